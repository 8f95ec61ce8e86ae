/*
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *        http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.eventledger;

import org.jspecify.annotations.NullMarked;

import static java.util.Objects.requireNonNull;

/**
 * The id of an event stream, i.e. the ordered sequence of events that belongs to one entity.
 *
 * @param value The stream id, cannot be blank.
 */
@NullMarked
public record StreamId(String value) {
    static final char ENTITY_TYPE_SEPARATOR = '-';

    public StreamId {
        requireNonNull(value, StreamId.class.getSimpleName() + " cannot be null");
        if (value.isBlank()) {
            throw new IllegalArgumentException(StreamId.class.getSimpleName() + " cannot be blank");
        }
    }

    public static StreamId of(String value) {
        return new StreamId(value);
    }

    /**
     * Derive the stream id of an entity. The result is {@code <entityType>-<entityId>}, for example {@code cart-1}
     * for entity type {@code cart} and entity id {@code 1}. The same input always yields the same stream id.
     *
     * @param entityType The type of the entity, cannot be blank or contain {@value #ENTITY_TYPE_SEPARATOR}.
     * @param entityId   The id of the entity
     * @return The {@link StreamId} of the entity
     */
    public static StreamId forEntity(String entityType, EntityId entityId) {
        requireNonNull(entityType, "Entity type cannot be null");
        requireNonNull(entityId, EntityId.class.getSimpleName() + " cannot be null");
        if (entityType.isBlank()) {
            throw new IllegalArgumentException("Entity type cannot be blank");
        } else if (entityType.indexOf(ENTITY_TYPE_SEPARATOR) >= 0) {
            throw new IllegalArgumentException("Entity type cannot contain '" + ENTITY_TYPE_SEPARATOR + "' but was \"" + entityType + "\"");
        }
        return new StreamId(entityType + ENTITY_TYPE_SEPARATOR + entityId.value());
    }

    @Override
    public String toString() {
        return value;
    }
}
