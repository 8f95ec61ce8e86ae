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

import java.util.UUID;

import static java.util.Objects.requireNonNull;

/**
 * Identifies a domain entity (typically an aggregate). The value is opaque to the event store, use
 * {@link StreamId#forEntity(String, EntityId)} to derive the id of the stream that holds the entity's events.
 *
 * @param value The identifier, cannot be blank.
 */
@NullMarked
public record EntityId(String value) {

    public EntityId {
        requireNonNull(value, EntityId.class.getSimpleName() + " cannot be null");
        if (value.isBlank()) {
            throw new IllegalArgumentException(EntityId.class.getSimpleName() + " cannot be blank");
        }
    }

    public static EntityId of(String value) {
        return new EntityId(value);
    }

    /**
     * @return A new {@link EntityId} based on a random {@link UUID}.
     */
    public static EntityId random() {
        return new EntityId(UUID.randomUUID().toString());
    }

    @Override
    public String toString() {
        return value;
    }
}
