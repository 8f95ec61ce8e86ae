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

import java.util.Arrays;
import java.util.Objects;
import java.util.StringJoiner;

import static java.util.Objects.requireNonNull;

/**
 * An event that is about to be appended to a stream. The payload and metadata are opaque to the event store,
 * encoding them is left to the caller.
 */
@NullMarked
public final class EventData {
    private static final byte[] EMPTY = new byte[0];

    private final String type;
    private final byte[] payload;
    private final byte[] metadata;

    private EventData(String type, byte[] payload, byte[] metadata) {
        requireNonNull(type, "Event type cannot be null");
        requireNonNull(payload, "Payload cannot be null");
        requireNonNull(metadata, "Metadata cannot be null");
        if (type.isBlank()) {
            throw new IllegalArgumentException("Event type cannot be blank");
        }
        this.type = type;
        this.payload = payload.clone();
        this.metadata = metadata.clone();
    }

    public static EventData of(String type, byte[] payload, byte[] metadata) {
        return new EventData(type, payload, metadata);
    }

    public static EventData of(String type, byte[] payload) {
        return new EventData(type, payload, EMPTY);
    }

    public String type() {
        return type;
    }

    public byte[] payload() {
        return payload.clone();
    }

    public byte[] metadata() {
        return metadata.clone();
    }

    // Not copied, callers must not modify or leak the arrays
    byte[] payloadBytes() {
        return payload;
    }

    byte[] metadataBytes() {
        return metadata;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EventData)) return false;
        EventData that = (EventData) o;
        return type.equals(that.type) && Arrays.equals(payload, that.payload) && Arrays.equals(metadata, that.metadata);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(type);
        result = 31 * result + Arrays.hashCode(payload);
        result = 31 * result + Arrays.hashCode(metadata);
        return result;
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", EventData.class.getSimpleName() + "[", "]")
                .add("type='" + type + "'")
                .add("payload=" + payload.length + " bytes")
                .add("metadata=" + metadata.length + " bytes")
                .toString();
    }
}
