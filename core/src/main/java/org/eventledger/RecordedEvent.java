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

import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;
import java.util.StringJoiner;
import java.util.UUID;

import static java.util.Objects.requireNonNull;

/**
 * An event that has been committed to the event store. Recorded events are immutable, they carry both the position
 * within their stream and the position in the global log.
 */
@NullMarked
public final class RecordedEvent {
    private final UUID eventId;
    private final String streamId;
    private final long streamPosition;
    private final long globalPosition;
    private final String type;
    private final byte[] payload;
    private final byte[] metadata;
    private final Instant timestamp;

    public RecordedEvent(UUID eventId, String streamId, long streamPosition, long globalPosition, String type, byte[] payload, byte[] metadata, Instant timestamp) {
        this(eventId, streamId, streamPosition, globalPosition, timestamp, type,
                requireNonNull(payload, "Payload cannot be null").clone(), requireNonNull(metadata, "Metadata cannot be null").clone());
    }

    // Takes ownership of the byte arrays
    private RecordedEvent(UUID eventId, String streamId, long streamPosition, long globalPosition, Instant timestamp, String type, byte[] payload, byte[] metadata) {
        requireNonNull(eventId, "Event id cannot be null");
        requireNonNull(streamId, "Stream id cannot be null");
        requireNonNull(type, "Event type cannot be null");
        requireNonNull(timestamp, "Timestamp cannot be null");
        if (!StreamPosition.isValid(streamPosition)) {
            throw new IllegalArgumentException("Stream position cannot be negative but was " + streamPosition);
        } else if (!GlobalPosition.isValid(globalPosition)) {
            throw new IllegalArgumentException("Global position cannot be negative but was " + globalPosition);
        }
        this.eventId = eventId;
        this.streamId = streamId;
        this.streamPosition = streamPosition;
        this.globalPosition = globalPosition;
        this.type = type;
        this.payload = payload;
        this.metadata = metadata;
        this.timestamp = timestamp;
    }

    /**
     * Create a {@link RecordedEvent} from the supplied {@link EventData}. The byte arrays aren't copied, they're shared with the
     * {@link EventData} which never exposes them either.
     */
    public static RecordedEvent record(UUID eventId, String streamId, long streamPosition, long globalPosition, EventData eventData, Instant timestamp) {
        requireNonNull(eventData, EventData.class.getSimpleName() + " cannot be null");
        return new RecordedEvent(eventId, streamId, streamPosition, globalPosition, timestamp, eventData.type(), eventData.payloadBytes(), eventData.metadataBytes());
    }

    public UUID eventId() {
        return eventId;
    }

    public String streamId() {
        return streamId;
    }

    public long streamPosition() {
        return streamPosition;
    }

    public long globalPosition() {
        return globalPosition;
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

    public Instant timestamp() {
        return timestamp;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RecordedEvent)) return false;
        RecordedEvent that = (RecordedEvent) o;
        return streamPosition == that.streamPosition && globalPosition == that.globalPosition
                && eventId.equals(that.eventId) && streamId.equals(that.streamId) && type.equals(that.type)
                && Arrays.equals(payload, that.payload) && Arrays.equals(metadata, that.metadata)
                && timestamp.equals(that.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(eventId, streamId, streamPosition, globalPosition);
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", RecordedEvent.class.getSimpleName() + "[", "]")
                .add("eventId=" + eventId)
                .add("streamId='" + streamId + "'")
                .add("streamPosition=" + streamPosition)
                .add("globalPosition=" + globalPosition)
                .add("type='" + type + "'")
                .add("timestamp=" + timestamp)
                .toString();
    }
}
