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

package org.eventledger.eventstore.api;

import org.eventledger.EventData;
import org.eventledger.StreamId;
import org.eventledger.StreamPosition;
import org.eventledger.subscription.api.Subscribable;
import org.jspecify.annotations.NullMarked;

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * An event store: an append-only log of events, organized in streams. Every committed event has a gap-free position
 * within its stream and a gap-free position in the global log that reflects the order in which events were committed.
 * <p>
 * Implementations are free to choose how events are stored, but they must all satisfy the same contract, i.e. appends
 * guarded by {@link ExpectedVersion}, lock-free reads of fully committed state and subscriptions that never drop,
 * duplicate or reorder events.
 */
@NullMarked
public interface EventStore extends EventStoreQueries, Subscribable, AutoCloseable {

    /**
     * The version of a stream that doesn't exist
     */
    long EMPTY_STREAM_VERSION = StreamPosition.NO_STREAM;

    /**
     * Conditionally append events to a stream. All events are committed atomically, and they receive contiguous
     * global positions, no event from another stream is interleaved with them.
     *
     * @param streamId        The id of the stream
     * @param expectedVersion The expected version of the stream
     * @param events          The events to append, in order. An empty list only validates the {@code expectedVersion}.
     * @return {@link AppendResult.Appended} if the events were committed, {@link AppendResult.VersionConflict} if the stream didn't have the expected version.
     */
    AppendResult append(String streamId, ExpectedVersion expectedVersion, List<EventData> events);

    /**
     * Append events to a stream regardless of its version.
     */
    default AppendResult append(String streamId, List<EventData> events) {
        return append(streamId, ExpectedVersion.any(), events);
    }

    default AppendResult append(StreamId streamId, ExpectedVersion expectedVersion, List<EventData> events) {
        requireNonNull(streamId, StreamId.class.getSimpleName() + " cannot be null");
        return append(streamId.value(), expectedVersion, events);
    }

    /**
     * Release the resources held by the event store and close all subscriptions.
     */
    @Override
    void close();
}
