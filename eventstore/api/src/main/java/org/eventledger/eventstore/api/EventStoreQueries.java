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

import org.eventledger.RecordedEvent;
import org.eventledger.StreamPosition;
import org.jspecify.annotations.NullMarked;

import java.util.List;

/**
 * Read operations of an event store. Reads never block on writers and never observe a partially committed append.
 * Reading a stream that doesn't exist, or from a position after the last event, returns an empty result.
 */
@NullMarked
public interface EventStoreQueries {

    /**
     * Read events from a stream.
     *
     * @param streamId  The id of the stream to read
     * @param direction {@link ReadDirection#FORWARD} for ascending stream positions, {@link ReadDirection#BACKWARD} for descending
     * @param from      The first position to read (inclusive)
     * @param maxCount  The maximum number of events to return, must be greater than or equal to {@code 1}
     * @return The events, possibly empty
     * @throws InvalidRangeException if {@code maxCount} is less than {@code 1}
     */
    List<RecordedEvent> readStream(String streamId, ReadDirection direction, ReadFrom from, int maxCount);

    /**
     * Read events from all streams in global order.
     *
     * @param direction {@link ReadDirection#FORWARD} for ascending global positions, {@link ReadDirection#BACKWARD} for descending
     * @param from      The first position to read (inclusive)
     * @param maxCount  The maximum number of events to return, must be greater than or equal to {@code 1}
     * @return The events, possibly empty
     * @throws InvalidRangeException if {@code maxCount} is less than {@code 1}
     */
    List<RecordedEvent> readAll(ReadDirection direction, ReadFrom from, int maxCount);

    /**
     * @return The position of the last event in the stream, or {@code -1} if the stream has never been written to.
     */
    long currentVersion(String streamId);

    /**
     * @return The global position of the last committed event, or {@code -1} if the store is empty.
     */
    long headPosition();

    /**
     * Read all events of a stream.
     *
     * @return An {@link EventStream} with version {@code -1} if the stream doesn't exist
     */
    EventStream readStream(String streamId);

    default boolean exists(String streamId) {
        return currentVersion(streamId) > StreamPosition.NO_STREAM;
    }

    default List<RecordedEvent> readStreamForwards(String streamId, long from, int maxCount) {
        return readStream(streamId, ReadDirection.FORWARD, ReadFrom.position(from), maxCount);
    }

    default List<RecordedEvent> readStreamBackwards(String streamId, long from, int maxCount) {
        return readStream(streamId, ReadDirection.BACKWARD, ReadFrom.position(from), maxCount);
    }

    default List<RecordedEvent> readAllForwards(long from, int maxCount) {
        return readAll(ReadDirection.FORWARD, ReadFrom.position(from), maxCount);
    }

    default List<RecordedEvent> readAllBackwards(long from, int maxCount) {
        return readAll(ReadDirection.BACKWARD, ReadFrom.position(from), maxCount);
    }
}
