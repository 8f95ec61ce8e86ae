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

import org.eventledger.GlobalPosition;
import org.eventledger.StreamPosition;

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * The result of appending events to a stream. Either the events were {@link Appended appended} or the
 * {@link ExpectedVersion} was not fulfilled and the store was left untouched ({@link VersionConflict}).
 */
public sealed interface AppendResult {

    String streamId();

    default boolean isSuccess() {
        return this instanceof Appended;
    }

    /**
     * @return The {@link Appended} result
     * @throws VersionConflictException if this is a {@link VersionConflict}
     */
    Appended orElseThrow();

    /**
     * The events were committed.
     *
     * @param streamId            The stream that was appended to
     * @param streamPositions     The positions assigned to the events, in the order they were supplied. Empty if no events were supplied.
     * @param nextExpectedVersion The version of the stream after the append, pass this as {@link ExpectedVersion#exactly(long)} on the next append.
     * @param lastGlobalPosition  The global position of the last appended event, {@code -1} if no events were appended.
     */
    record Appended(String streamId, List<Long> streamPositions, long nextExpectedVersion, long lastGlobalPosition) implements AppendResult {
        public Appended {
            requireNonNull(streamId, "Stream id cannot be null");
            requireNonNull(streamPositions, "Stream positions cannot be null");
            streamPositions = List.copyOf(streamPositions);
            if (nextExpectedVersion < StreamPosition.NO_STREAM) {
                throw new IllegalArgumentException("Stream version cannot be less than " + StreamPosition.NO_STREAM);
            } else if (lastGlobalPosition < GlobalPosition.NONE) {
                throw new IllegalArgumentException("Global position cannot be less than " + GlobalPosition.NONE);
            }
        }

        @Override
        public Appended orElseThrow() {
            return this;
        }
    }

    /**
     * The stream didn't have the expected version. Reread the stream and retry with a fresh expectation.
     *
     * @param streamId The stream that was appended to
     * @param expected The expectation supplied by the caller
     * @param actual   The actual version of the stream, {@code -1} if it doesn't exist
     */
    record VersionConflict(String streamId, ExpectedVersion expected, long actual) implements AppendResult {
        public VersionConflict {
            requireNonNull(streamId, "Stream id cannot be null");
            requireNonNull(expected, ExpectedVersion.class.getSimpleName() + " cannot be null");
        }

        @Override
        public Appended orElseThrow() {
            throw new VersionConflictException(this);
        }
    }
}
