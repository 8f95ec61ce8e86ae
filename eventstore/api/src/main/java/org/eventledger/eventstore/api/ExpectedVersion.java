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

import org.eventledger.StreamPosition;

/**
 * The version a stream is expected to have when appending events to it. If the expectation is not met the events are
 * not written and a {@link AppendResult.VersionConflict} is returned.
 */
public sealed interface ExpectedVersion {

    /**
     * Stream version doesn't matter, essentially the same as an unconditional write.
     */
    static ExpectedVersion any() {
        return Any.INSTANCE;
    }

    /**
     * The stream must not exist, i.e. no events have been written to it.
     */
    static ExpectedVersion noStream() {
        return Exactly.NO_STREAM;
    }

    /**
     * The stream must contain at least one event, regardless of its version.
     */
    static ExpectedVersion streamExists() {
        return StreamExists.INSTANCE;
    }

    /**
     * Stream version must be equal to the specified {@code version} in order for the events to be written.
     * {@code -1} means that the stream must not exist.
     */
    static ExpectedVersion exactly(long version) {
        return version == StreamPosition.NO_STREAM ? Exactly.NO_STREAM : new Exactly(version);
    }

    /**
     * @param currentVersion The current version of the stream, {@code -1} if it doesn't exist
     * @return {@code true} if a stream with the given version fulfills this expectation
     */
    boolean isSatisfiedBy(long currentVersion);

    default boolean isAny() {
        return this instanceof Any;
    }

    final class Any implements ExpectedVersion {
        private static final Any INSTANCE = new Any();

        private Any() {
        }

        @Override
        public boolean isSatisfiedBy(long currentVersion) {
            return true;
        }

        @Override
        public String toString() {
            return "any";
        }
    }

    final class StreamExists implements ExpectedVersion {
        private static final StreamExists INSTANCE = new StreamExists();

        private StreamExists() {
        }

        @Override
        public boolean isSatisfiedBy(long currentVersion) {
            return currentVersion > StreamPosition.NO_STREAM;
        }

        @Override
        public String toString() {
            return "stream exists";
        }
    }

    record Exactly(long version) implements ExpectedVersion {
        private static final Exactly NO_STREAM = new Exactly(StreamPosition.NO_STREAM);

        public Exactly {
            if (version < StreamPosition.NO_STREAM) {
                throw new IllegalArgumentException("Expected version cannot be less than " + StreamPosition.NO_STREAM + " but was " + version);
            }
        }

        @Override
        public boolean isSatisfiedBy(long currentVersion) {
            return version == currentVersion;
        }

        @Override
        public String toString() {
            return version == StreamPosition.NO_STREAM ? "no stream" : String.valueOf(version);
        }
    }
}
