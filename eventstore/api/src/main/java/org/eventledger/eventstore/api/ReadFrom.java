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

/**
 * The position a read starts from. The event at the position is included in the result.
 */
public sealed interface ReadFrom {

    /**
     * The first event of the stream (or of the global log)
     */
    static ReadFrom start() {
        return Start.INSTANCE;
    }

    /**
     * The last event of the stream (or of the global log), typically combined with {@link ReadDirection#BACKWARD}.
     */
    static ReadFrom end() {
        return End.INSTANCE;
    }

    /**
     * A specific position
     *
     * @throws InvalidRangeException if {@code position} is negative
     */
    static ReadFrom position(long position) {
        return new Position(position);
    }

    /**
     * Resolve this position given the position of the last event.
     *
     * @param lastPosition The position of the last event, {@code -1} if there are no events.
     * @return The resolved position, or {@code -1} if there is nothing to read.
     */
    long resolve(long lastPosition);

    final class Start implements ReadFrom {
        private static final Start INSTANCE = new Start();

        private Start() {
        }

        @Override
        public long resolve(long lastPosition) {
            return lastPosition < 0 ? -1 : 0;
        }

        @Override
        public String toString() {
            return "start";
        }
    }

    final class End implements ReadFrom {
        private static final End INSTANCE = new End();

        private End() {
        }

        @Override
        public long resolve(long lastPosition) {
            return lastPosition;
        }

        @Override
        public String toString() {
            return "end";
        }
    }

    record Position(long position) implements ReadFrom {
        public Position {
            if (position < 0) {
                throw new InvalidRangeException("Position cannot be negative but was " + position);
            }
        }

        @Override
        public long resolve(long lastPosition) {
            return position > lastPosition ? -1 : position;
        }
    }
}
