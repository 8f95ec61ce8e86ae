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

package org.eventledger.subscription.api;

/**
 * Specifies in which position a subscription should start when subscribing to it
 */
public sealed interface StartAt {

    /**
     * Replay every event in the scope before going live
     */
    static StartAt beginning() {
        return Position.BEGINNING;
    }

    /**
     * Start subscribing at this moment in time, i.e. only receive events committed after the subscription was created
     */
    static StartAt now() {
        return Now.INSTANCE;
    }

    /**
     * Start at the given position (inclusive) in the order of the subscription scope. To resume a subscription, pass the
     * position after the last event that was processed.
     */
    static StartAt position(long position) {
        return new Position(position);
    }

    default boolean isNow() {
        return this instanceof Now;
    }

    record Position(long position) implements StartAt {
        private static final Position BEGINNING = new Position(0);

        public Position {
            if (position < 0) {
                throw new IllegalArgumentException("Start position cannot be negative but was " + position);
            }
        }
    }

    final class Now implements StartAt {
        private static final Now INSTANCE = new Now();

        private Now() {
        }

        @Override
        public String toString() {
            return this.getClass().getSimpleName();
        }
    }
}
