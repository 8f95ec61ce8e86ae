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

import org.eventledger.RecordedEvent;
import org.eventledger.StreamId;

import static java.util.Objects.requireNonNull;

/**
 * Which events a subscription receives, and thus in which order.
 */
public sealed interface SubscriptionScope {

    /**
     * Subscribe to every event in the store, in global order.
     */
    static SubscriptionScope all() {
        return All.INSTANCE;
    }

    /**
     * Subscribe to the events of a single stream, in stream order.
     */
    static SubscriptionScope stream(String streamId) {
        return new Stream(streamId);
    }

    static SubscriptionScope stream(StreamId streamId) {
        requireNonNull(streamId, StreamId.class.getSimpleName() + " cannot be null");
        return new Stream(streamId.value());
    }

    /**
     * @return {@code true} if the event belongs to this scope
     */
    boolean includes(RecordedEvent event);

    /**
     * @return The position of the event in the order of this scope
     */
    long positionOf(RecordedEvent event);

    record Stream(String streamId) implements SubscriptionScope {
        public Stream {
            requireNonNull(streamId, "Stream id cannot be null");
            if (streamId.isBlank()) {
                throw new IllegalArgumentException("Stream id cannot be blank");
            }
        }

        @Override
        public boolean includes(RecordedEvent event) {
            return streamId.equals(event.streamId());
        }

        @Override
        public long positionOf(RecordedEvent event) {
            return event.streamPosition();
        }

        @Override
        public String toString() {
            return "stream:" + streamId;
        }
    }

    final class All implements SubscriptionScope {
        private static final All INSTANCE = new All();

        private All() {
        }

        @Override
        public boolean includes(RecordedEvent event) {
            return true;
        }

        @Override
        public long positionOf(RecordedEvent event) {
            return event.globalPosition();
        }

        @Override
        public String toString() {
            return "all";
        }
    }
}
