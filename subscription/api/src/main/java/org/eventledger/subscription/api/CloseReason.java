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

import static java.util.Objects.requireNonNull;

/**
 * Why a {@link Subscription} was closed.
 */
public sealed interface CloseReason {

    static CloseReason unsubscribed() {
        return Unsubscribed.INSTANCE;
    }

    static CloseReason storeShutdown() {
        return StoreShutdown.INSTANCE;
    }

    static CloseReason overrun(String subscriptionId, int capacity) {
        return new SubscriptionOverrun(subscriptionId, capacity);
    }

    /**
     * The subscriber closed the subscription.
     */
    final class Unsubscribed implements CloseReason {
        private static final Unsubscribed INSTANCE = new Unsubscribed();

        private Unsubscribed() {
        }

        @Override
        public String toString() {
            return this.getClass().getSimpleName();
        }
    }

    /**
     * The event store was shutdown.
     */
    final class StoreShutdown implements CloseReason {
        private static final StoreShutdown INSTANCE = new StoreShutdown();

        private StoreShutdown() {
        }

        @Override
        public String toString() {
            return this.getClass().getSimpleName();
        }
    }

    /**
     * The subscriber fell further behind than its buffer allows. Events that were queued but not yet delivered are discarded,
     * resubscribe from {@link Subscription#lastDeliveredPosition()} + 1 to continue.
     *
     * @param subscriptionId The id of the subscription that was closed
     * @param capacity       The size of the delivery buffer that was exceeded
     */
    record SubscriptionOverrun(String subscriptionId, int capacity) implements CloseReason {
        public SubscriptionOverrun {
            requireNonNull(subscriptionId, "Subscription id cannot be null");
        }
    }
}
