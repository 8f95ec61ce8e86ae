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

import static java.util.Objects.requireNonNull;

/**
 * The outcome of waiting for the next item of a {@link Subscription}.
 */
public sealed interface Delivery {

    record EventDelivered(RecordedEvent event) implements Delivery {
        public EventDelivered {
            requireNonNull(event, RecordedEvent.class.getSimpleName() + " cannot be null");
        }
    }

    record SubscriptionClosed(CloseReason reason) implements Delivery {
        public SubscriptionClosed {
            requireNonNull(reason, CloseReason.class.getSimpleName() + " cannot be null");
        }
    }
}
