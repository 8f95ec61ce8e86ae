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

public interface Subscribable {

    /**
     * Start a subscription. Historic events in the {@code scope} are replayed from {@code startAt} before the subscription
     * switches to events committed after it was created.
     *
     * @param scope   Which events to receive
     * @param startAt The position to start the subscription from
     * @return A {@link Subscription} owned by the caller, close it to unsubscribe.
     */
    Subscription subscribe(SubscriptionScope scope, StartAt startAt);

    /**
     * Subscribe to every event in the store, in global order.
     */
    default Subscription subscribeAll(StartAt startAt) {
        return subscribe(SubscriptionScope.all(), startAt);
    }

    /**
     * Subscribe to the events of a single stream, in stream order.
     */
    default Subscription subscribeStream(String streamId, StartAt startAt) {
        return subscribe(SubscriptionScope.stream(streamId), startAt);
    }
}
