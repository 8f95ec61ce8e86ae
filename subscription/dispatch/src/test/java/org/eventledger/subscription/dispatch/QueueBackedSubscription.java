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

package org.eventledger.subscription.dispatch;

import org.eventledger.RecordedEvent;
import org.eventledger.subscription.api.CloseReason;
import org.eventledger.subscription.api.Delivery;
import org.eventledger.subscription.api.Subscription;
import org.eventledger.subscription.api.SubscriptionScope;
import org.eventledger.subscription.api.SubscriptionState;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * A live-only {@link Subscription} whose events are offered by the test.
 */
class QueueBackedSubscription implements Subscription {
    private final String id = UUID.randomUUID().toString();
    private final LinkedBlockingQueue<Delivery> deliveries = new LinkedBlockingQueue<>();
    private final AtomicReference<CloseReason> closeReason = new AtomicReference<>();
    private volatile long lastDeliveredPosition = -1;

    void offer(RecordedEvent event) {
        deliveries.add(new Delivery.EventDelivered(event));
    }

    void closeWith(CloseReason reason) {
        if (closeReason.compareAndSet(null, reason)) {
            deliveries.clear();
            deliveries.add(new Delivery.SubscriptionClosed(reason));
        }
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public SubscriptionScope scope() {
        return SubscriptionScope.all();
    }

    @Override
    public SubscriptionState state() {
        return closeReason.get() == null ? SubscriptionState.LIVE : SubscriptionState.CLOSED;
    }

    @Override
    public Delivery next() throws InterruptedException {
        return track(deliveries.take());
    }

    @Override
    public Optional<Delivery> poll(Duration timeout) throws InterruptedException {
        return Optional.ofNullable(deliveries.poll(timeout.toNanos(), TimeUnit.NANOSECONDS)).map(this::track);
    }

    private Delivery track(Delivery delivery) {
        if (delivery instanceof Delivery.SubscriptionClosed) {
            // Closed is returned on every call
            deliveries.add(delivery);
        } else {
            lastDeliveredPosition = ((Delivery.EventDelivered) delivery).event().globalPosition();
        }
        return delivery;
    }

    @Override
    public long lastDeliveredPosition() {
        return lastDeliveredPosition;
    }

    @Override
    public Optional<CloseReason> closeReason() {
        return Optional.ofNullable(closeReason.get());
    }

    @Override
    public boolean awaitLive(Duration timeout) {
        return true;
    }

    @Override
    public void close() {
        closeWith(CloseReason.unsubscribed());
    }
}
