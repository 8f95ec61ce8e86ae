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
import org.eventledger.subscription.dispatch.internal.ExecutorShutdown;
import org.jspecify.annotations.NullMarked;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Delivers the events of {@link Subscription}s to {@link Consumer}s on an {@link ExecutorService}, one thread per subscription.
 * If a consumer throws an exception the subscription is closed, resubscribe from {@link Subscription#lastDeliveredPosition()}
 * to continue after the failing event.
 */
@NullMarked
public class SubscriptionDispatcher {
    private static final Logger log = LoggerFactory.getLogger(SubscriptionDispatcher.class);

    private final ExecutorService executorService;
    private final ConcurrentMap<String, DispatchedSubscription> dispatched = new ConcurrentHashMap<>();
    private volatile boolean shutdown = false;

    /**
     * Create a new {@link SubscriptionDispatcher} with an unbounded cached thread pool.
     */
    public SubscriptionDispatcher() {
        this(Executors.newCachedThreadPool());
    }

    /**
     * @param executorService The {@link ExecutorService} that will run the consumers. It's shutdown by {@link #shutdown()}.
     */
    public SubscriptionDispatcher(ExecutorService executorService) {
        if (executorService == null) {
            throw new IllegalArgumentException(ExecutorService.class.getSimpleName() + " cannot be null");
        }
        this.executorService = executorService;
    }

    /**
     * Start delivering the events of the {@code subscription} to {@code action}.
     *
     * @param subscription The subscription, owned by the dispatcher from now on
     * @param action       Invoked for each event, in order
     * @return A {@link DispatchedSubscription} that can be used to wait for the consumer to start or stop
     */
    public DispatchedSubscription dispatch(Subscription subscription, Consumer<RecordedEvent> action) {
        return dispatch(subscription, action, __ -> {
        });
    }

    /**
     * Start delivering the events of the {@code subscription} to {@code action}.
     *
     * @param subscription The subscription, owned by the dispatcher from now on
     * @param action       Invoked for each event, in order
     * @param onClose      Invoked once with the reason when the subscription is closed
     */
    public synchronized DispatchedSubscription dispatch(Subscription subscription, Consumer<RecordedEvent> action, Consumer<CloseReason> onClose) {
        if (shutdown) {
            throw new IllegalStateException("Cannot dispatch when shutdown");
        } else if (subscription == null) {
            throw new IllegalArgumentException(Subscription.class.getSimpleName() + " cannot be null");
        } else if (action == null) {
            throw new IllegalArgumentException("action cannot be null");
        } else if (onClose == null) {
            throw new IllegalArgumentException("onClose cannot be null");
        } else if (dispatched.containsKey(subscription.id())) {
            throw new IllegalArgumentException("Subscription " + subscription.id() + " is already dispatched.");
        }

        DispatchedSubscription dispatchedSubscription = new DispatchedSubscription(subscription, action, onClose);
        dispatched.put(subscription.id(), dispatchedSubscription);
        executorService.execute(dispatchedSubscription);
        return dispatchedSubscription;
    }

    /**
     * @return {@code true} if the subscription with the given id is currently being dispatched
     */
    public boolean isDispatching(String subscriptionId) {
        return dispatched.containsKey(subscriptionId);
    }

    /**
     * Close all dispatched subscriptions and shutdown the {@link ExecutorService}.
     */
    public void shutdown() {
        List<DispatchedSubscription> subscriptions;
        synchronized (this) {
            shutdown = true;
            subscriptions = new ArrayList<>(dispatched.values());
        }
        subscriptions.forEach(dispatchedSubscription -> dispatchedSubscription.subscription.close());
        ExecutorShutdown.shutdownSafely(executorService, 5, TimeUnit.SECONDS);
    }

    public class DispatchedSubscription implements Runnable {
        private final Subscription subscription;
        private final Consumer<RecordedEvent> action;
        private final Consumer<CloseReason> onClose;
        private final CountDownLatch started = new CountDownLatch(1);
        private final CountDownLatch stopped = new CountDownLatch(1);

        private DispatchedSubscription(Subscription subscription, Consumer<RecordedEvent> action, Consumer<CloseReason> onClose) {
            this.subscription = subscription;
            this.action = action;
            this.onClose = onClose;
        }

        public Subscription subscription() {
            return subscription;
        }

        /**
         * Blocks until the consumer thread has started
         */
        public boolean waitUntilStarted(long timeout, TimeUnit unit) throws InterruptedException {
            return started.await(timeout, unit);
        }

        /**
         * Blocks until the consumer thread has stopped, i.e. the subscription was closed and {@code onClose} has been called.
         */
        public boolean waitUntilStopped(long timeout, TimeUnit unit) throws InterruptedException {
            return stopped.await(timeout, unit);
        }

        @Override
        public void run() {
            started.countDown();
            try {
                CloseReason reason = deliverUntilClosed();
                notifyClosed(reason);
            } finally {
                dispatched.remove(subscription.id());
                stopped.countDown();
            }
        }

        private CloseReason deliverUntilClosed() {
            while (true) {
                final Delivery delivery;
                try {
                    delivery = subscription.next();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    subscription.close();
                    return subscription.closeReason().orElse(CloseReason.unsubscribed());
                }

                if (delivery instanceof Delivery.SubscriptionClosed) {
                    return ((Delivery.SubscriptionClosed) delivery).reason();
                }

                RecordedEvent event = ((Delivery.EventDelivered) delivery).event();
                try {
                    action.accept(event);
                } catch (RuntimeException e) {
                    log.error("Subscription {} failed to process event {} at global position {}, closing subscription.", subscription.id(), event.eventId(), event.globalPosition(), e);
                    subscription.close();
                    return subscription.closeReason().orElse(CloseReason.unsubscribed());
                }
            }
        }

        private void notifyClosed(CloseReason reason) {
            try {
                onClose.accept(reason);
            } catch (RuntimeException e) {
                log.error("onClose callback for subscription {} failed", subscription.id(), e);
            }
        }
    }
}
