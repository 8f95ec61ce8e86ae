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

package org.eventledger.subscription.inmemory;

import org.eventledger.RecordedEvent;
import org.eventledger.eventstore.api.EventStoreQueries;
import org.eventledger.subscription.api.CloseReason;
import org.eventledger.subscription.api.StartAt;
import org.eventledger.subscription.api.Subscribable;
import org.eventledger.subscription.api.Subscription;
import org.eventledger.subscription.api.SubscriptionScope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Fans out committed events to in-memory subscriptions. The event store calls {@link #publish(List)} for every commit,
 * in commit order, and each matching subscription gets the events enqueued in its bounded buffer. Publishing never blocks,
 * a subscription whose buffer is full is closed with a {@link CloseReason.SubscriptionOverrun}.
 * <p>
 * When subscribing, the head of the scope is captured as the catch-up boundary while holding the same monitor that
 * {@link #publish(List)} holds. A commit is therefore either part of the history replayed from the {@link EventStoreQueries}
 * or published to the new subscription afterwards. Live events at or below the boundary are discarded by the subscription.
 */
public class SubscriptionHub implements Subscribable {
    private static final Logger log = LoggerFactory.getLogger(SubscriptionHub.class);

    private final EventStoreQueries eventStoreQueries;
    private final SubscriptionHubConfig config;
    private final ConcurrentMap<String, InMemorySubscription> subscriptions = new ConcurrentHashMap<>();

    private volatile boolean shutdown = false;

    public SubscriptionHub(EventStoreQueries eventStoreQueries) {
        this(eventStoreQueries, new SubscriptionHubConfig());
    }

    /**
     * Create an instance of {@link SubscriptionHub} with the given parameters
     *
     * @param eventStoreQueries The read API used to replay historic events while a subscription is catching up
     * @param config            The configuration
     */
    public SubscriptionHub(EventStoreQueries eventStoreQueries, SubscriptionHubConfig config) {
        if (eventStoreQueries == null) {
            throw new IllegalArgumentException(EventStoreQueries.class.getSimpleName() + " cannot be null");
        } else if (config == null) {
            throw new IllegalArgumentException(SubscriptionHubConfig.class.getSimpleName() + " cannot be null");
        }
        this.eventStoreQueries = eventStoreQueries;
        this.config = config;
    }

    @Override
    public synchronized Subscription subscribe(SubscriptionScope scope, StartAt startAt) {
        if (shutdown) {
            throw new IllegalStateException("Cannot subscribe when shutdown");
        } else if (scope == null) {
            throw new IllegalArgumentException(SubscriptionScope.class.getSimpleName() + " cannot be null");
        } else if (startAt == null) {
            throw new IllegalArgumentException(StartAt.class.getSimpleName() + " cannot be null");
        }

        long boundary = headOf(scope);
        long from = startAt.isNow() ? boundary + 1 : ((StartAt.Position) startAt).position();
        String subscriptionId = UUID.randomUUID().toString();
        InMemorySubscription subscription = new InMemorySubscription(subscriptionId, scope, from, boundary, eventStoreQueries, config, this::remove);
        subscriptions.put(subscriptionId, subscription);
        log.debug("Subscription {} to {} starts at {}, catching up to {}", subscriptionId, scope, from, boundary);
        return subscription;
    }

    /**
     * Enqueue committed events to all matching subscriptions. Must be called in commit order and the events must be in commit order.
     */
    public synchronized void publish(List<RecordedEvent> events) {
        Objects.requireNonNull(events, "Events cannot be null");
        if (shutdown || events.isEmpty()) {
            return;
        }
        subscriptions.values().forEach(subscription -> {
            for (RecordedEvent event : events) {
                if (subscription.matches(event) && !subscription.eventAvailable(event)) {
                    break;
                }
            }
        });
    }

    /**
     * Close all subscriptions with {@link CloseReason#storeShutdown()}. New subscriptions are rejected afterwards.
     */
    public synchronized void shutdown() {
        if (shutdown) {
            return;
        }
        shutdown = true;
        List<InMemorySubscription> open = new ArrayList<>(subscriptions.values());
        open.forEach(subscription -> subscription.close(CloseReason.storeShutdown()));
        subscriptions.clear();
        log.debug("Subscription hub shutdown, closed {} subscription(s)", open.size());
    }

    public boolean isShutdown() {
        return shutdown;
    }

    /**
     * @return The number of subscriptions that are not closed
     */
    public int activeSubscriptions() {
        return subscriptions.size();
    }

    private long headOf(SubscriptionScope scope) {
        if (scope instanceof SubscriptionScope.Stream) {
            return eventStoreQueries.currentVersion(((SubscriptionScope.Stream) scope).streamId());
        }
        return eventStoreQueries.headPosition();
    }

    private void remove(InMemorySubscription subscription) {
        subscriptions.remove(subscription.id());
    }
}
