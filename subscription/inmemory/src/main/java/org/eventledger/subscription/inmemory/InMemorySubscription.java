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
import org.eventledger.eventstore.api.ReadDirection;
import org.eventledger.eventstore.api.ReadFrom;
import org.eventledger.subscription.api.CloseReason;
import org.eventledger.subscription.api.Delivery;
import org.eventledger.subscription.api.Delivery.EventDelivered;
import org.eventledger.subscription.api.Delivery.SubscriptionClosed;
import org.eventledger.subscription.api.Subscription;
import org.eventledger.subscription.api.SubscriptionScope;
import org.eventledger.subscription.api.SubscriptionState;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.List;
import java.util.Optional;
import java.util.StringJoiner;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

import static org.eventledger.subscription.api.SubscriptionState.CATCHING_UP;
import static org.eventledger.subscription.api.SubscriptionState.CLOSED;
import static org.eventledger.subscription.api.SubscriptionState.LIVE;

/**
 * An in-memory subscription. Historic events are read from the event store in batches on the consumer's thread, live events
 * are pushed by the {@link SubscriptionHub} into a bounded queue.
 */
class InMemorySubscription implements Subscription {
    private static final Logger log = LoggerFactory.getLogger(InMemorySubscription.class);

    private final String id;
    private final SubscriptionScope scope;
    private final long catchUpBoundary;
    private final long discardAtOrBelow;
    private final EventStoreQueries eventStoreQueries;
    private final int capacity;
    private final int catchUpBatchSize;
    private final Consumer<InMemorySubscription> onClose;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition eventAvailable = lock.newCondition();
    private final Condition stateChanged = lock.newCondition();
    private final ArrayDeque<RecordedEvent> liveEvents = new ArrayDeque<>();

    // Only touched by the consuming thread
    private final ArrayDeque<RecordedEvent> historicEvents = new ArrayDeque<>();
    private long nextHistoricPosition;

    private volatile SubscriptionState state;
    private volatile long lastDeliveredPosition;
    private volatile @Nullable CloseReason closeReason;

    InMemorySubscription(String id, SubscriptionScope scope, long startPosition, long catchUpBoundary, EventStoreQueries eventStoreQueries,
                         SubscriptionHubConfig config, Consumer<InMemorySubscription> onClose) {
        this.id = id;
        this.scope = scope;
        this.catchUpBoundary = catchUpBoundary;
        this.discardAtOrBelow = Math.max(catchUpBoundary, startPosition - 1);
        this.eventStoreQueries = eventStoreQueries;
        this.capacity = config.bufferCapacity;
        this.catchUpBatchSize = config.catchUpBatchSize;
        this.onClose = onClose;
        this.nextHistoricPosition = startPosition;
        this.lastDeliveredPosition = startPosition - 1;
        this.state = startPosition > catchUpBoundary ? LIVE : CATCHING_UP;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public SubscriptionScope scope() {
        return scope;
    }

    @Override
    public SubscriptionState state() {
        return state;
    }

    @Override
    public long lastDeliveredPosition() {
        return lastDeliveredPosition;
    }

    @Override
    public Optional<CloseReason> closeReason() {
        return Optional.ofNullable(closeReason);
    }

    @Override
    public Delivery next() throws InterruptedException {
        Delivery delivery;
        do {
            delivery = poll(Long.MAX_VALUE);
        } while (delivery == null);
        return delivery;
    }

    @Override
    public Optional<Delivery> poll(Duration timeout) throws InterruptedException {
        if (timeout == null) {
            throw new IllegalArgumentException("Timeout cannot be null");
        }
        return Optional.ofNullable(poll(toNanos(timeout)));
    }

    @Override
    public boolean awaitLive(Duration timeout) throws InterruptedException {
        long nanos = toNanos(timeout);
        lock.lockInterruptibly();
        try {
            while (state == CATCHING_UP) {
                if (nanos <= 0) {
                    return false;
                }
                nanos = stateChanged.awaitNanos(nanos);
            }
            return state == LIVE;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void close() {
        close(CloseReason.unsubscribed());
    }

    void close(CloseReason reason) {
        lock.lock();
        try {
            if (!state.canTransitionTo(CLOSED)) {
                return;
            }
            closeReason = reason;
            transitionTo(CLOSED);
            liveEvents.clear();
            eventAvailable.signalAll();
        } finally {
            lock.unlock();
        }
        log.debug("Subscription {} to {} closed: {}", id, scope, reason);
        onClose.accept(this);
    }

    boolean matches(RecordedEvent event) {
        return scope.includes(event);
    }

    /**
     * Called by the {@link SubscriptionHub} for each committed event in scope, in scope order. Never blocks.
     *
     * @return {@code false} if the subscription is closed (possibly by this call) and doesn't accept more events.
     */
    boolean eventAvailable(RecordedEvent event) {
        boolean overrun = false;
        lock.lock();
        try {
            if (state == CLOSED) {
                return false;
            } else if (scope.positionOf(event) <= discardAtOrBelow) {
                return true;
            } else if (liveEvents.size() >= capacity) {
                overrun = true;
            } else {
                liveEvents.addLast(event);
                eventAvailable.signal();
                return true;
            }
        } finally {
            lock.unlock();
        }

        if (overrun) {
            log.warn("Subscription {} to {} exceeded its buffer capacity of {} events and is closed, last delivered position was {}", id, scope, capacity, lastDeliveredPosition);
            close(CloseReason.overrun(id, capacity));
        }
        return false;
    }

    private @Nullable Delivery poll(long timeoutNanos) throws InterruptedException {
        if (state == CATCHING_UP) {
            RecordedEvent historic = nextHistoricEvent();
            if (historic != null) {
                return deliverIfOpen(historic);
            }
        }
        return nextLiveEvent(timeoutNanos);
    }

    private @Nullable RecordedEvent nextHistoricEvent() {
        if (historicEvents.isEmpty() && nextHistoricPosition <= catchUpBoundary) {
            int count = (int) Math.min(catchUpBatchSize, catchUpBoundary - nextHistoricPosition + 1);
            List<RecordedEvent> batch = readHistory(nextHistoricPosition, count);
            historicEvents.addAll(batch);
            nextHistoricPosition += batch.size();
            if (batch.isEmpty()) {
                // Nothing more can be read, e.g. the stream didn't contain the requested start position
                nextHistoricPosition = catchUpBoundary + 1;
            }
        }

        RecordedEvent event = historicEvents.pollFirst();
        if (historicEvents.isEmpty() && nextHistoricPosition > catchUpBoundary) {
            lock.lock();
            try {
                if (transitionTo(LIVE)) {
                    log.debug("Subscription {} to {} caught up to position {} and is live", id, scope, catchUpBoundary);
                }
            } finally {
                lock.unlock();
            }
        }
        return event;
    }

    private List<RecordedEvent> readHistory(long from, int count) {
        if (scope instanceof SubscriptionScope.Stream) {
            String streamId = ((SubscriptionScope.Stream) scope).streamId();
            return eventStoreQueries.readStream(streamId, ReadDirection.FORWARD, ReadFrom.position(from), count);
        }
        return eventStoreQueries.readAll(ReadDirection.FORWARD, ReadFrom.position(from), count);
    }

    private @Nullable Delivery nextLiveEvent(long timeoutNanos) throws InterruptedException {
        long nanos = timeoutNanos;
        lock.lockInterruptibly();
        try {
            while (liveEvents.isEmpty()) {
                if (state == CLOSED) {
                    return closed();
                } else if (nanos <= 0) {
                    return null;
                }
                nanos = eventAvailable.awaitNanos(nanos);
            }
            return deliver(liveEvents.pollFirst());
        } finally {
            lock.unlock();
        }
    }

    private Delivery deliverIfOpen(RecordedEvent event) {
        lock.lock();
        try {
            return state == CLOSED ? closed() : deliver(event);
        } finally {
            lock.unlock();
        }
    }

    // Must hold lock
    private Delivery deliver(RecordedEvent event) {
        lastDeliveredPosition = scope.positionOf(event);
        return new EventDelivered(event);
    }

    @SuppressWarnings("ConstantConditions")
    private Delivery closed() {
        return new SubscriptionClosed(closeReason);
    }

    // Must hold lock
    private boolean transitionTo(SubscriptionState next) {
        if (!state.canTransitionTo(next)) {
            return false;
        }
        state = next;
        stateChanged.signalAll();
        return true;
    }

    private static long toNanos(Duration duration) {
        try {
            return duration.toNanos();
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE;
        }
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", InMemorySubscription.class.getSimpleName() + "[", "]")
                .add("id='" + id + "'")
                .add("scope=" + scope)
                .add("state=" + state)
                .add("lastDeliveredPosition=" + lastDeliveredPosition)
                .add("closeReason=" + closeReason)
                .toString();
    }
}
