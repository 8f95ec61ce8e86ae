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

import org.jspecify.annotations.NullMarked;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.Optional;

/**
 * A handle to a subscription. Events are first replayed from the requested {@link StartAt} position
 * ({@link SubscriptionState#CATCHING_UP}) and then delivered as they are committed ({@link SubscriptionState#LIVE}).
 * Events are delivered in the order of the subscription's {@link SubscriptionScope}, exactly once.
 * <p>
 * A subscription is meant to be consumed by one thread at a time. {@link #close()} may be called from any thread.
 */
@NullMarked
public interface Subscription extends AutoCloseable {

    /**
     * @return The id of the subscription
     */
    String id();

    SubscriptionScope scope();

    SubscriptionState state();

    /**
     * Synchronous, <strong>blocking</strong> call that returns the next {@link Delivery}. Once the subscription is closed,
     * {@link Delivery.SubscriptionClosed} is returned, on every call.
     *
     * @throws InterruptedException If the calling thread is interrupted while waiting
     */
    Delivery next() throws InterruptedException;

    /**
     * Like {@link #next()} but gives up after {@code timeout}.
     *
     * @return The next {@link Delivery} or {@link Optional#empty()} if nothing was available within the timeout
     * @throws InterruptedException If the calling thread is interrupted while waiting
     */
    Optional<Delivery> poll(Duration timeout) throws InterruptedException;

    /**
     * @return The position, in the order of the {@link #scope()}, of the last event returned to the consumer or {@code -1} if none.
     */
    long lastDeliveredPosition();

    /**
     * @return The reason the subscription was closed, or {@link Optional#empty()} if it's still open.
     */
    Optional<CloseReason> closeReason();

    /**
     * Synchronous, <strong>blocking</strong> call that returns once the subscription has replayed all historic events
     * and is receiving live events, or it's closed.
     */
    default void awaitLive() throws InterruptedException {
        awaitLive(ChronoUnit.FOREVER.getDuration());
    }

    /**
     * @return {@code true} if the subscription went live within the given {@code timeout}, {@code false} otherwise.
     */
    boolean awaitLive(Duration timeout) throws InterruptedException;

    /**
     * Unsubscribe. Delivery stops immediately and a consumer waiting in {@link #next()} is woken up.
     * Calling this method more than once has no effect.
     */
    @Override
    void close();

    default boolean isClosed() {
        return state() == SubscriptionState.CLOSED;
    }
}
