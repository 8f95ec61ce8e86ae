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
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.notNullValue;

@Timeout(10)
@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class SubscriptionDispatcherTest {

    private SubscriptionDispatcher dispatcher;

    @BeforeEach
    void create_dispatcher() {
        dispatcher = new SubscriptionDispatcher(Executors.newCachedThreadPool());
    }

    @AfterEach
    void shutdown_dispatcher() {
        dispatcher.shutdown();
    }

    @Nested
    class Dispatch {

        @Test
        void delivers_events_to_the_consumer_in_order() {
            // Given
            QueueBackedSubscription subscription = new QueueBackedSubscription();
            List<RecordedEvent> received = new CopyOnWriteArrayList<>();
            dispatcher.dispatch(subscription, received::add);

            // When
            subscription.offer(event(0));
            subscription.offer(event(1));
            subscription.offer(event(2));

            // Then
            await().until(received::size, is(3));
            assertThat(received).extracting(RecordedEvent::globalPosition).containsExactly(0L, 1L, 2L);
        }

        @Test
        void consumer_that_throws_closes_the_subscription() throws InterruptedException {
            // Given
            QueueBackedSubscription subscription = new QueueBackedSubscription();
            List<RecordedEvent> received = new CopyOnWriteArrayList<>();
            AtomicReference<CloseReason> closeReason = new AtomicReference<>();
            SubscriptionDispatcher.DispatchedSubscription dispatched = dispatcher.dispatch(subscription, event -> {
                if (event.globalPosition() == 1) {
                    throw new IllegalStateException("expected");
                }
                received.add(event);
            }, closeReason::set);

            // When
            subscription.offer(event(0));
            subscription.offer(event(1));
            subscription.offer(event(2));

            // Then
            assertThat(dispatched.waitUntilStopped(5, TimeUnit.SECONDS)).isTrue();
            assertThat(received).extracting(RecordedEvent::globalPosition).containsExactly(0L);
            assertThat(subscription.isClosed()).isTrue();
            assertThat(subscription.lastDeliveredPosition()).isEqualTo(1L);
            assertThat(closeReason.get()).isEqualTo(CloseReason.unsubscribed());
            assertThat(dispatcher.isDispatching(subscription.id())).isFalse();
        }

        @Test
        void close_callback_receives_the_close_reason() {
            // Given
            QueueBackedSubscription subscription = new QueueBackedSubscription();
            AtomicReference<CloseReason> closeReason = new AtomicReference<>();
            dispatcher.dispatch(subscription, __ -> {
            }, closeReason::set);

            // When
            subscription.closeWith(CloseReason.overrun(subscription.id(), 16));

            // Then
            await().untilAtomic(closeReason, notNullValue());
            assertThat(closeReason.get()).isEqualTo(CloseReason.overrun(subscription.id(), 16));
        }

        @Test
        void cannot_dispatch_the_same_subscription_twice() {
            QueueBackedSubscription subscription = new QueueBackedSubscription();
            dispatcher.dispatch(subscription, __ -> {
            });

            assertThatThrownBy(() -> dispatcher.dispatch(subscription, __ -> {
            }))
                    .isExactlyInstanceOf(IllegalArgumentException.class)
                    .hasMessage("Subscription " + subscription.id() + " is already dispatched.");
        }
    }

    @Nested
    class Shutdown {

        @Test
        void closes_all_dispatched_subscriptions() throws InterruptedException {
            // Given
            QueueBackedSubscription subscription1 = new QueueBackedSubscription();
            QueueBackedSubscription subscription2 = new QueueBackedSubscription();
            SubscriptionDispatcher.DispatchedSubscription dispatched1 = dispatcher.dispatch(subscription1, __ -> {
            });
            SubscriptionDispatcher.DispatchedSubscription dispatched2 = dispatcher.dispatch(subscription2, __ -> {
            });
            dispatched1.waitUntilStarted(5, TimeUnit.SECONDS);
            dispatched2.waitUntilStarted(5, TimeUnit.SECONDS);

            // When
            dispatcher.shutdown();

            // Then
            assertThat(subscription1.isClosed()).isTrue();
            assertThat(subscription2.isClosed()).isTrue();
            assertThat(dispatched1.waitUntilStopped(5, TimeUnit.SECONDS)).isTrue();
            assertThat(dispatched2.waitUntilStopped(5, TimeUnit.SECONDS)).isTrue();
        }

        @Test
        void cannot_dispatch_after_shutdown() {
            dispatcher.shutdown();

            assertThatThrownBy(() -> dispatcher.dispatch(new QueueBackedSubscription(), __ -> {
            }))
                    .isExactlyInstanceOf(IllegalStateException.class)
                    .hasMessage("Cannot dispatch when shutdown");
        }
    }

    private static RecordedEvent event(long globalPosition) {
        return new RecordedEvent(UUID.randomUUID(), "stream", globalPosition, globalPosition, "Something", new byte[0], new byte[0], Instant.now());
    }
}
