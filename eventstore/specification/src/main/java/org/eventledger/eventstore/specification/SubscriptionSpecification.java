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

package org.eventledger.eventstore.specification;

import org.eventledger.RecordedEvent;
import org.eventledger.eventstore.api.AppendResult;
import org.eventledger.eventstore.api.ExpectedVersion;
import org.eventledger.eventstore.api.ReadDirection;
import org.eventledger.eventstore.api.ReadFrom;
import org.eventledger.subscription.api.CloseReason;
import org.eventledger.subscription.api.Delivery;
import org.eventledger.subscription.api.StartAt;
import org.eventledger.subscription.api.Subscription;
import org.eventledger.subscription.api.SubscriptionState;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.eventledger.eventstore.specification.SimpleSubscriptionSpecification.take;
import static org.eventledger.eventstore.specification.TestEvents.append;
import static org.eventledger.eventstore.specification.TestEvents.appendOneByOne;
import static org.eventledger.eventstore.specification.TestEvents.events;
import static org.eventledger.eventstore.specification.TestEvents.globalPositionsOf;
import static org.eventledger.eventstore.specification.TestEvents.positions;
import static org.eventledger.eventstore.specification.TestEvents.streamPositionsOf;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertAll;

/**
 * Catch-up, overrun and cancellation of subscriptions. The event store under test is expected to use a subscription buffer
 * of at least 1 000 and less than 10 000 events.
 */
@Timeout(30)
@DisplayNameGeneration(ReplaceUnderscores.class)
public abstract class SubscriptionSpecification extends EventStoreSpecification {

    @Nested
    class CatchUp {

        @Test
        void subscribing_from_the_beginning_replays_history_and_then_goes_live() throws InterruptedException {
            // Given
            append(eventStore, "a", events("a", 3));
            append(eventStore, "b", events("b", 2));
            Subscription subscription = eventStore.subscribeAll(StartAt.beginning());
            assertThat(subscription.state()).isEqualTo(SubscriptionState.CATCHING_UP);

            // When
            List<RecordedEvent> history = take(subscription, 5);
            append(eventStore, "a", events("live", 1));
            List<RecordedEvent> live = take(subscription, 1);

            // Then
            assertAll(
                    () -> assertThat(globalPositionsOf(history)).isEqualTo(positions(5)),
                    () -> assertThat(live).extracting(TestEvents::labelOf).containsExactly("live-0"),
                    () -> assertThat(subscription.awaitLive(Duration.ofSeconds(1))).isTrue(),
                    () -> assertThat(subscription.state()).isEqualTo(SubscriptionState.LIVE),
                    () -> assertThat(subscription.lastDeliveredPosition()).isEqualTo(5L)
            );
        }

        @Test
        void subscribing_from_the_beginning_of_an_empty_store_is_live_immediately() throws InterruptedException {
            Subscription subscription = eventStore.subscribeAll(StartAt.beginning());

            assertThat(subscription.awaitLive(Duration.ofSeconds(1))).isTrue();
        }

        @Test
        void subscribing_from_a_position_replays_from_that_position() {
            // Given
            append(eventStore, "a", events(10));

            // When
            Subscription subscription = eventStore.subscribeAll(StartAt.position(7));

            // Then
            assertThat(globalPositionsOf(takeUnchecked(subscription, 3))).containsExactly(7L, 8L, 9L);
        }

        @Test
        void subscribing_to_a_stream_replays_the_stream_in_stream_order() {
            // Given
            append(eventStore, "a", events("a", 2));
            append(eventStore, "b", events("b", 2));
            append(eventStore, "a", events("a-again", 2));
            Subscription subscription = eventStore.subscribeStream("a", StartAt.position(1));

            // When
            List<RecordedEvent> received = takeUnchecked(subscription, 3);

            // Then
            assertThat(streamPositionsOf(received)).containsExactly(1L, 2L, 3L);
            assertThat(received).extracting(TestEvents::labelOf).containsExactly("a-1", "a-again-0", "a-again-1");
        }

        @Test
        void resuming_after_the_last_delivered_position_continues_without_gaps_or_duplicates() {
            // Given
            append(eventStore, "a", events(6));
            Subscription first = eventStore.subscribeAll(StartAt.beginning());
            takeUnchecked(first, 4);
            first.close();

            // When
            Subscription resumed = eventStore.subscribeAll(StartAt.position(first.lastDeliveredPosition() + 1));

            // Then
            assertThat(globalPositionsOf(takeUnchecked(resumed, 2))).containsExactly(4L, 5L);
        }

        @Test
        void never_drops_or_duplicates_events_committed_while_catching_up() throws Exception {
            // Given
            int historic = 2_000;
            // Fewer than the buffer capacity so that the subscriber can't be overrun while it replays history
            int concurrent = 1_000;
            appendOneByOne(eventStore, "history", historic);

            // When
            Subscription subscription = eventStore.subscribeAll(StartAt.beginning());
            CompletableFuture<Void> writer = CompletableFuture.runAsync(() -> {
                for (int i = 0; i < concurrent; i++) {
                    append(eventStore, "stream-" + (i % 5), events("concurrent-" + i, 1));
                }
            });
            List<RecordedEvent> received = take(subscription, historic + concurrent);
            writer.get(10, TimeUnit.SECONDS);

            // Then
            assertThat(globalPositionsOf(received)).isEqualTo(positions(historic + concurrent));
            assertThat(subscription.poll(Duration.ofMillis(50))).isEmpty();
        }
    }

    @Nested
    class ConcurrentWriters {

        @Test
        void subscription_to_all_receives_every_event_of_concurrent_writers_in_global_order() throws InterruptedException {
            // Given
            int writers = 4;
            int appendsPerWriter = 100;
            Subscription subscription = eventStore.subscribeAll(StartAt.now());

            // When
            Concurrently.run(writers, writer -> {
                for (int i = 0; i < appendsPerWriter; i++) {
                    append(eventStore, "stream-" + writer, events("w" + writer + "-a" + i, 1 + i % 2));
                }
            });

            // Then
            int expectedCount = writers * (appendsPerWriter / 2) * 3;
            List<RecordedEvent> received = take(subscription, expectedCount);
            Map<String, List<RecordedEvent>> byStream = received.stream().collect(Collectors.groupingBy(RecordedEvent::streamId));
            assertAll(
                    () -> assertThat(globalPositionsOf(received)).isEqualTo(positions(expectedCount)),
                    () -> assertThat(byStream).hasSize(writers),
                    () -> byStream.values().forEach(eventsOfStream -> assertThat(streamPositionsOf(eventsOfStream)).isEqualTo(positions(eventsOfStream.size()))),
                    () -> assertThat(subscription.poll(Duration.ofMillis(50))).isEmpty()
            );
        }

        @Test
        void subscription_to_a_stream_receives_exactly_the_events_of_that_stream_while_other_streams_are_written() throws InterruptedException {
            // Given
            int count = 200;
            Subscription subscription = eventStore.subscribeStream("target", StartAt.beginning());

            // When
            Concurrently.run(4, writer -> {
                for (int i = 0; i < count; i++) {
                    String streamId = writer == 0 ? "target" : "other-" + writer;
                    append(eventStore, streamId, List.of(TestEvents.event(streamId + "-" + i)));
                }
            });

            // Then
            List<RecordedEvent> received = take(subscription, count);
            assertAll(
                    () -> assertThat(received).allMatch(event -> event.streamId().equals("target")),
                    () -> assertThat(streamPositionsOf(received)).isEqualTo(positions(count)),
                    () -> assertThat(received).extracting(TestEvents::labelOf).first().isEqualTo("target-0"),
                    () -> assertThat(subscription.poll(Duration.ofMillis(50))).isEmpty()
            );
        }

        @Test
        void first_appends_to_two_carts_made_concurrently_are_both_delivered_to_a_subscriber_of_all() throws InterruptedException {
            Subscription subscription = eventStore.subscribeAll(StartAt.now());

            for (int round = 0; round < 20; round++) {
                // Given
                String cart1 = "cart-1-" + round;
                String cart2 = "cart-2-" + round;
                List<AppendResult> results = new CopyOnWriteArrayList<>();

                // When
                Concurrently.run(2, writer -> {
                    String cart = writer == 0 ? cart1 : cart2;
                    results.add(eventStore.append(cart, ExpectedVersion.exactly(-1), List.of(TestEvents.event(cart + "-item-added"))));
                });

                // Then
                List<RecordedEvent> received = take(subscription, 2);
                assertAll(
                        () -> assertThat(results).hasSize(2).allMatch(result -> result instanceof AppendResult.Appended),
                        () -> assertThat(received).extracting(RecordedEvent::streamId).containsExactlyInAnyOrder(cart1, cart2),
                        () -> assertThat(streamPositionsOf(received)).containsExactly(0L, 0L),
                        () -> assertThat(received.get(1).globalPosition()).isEqualTo(received.get(0).globalPosition() + 1)
                );
            }
            assertThat(globalPositionsOf(eventStore.readAll(ReadDirection.FORWARD, ReadFrom.start(), Integer.MAX_VALUE))).isEqualTo(positions(40));
        }
    }

    @Nested
    class Overrun {

        @Test
        void subscriber_that_does_not_keep_up_is_closed_with_subscription_overrun() throws InterruptedException {
            // Given
            Subscription subscription = eventStore.subscribeAll(StartAt.now());

            // When
            for (int i = 0; i < 10; i++) {
                append(eventStore, "a", events("batch" + i, 1_000));
            }

            // Then
            Delivery delivery = subscription.next();
            assertAll(
                    () -> assertThat(delivery).isInstanceOf(Delivery.SubscriptionClosed.class),
                    () -> assertThat(((Delivery.SubscriptionClosed) delivery).reason()).isInstanceOf(CloseReason.SubscriptionOverrun.class),
                    () -> assertThat(((CloseReason.SubscriptionOverrun) ((Delivery.SubscriptionClosed) delivery).reason()).subscriptionId()).isEqualTo(subscription.id()),
                    () -> assertThat(subscription.state()).isEqualTo(SubscriptionState.CLOSED),
                    () -> assertThat(subscription.lastDeliveredPosition()).isEqualTo(-1L)
            );
        }

        @Test
        void overrun_of_one_subscriber_does_not_affect_writers_or_other_subscribers() throws InterruptedException {
            // Given
            Subscription slow = eventStore.subscribeAll(StartAt.now());
            Subscription fast = eventStore.subscribeAll(StartAt.now());
            CompletableFuture<List<RecordedEvent>> fastConsumer = CompletableFuture.supplyAsync(() -> takeUnchecked(fast, 10_000));

            // When
            for (int i = 0; i < 10_000; i++) {
                if (i % 500 == 0) {
                    long caughtUpTo = i - 1;
                    await().atMost(Duration.ofSeconds(10)).until(fast::lastDeliveredPosition, is(caughtUpTo));
                }
                append(eventStore, "a", events("event-" + i, 1));
            }

            // Then
            await().atMost(Duration.ofSeconds(20)).until(fastConsumer::isDone, is(true));
            assertThat(globalPositionsOf(fastConsumer.join())).isEqualTo(positions(10_000));
            assertThat(slow.next()).isInstanceOf(Delivery.SubscriptionClosed.class);
            assertThat(eventStore.currentVersion("a")).isEqualTo(9_999L);
        }
    }

    @Nested
    class Cancellation {

        @Test
        void closing_wakes_up_a_consumer_blocked_in_next() throws Exception {
            // Given
            Subscription subscription = eventStore.subscribeAll(StartAt.now());
            CompletableFuture<Delivery> blocked = CompletableFuture.supplyAsync(() -> {
                try {
                    return subscription.next();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException(e);
                }
            });

            // When
            subscription.close();

            // Then
            assertThat(blocked.get(5, TimeUnit.SECONDS)).isEqualTo(new Delivery.SubscriptionClosed(CloseReason.unsubscribed()));
        }

        @Test
        void closing_while_catching_up_stops_the_replay() throws InterruptedException {
            // Given
            append(eventStore, "a", events(100));
            Subscription subscription = eventStore.subscribeAll(StartAt.beginning());
            take(subscription, 10);

            // When
            subscription.close();

            // Then
            assertAll(
                    () -> assertThat(subscription.next()).isInstanceOf(Delivery.SubscriptionClosed.class),
                    () -> assertThat(subscription.lastDeliveredPosition()).isEqualTo(9L),
                    () -> assertThat(subscription.awaitLive(Duration.ofMillis(10))).isFalse()
            );
        }

        @Test
        void closing_a_subscription_does_not_affect_other_subscriptions() throws InterruptedException {
            // Given
            Subscription closed = eventStore.subscribeStream("a", StartAt.now());
            Subscription open = eventStore.subscribeStream("a", StartAt.now());

            // When
            closed.close();
            append(eventStore, "a", events(2));

            // Then
            assertThat(streamPositionsOf(take(open, 2))).containsExactly(0L, 1L);
        }
    }

    private static List<RecordedEvent> takeUnchecked(Subscription subscription, int count) {
        try {
            return take(subscription, count);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }
}
