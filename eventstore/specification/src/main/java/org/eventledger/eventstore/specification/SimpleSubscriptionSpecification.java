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
import org.eventledger.subscription.api.CloseReason;
import org.eventledger.subscription.api.Delivery;
import org.eventledger.subscription.api.StartAt;
import org.eventledger.subscription.api.Subscription;
import org.eventledger.subscription.api.SubscriptionState;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.eventledger.eventstore.specification.TestEvents.append;
import static org.eventledger.eventstore.specification.TestEvents.events;
import static org.junit.jupiter.api.Assertions.assertAll;

@Timeout(10)
@DisplayNameGeneration(ReplaceUnderscores.class)
public abstract class SimpleSubscriptionSpecification extends EventStoreSpecification {

    @Test
    void subscribing_to_all_from_now_receives_events_appended_afterwards() throws InterruptedException {
        // Given
        append(eventStore, "before", events("before", 2));
        Subscription subscription = eventStore.subscribeAll(StartAt.now());

        // When
        append(eventStore, "a", events("a", 1));
        append(eventStore, "b", events("b", 1));

        // Then
        List<RecordedEvent> received = take(subscription, 2);
        assertAll(
                () -> assertThat(received).extracting(TestEvents::labelOf).containsExactly("a-0", "b-0"),
                () -> assertThat(received).extracting(RecordedEvent::globalPosition).containsExactly(2L, 3L),
                () -> assertThat(subscription.state()).isEqualTo(SubscriptionState.LIVE),
                () -> assertThat(subscription.lastDeliveredPosition()).isEqualTo(3L)
        );
    }

    @Test
    void subscribing_to_a_stream_only_receives_events_of_that_stream() throws InterruptedException {
        // Given
        Subscription subscription = eventStore.subscribeStream("a", StartAt.now());

        // When
        append(eventStore, "a", events("a", 1));
        append(eventStore, "b", events("b", 3));
        append(eventStore, "a", events("a-again", 1));

        // Then
        List<RecordedEvent> received = take(subscription, 2);
        assertAll(
                () -> assertThat(received).extracting(TestEvents::labelOf).containsExactly("a-0", "a-again-0"),
                () -> assertThat(received).extracting(RecordedEvent::streamPosition).containsExactly(0L, 1L),
                () -> assertThat(subscription.lastDeliveredPosition()).isEqualTo(1L),
                () -> assertThat(subscription.poll(Duration.ofMillis(50))).isEmpty()
        );
    }

    @Test
    void poll_returns_empty_when_no_event_is_committed_within_the_timeout() throws InterruptedException {
        Subscription subscription = eventStore.subscribeAll(StartAt.now());

        assertThat(subscription.poll(Duration.ofMillis(20))).isEmpty();
    }

    @Test
    void closing_a_subscription_delivers_unsubscribed() throws InterruptedException {
        // Given
        Subscription subscription = eventStore.subscribeAll(StartAt.now());

        // When
        subscription.close();
        subscription.close();

        // Then
        assertAll(
                () -> assertThat(subscription.next()).isEqualTo(new Delivery.SubscriptionClosed(CloseReason.unsubscribed())),
                () -> assertThat(subscription.next()).isEqualTo(new Delivery.SubscriptionClosed(CloseReason.unsubscribed())),
                () -> assertThat(subscription.state()).isEqualTo(SubscriptionState.CLOSED),
                () -> assertThat(subscription.closeReason()).contains(CloseReason.unsubscribed())
        );
    }

    @Test
    void events_appended_after_close_are_not_delivered() throws InterruptedException {
        // Given
        Subscription subscription = eventStore.subscribeAll(StartAt.now());
        subscription.close();

        // When
        append(eventStore, "a", events(3));

        // Then
        assertThat(subscription.next()).isInstanceOf(Delivery.SubscriptionClosed.class);
        assertThat(subscription.lastDeliveredPosition()).isEqualTo(-1L);
    }

    @Test
    void closing_the_event_store_closes_its_subscriptions() throws InterruptedException {
        // Given
        Subscription subscription = eventStore.subscribeAll(StartAt.now());

        // When
        eventStore.close();

        // Then
        assertThat(subscription.next()).isEqualTo(new Delivery.SubscriptionClosed(CloseReason.storeShutdown()));
    }

    @Test
    void every_subscriber_receives_every_event() throws InterruptedException {
        // Given
        Subscription subscription1 = eventStore.subscribeAll(StartAt.now());
        Subscription subscription2 = eventStore.subscribeAll(StartAt.now());

        // When
        append(eventStore, "a", events(5));

        // Then
        assertThat(take(subscription1, 5)).isEqualTo(take(subscription2, 5));
    }

    /**
     * Take {@code count} events from the subscription, failing if it's closed before that.
     */
    protected static List<RecordedEvent> take(Subscription subscription, int count) throws InterruptedException {
        List<RecordedEvent> events = new ArrayList<>(count);
        while (events.size() < count) {
            Delivery delivery = subscription.next();
            if (delivery instanceof Delivery.SubscriptionClosed) {
                throw new AssertionError("Subscription was closed after " + events.size() + " events: " + ((Delivery.SubscriptionClosed) delivery).reason());
            }
            events.add(((Delivery.EventDelivered) delivery).event());
        }
        return events;
    }
}
