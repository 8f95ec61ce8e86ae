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

import org.eventledger.EventData;
import org.eventledger.RecordedEvent;
import org.eventledger.eventstore.api.InvalidRangeException;
import org.eventledger.eventstore.api.ReadFrom;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.eventledger.eventstore.api.ReadDirection.FORWARD;
import static org.eventledger.eventstore.specification.TestEvents.append;
import static org.eventledger.eventstore.specification.TestEvents.events;
import static org.eventledger.eventstore.specification.TestEvents.globalPositionsOf;
import static org.eventledger.eventstore.specification.TestEvents.labelOf;
import static org.eventledger.eventstore.specification.TestEvents.positions;
import static org.junit.jupiter.api.Assertions.assertAll;

@DisplayNameGeneration(ReplaceUnderscores.class)
public abstract class ReadAllForwardsFromStartSpecification extends EventStoreSpecification {

    @Test
    void reading_an_empty_store_returns_no_events() {
        assertThat(eventStore.readAll(FORWARD, ReadFrom.start(), 10)).isEmpty();
    }

    @Test
    void returns_the_events_of_all_streams_in_commit_order() {
        // Given
        append(eventStore, "a", events("a", 2));
        append(eventStore, "b", events("b", 1));
        append(eventStore, "a", List.of(TestEvents.event("a-2")));

        // When
        List<RecordedEvent> all = eventStore.readAll(FORWARD, ReadFrom.start(), 100);

        // Then
        assertAll(
                () -> assertThat(globalPositionsOf(all)).containsExactly(0L, 1L, 2L, 3L),
                () -> assertThat(all).extracting(RecordedEvent::streamId).containsExactly("a", "a", "b", "a"),
                () -> assertThat(all).extracting(RecordedEvent::streamPosition).containsExactly(0L, 1L, 0L, 2L),
                () -> assertThat(all).extracting(TestEvents::labelOf).containsExactly("a-0", "a-1", "b-0", "a-2")
        );
    }

    @Test
    void returns_at_most_max_count_events() {
        // Given
        append(eventStore, "a", events(10));

        // When
        List<RecordedEvent> events = eventStore.readAll(FORWARD, ReadFrom.start(), 3);

        // Then
        assertThat(globalPositionsOf(events)).containsExactly(0L, 1L, 2L);
    }

    @Test
    void reading_from_a_position_includes_the_event_at_that_position() {
        // Given
        append(eventStore, "a", events(10));

        // When
        List<RecordedEvent> events = eventStore.readAll(FORWARD, ReadFrom.position(4), 3);

        // Then
        assertThat(globalPositionsOf(events)).containsExactly(4L, 5L, 6L);
    }

    @Test
    void reading_from_a_position_after_the_last_event_returns_no_events() {
        // Given
        append(eventStore, "a", events(3));

        // Then
        assertAll(
                () -> assertThat(eventStore.readAllForwards(3, 10)).isEmpty(),
                () -> assertThat(eventStore.readAllForwards(100, 10)).isEmpty()
        );
    }

    @Test
    void paging_forwards_returns_every_event_exactly_once() {
        // Given
        for (int i = 0; i < 25; i++) {
            append(eventStore, "stream-" + (i % 3), List.of(TestEvents.event("event-" + i)));
        }

        // When
        List<RecordedEvent> read = new ArrayList<>();
        List<RecordedEvent> page = eventStore.readAllForwards(0, 4);
        while (!page.isEmpty()) {
            read.addAll(page);
            page = eventStore.readAllForwards(page.get(page.size() - 1).globalPosition() + 1, 4);
        }

        // Then
        assertAll(
                () -> assertThat(globalPositionsOf(read)).isEqualTo(positions(25)),
                () -> assertThat(labelOf(read.get(24))).isEqualTo("event-24")
        );
    }

    @Test
    void returned_events_carry_the_appended_data() {
        // Given
        EventData eventData = EventData.of("NameDefined", "John".getBytes(UTF_8), "{\"correlationId\":\"1\"}".getBytes(UTF_8));
        eventStore.append("name", List.of(eventData));

        // When
        RecordedEvent event = eventStore.readAll(FORWARD, ReadFrom.start(), 1).get(0);

        // Then
        assertAll(
                () -> assertThat(event.type()).isEqualTo("NameDefined"),
                () -> assertThat(labelOf(event)).isEqualTo("John"),
                () -> assertThat(event.metadata()).isEqualTo("{\"correlationId\":\"1\"}".getBytes(UTF_8)),
                () -> assertThat(event.streamId()).isEqualTo("name"),
                () -> assertThat(event.eventId()).isNotNull(),
                () -> assertThat(event.timestamp()).isNotNull()
        );
    }

    @Test
    void max_count_less_than_one_is_rejected() {
        assertThatThrownBy(() -> eventStore.readAll(FORWARD, ReadFrom.start(), 0))
                .isInstanceOf(InvalidRangeException.class)
                .hasMessage("maxCount must be greater than or equal to 1 but was 0");
    }

    @Test
    void negative_position_is_rejected() {
        assertThatThrownBy(() -> eventStore.readAllForwards(-1, 10)).isInstanceOf(InvalidRangeException.class);
    }
}
