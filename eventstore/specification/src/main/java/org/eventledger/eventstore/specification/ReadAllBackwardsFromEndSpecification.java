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
import org.eventledger.eventstore.api.InvalidRangeException;
import org.eventledger.eventstore.api.ReadFrom;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.eventledger.eventstore.api.ReadDirection.BACKWARD;
import static org.eventledger.eventstore.specification.TestEvents.append;
import static org.eventledger.eventstore.specification.TestEvents.events;
import static org.eventledger.eventstore.specification.TestEvents.globalPositionsOf;
import static org.eventledger.eventstore.specification.TestEvents.positions;
import static org.junit.jupiter.api.Assertions.assertAll;

@DisplayNameGeneration(ReplaceUnderscores.class)
public abstract class ReadAllBackwardsFromEndSpecification extends EventStoreSpecification {

    @Test
    void reading_an_empty_store_returns_no_events() {
        assertThat(eventStore.readAll(BACKWARD, ReadFrom.end(), 10)).isEmpty();
    }

    @Test
    void returns_all_events_in_reverse_commit_order() {
        // Given
        append(eventStore, "a", events("a", 2));
        append(eventStore, "b", events("b", 3));

        // When
        List<RecordedEvent> events = eventStore.readAll(BACKWARD, ReadFrom.end(), 100);

        // Then
        assertAll(
                () -> assertThat(globalPositionsOf(events)).containsExactly(4L, 3L, 2L, 1L, 0L),
                () -> assertThat(events).extracting(TestEvents::labelOf).containsExactly("b-2", "b-1", "b-0", "a-1", "a-0")
        );
    }

    @Test
    void returns_at_most_max_count_events_from_the_end() {
        // Given
        append(eventStore, "a", events(5));

        // When
        List<RecordedEvent> events = eventStore.readAll(BACKWARD, ReadFrom.end(), 2);

        // Then
        assertThat(globalPositionsOf(events)).containsExactly(4L, 3L);
    }

    @Test
    void reading_backwards_from_a_position_includes_the_event_at_that_position() {
        // Given
        append(eventStore, "a", events(5));

        // When
        List<RecordedEvent> events = eventStore.readAll(BACKWARD, ReadFrom.position(2), 10);

        // Then
        assertThat(globalPositionsOf(events)).containsExactly(2L, 1L, 0L);
    }

    @Test
    void reading_backwards_from_a_position_after_the_last_event_returns_no_events() {
        // Given
        append(eventStore, "a", events(5));

        // Then
        assertThat(eventStore.readAllBackwards(5, 10)).isEmpty();
    }

    @Test
    void paging_backwards_returns_every_event_exactly_once() {
        // Given
        for (int i = 0; i < 17; i++) {
            append(eventStore, "stream-" + (i % 4), events("event-" + i, 1));
        }

        // When
        List<RecordedEvent> read = new ArrayList<>();
        List<RecordedEvent> page = eventStore.readAll(BACKWARD, ReadFrom.end(), 5);
        while (!page.isEmpty()) {
            read.addAll(page);
            long next = page.get(page.size() - 1).globalPosition() - 1;
            page = next < 0 ? List.of() : eventStore.readAllBackwards(next, 5);
        }

        // Then
        List<Long> expected = new ArrayList<>(positions(17));
        Collections.reverse(expected);
        assertThat(globalPositionsOf(read)).isEqualTo(expected);
    }

    @Test
    void reading_forwards_and_backwards_returns_the_same_events() {
        // Given
        append(eventStore, "a", events("a", 3));
        append(eventStore, "b", events("b", 3));

        // When
        List<RecordedEvent> backwards = new ArrayList<>(eventStore.readAll(BACKWARD, ReadFrom.end(), 100));
        Collections.reverse(backwards);

        // Then
        assertThat(backwards).containsExactlyElementsOf(eventStore.readAllForwards(0, 100));
    }

    @Test
    void max_count_less_than_one_is_rejected() {
        assertThatThrownBy(() -> eventStore.readAll(BACKWARD, ReadFrom.end(), -1)).isInstanceOf(InvalidRangeException.class);
    }
}
