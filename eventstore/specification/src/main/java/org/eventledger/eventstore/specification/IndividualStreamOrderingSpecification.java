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
import org.eventledger.eventstore.api.EventStore;
import org.eventledger.eventstore.api.EventStream;
import org.eventledger.eventstore.api.ReadFrom;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.eventledger.eventstore.api.ReadDirection.BACKWARD;
import static org.eventledger.eventstore.api.ReadDirection.FORWARD;
import static org.eventledger.eventstore.specification.TestEvents.append;
import static org.eventledger.eventstore.specification.TestEvents.events;
import static org.eventledger.eventstore.specification.TestEvents.labelOf;
import static org.eventledger.eventstore.specification.TestEvents.positions;
import static org.eventledger.eventstore.specification.TestEvents.streamPositionsOf;
import static org.junit.jupiter.api.Assertions.assertAll;

@DisplayNameGeneration(ReplaceUnderscores.class)
public abstract class IndividualStreamOrderingSpecification extends EventStoreSpecification {

    @Test
    void stream_positions_start_at_zero_and_have_no_gaps() {
        // Given
        append(eventStore, "name", events("first", 3));

        // When
        AppendResult.Appended appended = append(eventStore, "name", events("second", 2));

        // Then
        assertAll(
                () -> assertThat(appended.streamPositions()).containsExactly(3L, 4L),
                () -> assertThat(appended.nextExpectedVersion()).isEqualTo(4L),
                () -> assertThat(eventStore.currentVersion("name")).isEqualTo(4L),
                () -> assertThat(streamPositionsOf(eventStore.readStream("name", FORWARD, ReadFrom.start(), 100))).isEqualTo(positions(5))
        );
    }

    @Test
    void streams_are_numbered_independently_of_each_other() {
        // Given
        append(eventStore, "a", events("a", 2));
        append(eventStore, "b", events("b", 1));
        append(eventStore, "a", events("a-again", 1));

        // When
        List<RecordedEvent> a = eventStore.readStream("a", FORWARD, ReadFrom.start(), 100);
        List<RecordedEvent> b = eventStore.readStream("b", FORWARD, ReadFrom.start(), 100);

        // Then
        assertAll(
                () -> assertThat(streamPositionsOf(a)).containsExactly(0L, 1L, 2L),
                () -> assertThat(a).extracting(TestEvents::labelOf).containsExactly("a-0", "a-1", "a-again-0"),
                () -> assertThat(streamPositionsOf(b)).containsExactly(0L),
                () -> assertThat(a).allMatch(event -> event.streamId().equals("a"))
        );
    }

    @Test
    void reading_a_stream_backwards_returns_descending_positions() {
        // Given
        append(eventStore, "name", events(4));
        append(eventStore, "other", events(4));

        // When
        List<RecordedEvent> events = eventStore.readStream("name", BACKWARD, ReadFrom.end(), 3);

        // Then
        assertThat(streamPositionsOf(events)).containsExactly(3L, 2L, 1L);
    }

    @Test
    void reading_a_stream_from_a_position_includes_that_position() {
        // Given
        append(eventStore, "name", events(6));

        // Then
        assertAll(
                () -> assertThat(streamPositionsOf(eventStore.readStreamForwards("name", 2, 2))).containsExactly(2L, 3L),
                () -> assertThat(streamPositionsOf(eventStore.readStreamBackwards("name", 2, 10))).containsExactly(2L, 1L, 0L),
                () -> assertThat(eventStore.readStreamForwards("name", 6, 10)).isEmpty()
        );
    }

    @Test
    void global_positions_increase_with_stream_positions() {
        // Given
        append(eventStore, "a", events(2));
        append(eventStore, "b", events(2));
        append(eventStore, "a", events(2));

        // When
        List<RecordedEvent> a = eventStore.readStream("a", FORWARD, ReadFrom.start(), 100);

        // Then
        assertThat(a).extracting(RecordedEvent::globalPosition).containsExactly(0L, 1L, 4L, 5L);
    }

    @Nested
    class AbsentStream {

        @Test
        void reading_a_stream_that_does_not_exist_returns_no_events() {
            assertAll(
                    () -> assertThat(eventStore.readStream("unknown", FORWARD, ReadFrom.start(), 10)).isEmpty(),
                    () -> assertThat(eventStore.readStream("unknown", BACKWARD, ReadFrom.end(), 10)).isEmpty()
            );
        }

        @Test
        void version_of_a_stream_that_does_not_exist_is_minus_one() {
            assertAll(
                    () -> assertThat(eventStore.currentVersion("unknown")).isEqualTo(EventStore.EMPTY_STREAM_VERSION),
                    () -> assertThat(eventStore.exists("unknown")).isFalse(),
                    () -> assertThat(eventStore.readStream("unknown")).isEqualTo(EventStream.empty("unknown"))
            );
        }
    }

    @Test
    void read_stream_returns_an_event_stream_with_the_current_version() {
        // Given
        append(eventStore, "name", events(3));

        // When
        EventStream eventStream = eventStore.readStream("name");

        // Then
        assertAll(
                () -> assertThat(eventStream.id()).isEqualTo("name"),
                () -> assertThat(eventStream.version()).isEqualTo(2L),
                () -> assertThat(eventStream.isEmpty()).isFalse(),
                () -> assertThat(eventStream.map(TestEvents::labelOf)).containsExactly("event-0", "event-1", "event-2"),
                () -> assertThat(eventStore.exists("name")).isTrue()
        );
    }

    @Test
    void concurrent_appends_to_the_same_stream_never_overlap() {
        // Given
        int threads = 8;
        int appendsPerThread = 50;

        // When
        Concurrently.run(threads, thread -> {
            for (int i = 0; i < appendsPerThread; i++) {
                append(eventStore, "contended", events("t" + thread + "-a" + i, 2));
            }
        });

        // Then
        List<RecordedEvent> events = eventStore.readStream("contended", FORWARD, ReadFrom.start(), Integer.MAX_VALUE);
        assertThat(streamPositionsOf(events)).isEqualTo(positions(threads * appendsPerThread * 2L));
        for (int i = 0; i < events.size(); i += 2) {
            String first = labelOf(events.get(i));
            String second = labelOf(events.get(i + 1));
            assertThat(first).endsWith("-0");
            assertThat(second).isEqualTo(first.substring(0, first.length() - 2) + "-1");
        }
    }
}
