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

package org.eventledger.eventstore.inmemory;

import org.eventledger.EventData;
import org.eventledger.RecordedEvent;
import org.eventledger.eventstore.api.InvalidRangeException;
import org.eventledger.eventstore.api.ReadFrom;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;
import java.util.stream.LongStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.eventledger.eventstore.api.ReadDirection.BACKWARD;
import static org.eventledger.eventstore.api.ReadDirection.FORWARD;
import static org.junit.jupiter.api.Assertions.assertAll;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class EventLogTest {

    private final EventLog eventLog = new EventLog();

    @Test
    void empty_log_has_no_last_index() {
        assertAll(
                () -> assertThat(eventLog.size()).isZero(),
                () -> assertThat(eventLog.lastIndex()).isEqualTo(-1L),
                () -> assertThat(eventLog.read(FORWARD, ReadFrom.start(), 10)).isEmpty(),
                () -> assertThat(eventLog.read(BACKWARD, ReadFrom.end(), 10)).isEmpty()
        );
    }

    @Test
    void stores_events_across_chunk_boundaries() {
        // Given
        List<RecordedEvent> events = events(0, 2_500);

        // When
        eventLog.appendAll(events.subList(0, 1_000));
        eventLog.appendAll(events.subList(1_000, 2_500));

        // Then
        assertAll(
                () -> assertThat(eventLog.size()).isEqualTo(2_500L),
                () -> assertThat(eventLog.get(1_023)).isEqualTo(events.get(1_023)),
                () -> assertThat(eventLog.get(1_024)).isEqualTo(events.get(1_024)),
                () -> assertThat(eventLog.get(2_499)).isEqualTo(events.get(2_499)),
                () -> assertThat(eventLog.read(FORWARD, ReadFrom.position(1_020), 10)).containsExactlyElementsOf(events.subList(1_020, 1_030))
        );
    }

    @Test
    void reads_backwards_down_to_the_first_event() {
        // Given
        eventLog.appendAll(events(0, 5));

        // When
        List<RecordedEvent> read = eventLog.read(BACKWARD, ReadFrom.position(3), 10);

        // Then
        assertThat(read).extracting(RecordedEvent::globalPosition).containsExactly(3L, 2L, 1L, 0L);
    }

    @Test
    void returned_lists_are_unmodifiable() {
        eventLog.appendAll(events(0, 2));

        List<RecordedEvent> read = eventLog.read(FORWARD, ReadFrom.start(), 10);

        assertThatThrownBy(read::clear).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void get_outside_of_the_visible_events_throws_index_out_of_bounds() {
        eventLog.appendAll(events(0, 2));

        assertThatThrownBy(() -> eventLog.get(2))
                .isExactlyInstanceOf(IndexOutOfBoundsException.class)
                .hasMessage("Index 2 is out of bounds for size 2");
    }

    @Test
    void max_count_less_than_one_is_rejected() {
        assertThatThrownBy(() -> eventLog.read(FORWARD, ReadFrom.start(), 0)).isInstanceOf(InvalidRangeException.class);
    }

    static List<RecordedEvent> events(long from, long count) {
        Instant now = Instant.now();
        return LongStream.range(from, from + count)
                .mapToObj(position -> RecordedEvent.record(UUID.randomUUID(), "stream", position, position, EventData.of("Test", new byte[0]), now))
                .collect(Collectors.toList());
    }
}
