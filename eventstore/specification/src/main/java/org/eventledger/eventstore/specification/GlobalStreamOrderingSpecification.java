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
import org.eventledger.eventstore.api.ReadFrom;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.eventledger.eventstore.api.ReadDirection.BACKWARD;
import static org.eventledger.eventstore.api.ReadDirection.FORWARD;
import static org.eventledger.eventstore.specification.TestEvents.append;
import static org.eventledger.eventstore.specification.TestEvents.events;
import static org.eventledger.eventstore.specification.TestEvents.globalPositionsOf;
import static org.eventledger.eventstore.specification.TestEvents.positions;
import static org.eventledger.eventstore.specification.TestEvents.streamPositionsOf;

@DisplayNameGeneration(ReplaceUnderscores.class)
public abstract class GlobalStreamOrderingSpecification extends EventStoreSpecification {

    private static final int WRITERS = 8;
    private static final int APPENDS_PER_WRITER = 100;

    @Test
    void global_positions_have_no_gaps_when_writing_to_many_streams_concurrently() {
        // When
        Concurrently.run(WRITERS, writer -> {
            for (int i = 0; i < APPENDS_PER_WRITER; i++) {
                append(eventStore, "stream-" + writer, events("w" + writer + "-a" + i, 1 + i % 3));
            }
        });

        // Then
        List<RecordedEvent> all = eventStore.readAll(FORWARD, ReadFrom.start(), Integer.MAX_VALUE);
        long expectedCount = (long) WRITERS * IntStream.range(0, APPENDS_PER_WRITER).map(i -> 1 + i % 3).sum();
        assertThat(globalPositionsOf(all)).isEqualTo(positions(expectedCount));
        assertThat(eventStore.headPosition()).isEqualTo(expectedCount - 1);
    }

    @Test
    void global_order_agrees_with_the_order_of_each_stream() {
        // When
        Concurrently.run(WRITERS, writer -> {
            for (int i = 0; i < APPENDS_PER_WRITER; i++) {
                append(eventStore, "stream-" + (i % 4), events("w" + writer + "-a" + i, 2));
            }
        });

        // Then
        List<RecordedEvent> all = eventStore.readAll(FORWARD, ReadFrom.start(), Integer.MAX_VALUE);
        Map<String, List<RecordedEvent>> byStream = all.stream().collect(Collectors.groupingBy(RecordedEvent::streamId));
        assertThat(byStream).hasSize(4);
        byStream.forEach((streamId, eventsInGlobalOrder) -> {
            assertThat(streamPositionsOf(eventsInGlobalOrder)).isEqualTo(positions(eventsInGlobalOrder.size()));
            assertThat(eventsInGlobalOrder).isEqualTo(eventStore.readStream(streamId, FORWARD, ReadFrom.start(), Integer.MAX_VALUE));
        });
    }

    @Test
    void events_of_one_append_receive_contiguous_global_positions() {
        // Given
        List<AppendResult.Appended> results = new CopyOnWriteArrayList<>();

        // When
        Concurrently.run(WRITERS, writer -> {
            for (int i = 0; i < APPENDS_PER_WRITER; i++) {
                results.add(append(eventStore, "stream-" + writer, events("w" + writer + "-a" + i, 3)));
            }
        });

        // Then
        assertThat(results).hasSize(WRITERS * APPENDS_PER_WRITER);
        for (AppendResult.Appended appended : results) {
            List<RecordedEvent> batch = eventStore.readAllBackwards(appended.lastGlobalPosition(), 3);
            assertThat(batch).allMatch(event -> event.streamId().equals(appended.streamId()));
            assertThat(streamPositionsOf(batch)).containsExactlyElementsOf(reversed(appended.streamPositions()));
        }
    }

    @Test
    void an_event_visible_in_the_global_log_is_visible_in_its_stream_and_the_other_way_around() {
        // Given
        AtomicBoolean writing = new AtomicBoolean(true);
        List<String> inconsistencies = new CopyOnWriteArrayList<>();

        // When
        Concurrently.run(2, thread -> {
            if (thread == 0) {
                try {
                    for (int i = 0; i < 2000; i++) {
                        append(eventStore, "stream-" + (i % 4), events("a" + i, 1 + i % 3));
                    }
                } finally {
                    writing.set(false);
                }
            } else {
                while (writing.get() && inconsistencies.isEmpty()) {
                    List<RecordedEvent> latest = eventStore.readAll(BACKWARD, ReadFrom.end(), 1);
                    if (!latest.isEmpty()) {
                        RecordedEvent event = latest.get(0);
                        long currentVersion = eventStore.currentVersion(event.streamId());
                        if (currentVersion < event.streamPosition()) {
                            inconsistencies.add("global position " + event.globalPosition() + " is " + event.streamId() + "@" + event.streamPosition() + " but its stream version is " + currentVersion);
                        }
                    }

                    List<RecordedEvent> latestInStream = eventStore.readStream("stream-1", BACKWARD, ReadFrom.end(), 1);
                    if (!latestInStream.isEmpty()) {
                        RecordedEvent event = latestInStream.get(0);
                        long headPosition = eventStore.headPosition();
                        if (headPosition < event.globalPosition()) {
                            inconsistencies.add("stream-1@" + event.streamPosition() + " has global position " + event.globalPosition() + " but head position is " + headPosition);
                        }
                    }
                }
            }
        });

        // Then
        assertThat(inconsistencies).isEmpty();
    }

    @Test
    void head_position_is_minus_one_for_an_empty_store() {
        assertThat(eventStore.headPosition()).isEqualTo(-1L);
    }

    private static List<Long> reversed(List<Long> positions) {
        return positions.stream().sorted((p1, p2) -> Long.compare(p2, p1)).collect(Collectors.toList());
    }
}
