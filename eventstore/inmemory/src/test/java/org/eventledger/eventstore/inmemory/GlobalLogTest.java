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
import org.eventledger.eventstore.api.ReadFrom;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertAll;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class GlobalLogTest {

    private final GlobalLog globalLog = new GlobalLog();

    @Test
    void head_position_of_empty_log_is_minus_one() {
        assertThat(globalLog.headPosition()).isEqualTo(-1L);
    }

    @Test
    void assigns_contiguous_positions_in_the_given_order() {
        // When
        List<RecordedEvent> first = appendAndCommit(List.of(pending("a", 0), pending("a", 1)));
        List<RecordedEvent> second = appendAndCommit(List.of(pending("b", 0)));

        // Then
        assertAll(
                () -> assertThat(first).extracting(RecordedEvent::globalPosition).containsExactly(0L, 1L),
                () -> assertThat(second).extracting(RecordedEvent::globalPosition).containsExactly(2L),
                () -> assertThat(globalLog.headPosition()).isEqualTo(2L),
                () -> assertThat(globalLog.readAllForwards(ReadFrom.start(), 10)).containsExactly(first.get(0), first.get(1), second.get(0)),
                () -> assertThat(globalLog.readAllBackwards(ReadFrom.end(), 2)).containsExactly(second.get(0), first.get(1))
        );
    }

    @Test
    void appending_without_holding_the_sequencer_is_rejected() {
        assertThatThrownBy(() -> globalLog.append(List.of(pending("a", 0))))
                .isExactlyInstanceOf(IllegalStateException.class)
                .hasMessage("Internal error: global positions can only be assigned while holding the sequencer");
        assertThat(globalLog.headPosition()).isEqualTo(-1L);
    }

    @Test
    void appended_events_are_invisible_until_committed() {
        ReentrantLock sequencer = globalLog.sequencer();
        sequencer.lock();
        try {
            // Given
            List<RecordedEvent> committed = globalLog.append(List.of(pending("a", 0)));
            globalLog.commit(0);

            // When
            globalLog.append(List.of(pending("b", 0), pending("b", 1)));

            // Then
            assertAll(
                    () -> assertThat(globalLog.headPosition()).isEqualTo(0L),
                    () -> assertThat(globalLog.readAllForwards(ReadFrom.start(), 10)).containsExactlyElementsOf(committed),
                    () -> assertThat(globalLog.readAllBackwards(ReadFrom.end(), 10)).containsExactlyElementsOf(committed),
                    () -> assertThat(globalLog.readAllForwards(ReadFrom.position(1), 10)).isEmpty()
            );

            globalLog.commit(2);
            assertThat(globalLog.readAllBackwards(ReadFrom.end(), 10)).extracting(RecordedEvent::globalPosition).containsExactly(2L, 1L, 0L);
        } finally {
            sequencer.unlock();
        }
    }

    @Test
    void cannot_commit_a_position_that_was_never_appended() {
        ReentrantLock sequencer = globalLog.sequencer();
        sequencer.lock();
        try {
            globalLog.append(List.of(pending("a", 0)));

            assertThatThrownBy(() -> globalLog.commit(1)).isExactlyInstanceOf(IllegalStateException.class);
            assertThat(globalLog.headPosition()).isEqualTo(-1L);
        } finally {
            sequencer.unlock();
        }
    }

    private List<RecordedEvent> appendAndCommit(List<PendingEvent> events) {
        ReentrantLock sequencer = globalLog.sequencer();
        sequencer.lock();
        try {
            List<RecordedEvent> recorded = globalLog.append(events);
            globalLog.commit(recorded.get(recorded.size() - 1).globalPosition());
            return recorded;
        } finally {
            sequencer.unlock();
        }
    }

    private static PendingEvent pending(String streamId, long streamPosition) {
        return new PendingEvent(UUID.randomUUID(), streamId, streamPosition, EventData.of("Test", new byte[0]), Instant.now());
    }
}
