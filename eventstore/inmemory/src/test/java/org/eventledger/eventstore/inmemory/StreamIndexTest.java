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
import org.eventledger.eventstore.api.AppendResult;
import org.eventledger.eventstore.api.ExpectedVersion;
import org.eventledger.eventstore.api.ReadFrom;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.assertAll;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class StreamIndexTest {

    private final StreamIndex streamIndex = new StreamIndex();

    @Test
    void current_version_of_unknown_stream_is_minus_one() {
        assertThat(streamIndex.currentVersion("unknown")).isEqualTo(-1L);
    }

    @Test
    void taking_the_lock_of_a_stream_does_not_create_a_version() {
        ReentrantLock lock = streamIndex.lock("name");
        try {
            assertAll(
                    () -> assertThat(lock.isHeldByCurrentThread()).isTrue(),
                    () -> assertThat(streamIndex.currentVersion("name")).isEqualTo(-1L),
                    () -> assertThat(streamIndex.readForwards("name", ReadFrom.start(), 10)).isEmpty()
            );
        } finally {
            streamIndex.unlock("name", lock);
        }
    }

    @Nested
    class Locking {

        @Test
        void a_stream_that_is_still_empty_when_unlocked_is_forgotten() {
            // When
            for (int i = 0; i < 100; i++) {
                AppendResult result = streamIndex.append("name-" + i, ExpectedVersion.exactly(5), List.of(event("name-" + i, 0, i)));
                assertThat(result).isInstanceOf(AppendResult.VersionConflict.class);
            }

            // Then
            assertThat(streamIndex.streamCount()).isZero();
        }

        @Test
        void a_stream_with_events_is_kept_when_unlocked() {
            // When
            streamIndex.append("name", ExpectedVersion.noStream(), List.of(event("name", 0, 0)));
            streamIndex.append("name", ExpectedVersion.noStream(), List.of(event("name", 0, 1)));

            // Then
            assertAll(
                    () -> assertThat(streamIndex.streamCount()).isEqualTo(1),
                    () -> assertThat(streamIndex.currentVersion("name")).isZero()
            );
        }

        @Test
        void a_writer_waiting_for_a_forgotten_stream_takes_the_lock_of_the_new_one() throws Exception {
            // Given
            ReentrantLock first = streamIndex.lock("name");
            CompletableFuture<AppendResult> waiting = CompletableFuture.supplyAsync(() -> streamIndex.append("name", ExpectedVersion.noStream(), List.of(event("name", 0, 0))));
            await().until(first::hasQueuedThreads);

            // When
            streamIndex.unlock("name", first);

            // Then
            assertAll(
                    () -> assertThat(waiting.get(5, TimeUnit.SECONDS)).isInstanceOf(AppendResult.Appended.class),
                    () -> assertThat(streamIndex.currentVersion("name")).isZero(),
                    () -> assertThat(streamIndex.streamCount()).isEqualTo(1)
            );
        }
    }

    @Nested
    class Visibility {

        @Test
        void events_above_the_committed_global_position_are_not_visible() {
            // Given
            AtomicLong committed = new AtomicLong(1);
            StreamIndex index = new StreamIndex(committed::get);
            index.store("name", List.of(event("name", 0, 0), event("name", 1, 1)));
            index.store("name", List.of(event("name", 2, 4), event("name", 3, 5)));

            // Then
            assertAll(
                    () -> assertThat(index.currentVersion("name")).isEqualTo(1L),
                    () -> assertThat(index.readForwards("name", ReadFrom.start(), 10)).extracting(RecordedEvent::streamPosition).containsExactly(0L, 1L),
                    () -> assertThat(index.readBackwards("name", ReadFrom.end(), 10)).extracting(RecordedEvent::streamPosition).containsExactly(1L, 0L),
                    () -> assertThat(index.readForwards("name", ReadFrom.position(2), 10)).isEmpty()
            );

            // When
            committed.set(5);

            // Then
            assertThat(index.readBackwards("name", ReadFrom.end(), 10)).extracting(RecordedEvent::streamPosition).containsExactly(3L, 2L, 1L, 0L);
        }

        @Test
        void a_stream_whose_first_batch_is_not_committed_has_no_version() {
            StreamIndex index = new StreamIndex(() -> -1);
            index.store("name", List.of(event("name", 0, 0)));

            assertAll(
                    () -> assertThat(index.currentVersion("name")).isEqualTo(-1L),
                    () -> assertThat(index.readForwards("name", ReadFrom.start(), 10)).isEmpty()
            );
        }
    }

    @Nested
    class Append {

        @Test
        void assigns_positions_after_the_current_version() {
            // Given
            streamIndex.append("name", ExpectedVersion.noStream(), List.of(event("name", 0, 10), event("name", 1, 11)));

            // When
            AppendResult result = streamIndex.append("name", ExpectedVersion.exactly(1), List.of(event("name", 2, 12)));

            // Then
            assertAll(
                    () -> assertThat(result).isEqualTo(new AppendResult.Appended("name", List.of(2L), 2, 12)),
                    () -> assertThat(streamIndex.currentVersion("name")).isEqualTo(2L)
            );
        }

        @Test
        void returns_version_conflict_and_stores_nothing_when_expected_version_is_not_fulfilled() {
            // Given
            streamIndex.append("name", ExpectedVersion.any(), List.of(event("name", 0, 0)));

            // When
            AppendResult result = streamIndex.append("name", ExpectedVersion.noStream(), List.of(event("name", 1, 1)));

            // Then
            assertAll(
                    () -> assertThat(result).isEqualTo(new AppendResult.VersionConflict("name", ExpectedVersion.noStream(), 0)),
                    () -> assertThat(streamIndex.currentVersion("name")).isZero()
            );
        }
    }

    @Test
    void storing_events_with_a_gap_is_rejected() {
        streamIndex.store("name", List.of(event("name", 0, 0)));

        assertThatThrownBy(() -> streamIndex.store("name", List.of(event("name", 2, 1))))
                .isExactlyInstanceOf(IllegalStateException.class)
                .hasMessageStartingWith("Internal error: event");
    }

    @Test
    void storing_events_of_another_stream_is_rejected() {
        assertThatThrownBy(() -> streamIndex.store("name", List.of(event("other", 0, 0))))
                .isExactlyInstanceOf(IllegalStateException.class);
    }

    @Test
    void reads_forwards_and_backwards() {
        // Given
        streamIndex.store("name", List.of(event("name", 0, 3), event("name", 1, 5), event("name", 2, 8)));

        // Then
        assertAll(
                () -> assertThat(streamIndex.readForwards("name", ReadFrom.position(1), 10)).extracting(RecordedEvent::globalPosition).containsExactly(5L, 8L),
                () -> assertThat(streamIndex.readBackwards("name", ReadFrom.end(), 2)).extracting(RecordedEvent::streamPosition).containsExactly(2L, 1L),
                () -> assertThat(streamIndex.readForwards("name", ReadFrom.position(3), 10)).isEmpty()
        );
    }

    private static RecordedEvent event(String streamId, long streamPosition, long globalPosition) {
        return RecordedEvent.record(UUID.randomUUID(), streamId, streamPosition, globalPosition, EventData.of("Test", new byte[0]), Instant.now());
    }
}
