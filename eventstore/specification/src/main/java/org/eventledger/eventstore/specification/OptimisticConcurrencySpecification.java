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

import org.eventledger.eventstore.api.AppendResult;
import org.eventledger.eventstore.api.AppendResult.VersionConflict;
import org.eventledger.eventstore.api.ExpectedVersion;
import org.eventledger.eventstore.api.ReadFrom;
import org.eventledger.eventstore.api.VersionConflictException;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.eventledger.eventstore.api.ReadDirection.FORWARD;
import static org.eventledger.eventstore.specification.TestEvents.append;
import static org.eventledger.eventstore.specification.TestEvents.events;
import static org.junit.jupiter.api.Assertions.assertAll;

@DisplayNameGeneration(ReplaceUnderscores.class)
public abstract class OptimisticConcurrencySpecification extends EventStoreSpecification {

    @Nested
    class NoStream {

        @Test
        void succeeds_when_the_stream_does_not_exist() {
            AppendResult result = eventStore.append("name", ExpectedVersion.noStream(), events(2));

            assertThat(result).isInstanceOf(AppendResult.Appended.class);
            assertThat(((AppendResult.Appended) result).streamPositions()).containsExactly(0L, 1L);
        }

        @Test
        void conflicts_when_the_stream_exists() {
            // Given
            append(eventStore, "name", events(1));

            // When
            AppendResult result = eventStore.append("name", ExpectedVersion.noStream(), events(1));

            // Then
            assertThat(result).isEqualTo(new VersionConflict("name", ExpectedVersion.noStream(), 0));
        }
    }

    @Nested
    class Exactly {

        @Test
        void succeeds_when_the_stream_has_the_expected_version() {
            // Given
            AppendResult.Appended first = append(eventStore, "name", events(2));

            // When
            AppendResult result = eventStore.append("name", ExpectedVersion.exactly(first.nextExpectedVersion()), events(1));

            // Then
            assertThat(result.isSuccess()).isTrue();
            assertThat(eventStore.currentVersion("name")).isEqualTo(2L);
        }

        @Test
        void conflicts_with_the_actual_version_when_the_expected_version_is_stale() {
            // Given
            append(eventStore, "name", events(3));

            // When
            AppendResult result = eventStore.append("name", ExpectedVersion.exactly(1), events(1));

            // Then
            assertThat(result).isEqualTo(new VersionConflict("name", ExpectedVersion.exactly(1), 2));
        }

        @Test
        void exactly_minus_one_is_the_same_as_no_stream() {
            assertThat(ExpectedVersion.exactly(-1)).isEqualTo(ExpectedVersion.noStream());
            assertThat(eventStore.append("name", ExpectedVersion.exactly(-1), events(1)).isSuccess()).isTrue();
        }
    }

    @Nested
    class StreamExists {

        @Test
        void conflicts_when_the_stream_does_not_exist() {
            AppendResult result = eventStore.append("name", ExpectedVersion.streamExists(), events(1));

            assertThat(result).isEqualTo(new VersionConflict("name", ExpectedVersion.streamExists(), -1));
        }

        @Test
        void succeeds_when_the_stream_exists() {
            // Given
            append(eventStore, "name", events(1));

            // When
            AppendResult result = eventStore.append("name", ExpectedVersion.streamExists(), events(1));

            // Then
            assertThat(result.isSuccess()).isTrue();
        }
    }

    @Test
    void any_succeeds_regardless_of_the_stream_version() {
        assertAll(
                () -> assertThat(eventStore.append("name", ExpectedVersion.any(), events(1)).isSuccess()).isTrue(),
                () -> assertThat(eventStore.append("name", ExpectedVersion.any(), events(1)).isSuccess()).isTrue(),
                () -> assertThat(eventStore.currentVersion("name")).isEqualTo(1L)
        );
    }

    @Test
    void a_conflict_leaves_the_store_unchanged() {
        // Given
        append(eventStore, "name", events(2));
        append(eventStore, "other", events(1));
        long headBefore = eventStore.headPosition();

        // When
        eventStore.append("name", ExpectedVersion.exactly(0), events(5));

        // Then
        assertAll(
                () -> assertThat(eventStore.currentVersion("name")).isEqualTo(1L),
                () -> assertThat(eventStore.headPosition()).isEqualTo(headBefore),
                () -> assertThat(eventStore.readAll(FORWARD, ReadFrom.start(), 100)).hasSize(3)
        );
    }

    @Test
    void or_else_throw_converts_a_conflict_into_an_exception() {
        // Given
        append(eventStore, "name", events(1));

        // When
        VersionConflictException exception = catchThrowableOfType(
                () -> eventStore.append("name", ExpectedVersion.noStream(), events(1)).orElseThrow(), VersionConflictException.class);

        // Then
        assertAll(
                () -> assertThat(exception).hasMessage("ExpectedVersion was not fulfilled for stream \"name\". Expected version no stream but was 0."),
                () -> assertThat(exception.streamId).isEqualTo("name"),
                () -> assertThat(exception.actualVersion).isEqualTo(0L),
                () -> assertThat(exception.conflict()).isEqualTo(new VersionConflict("name", ExpectedVersion.noStream(), 0))
        );
    }

    @Nested
    class EmptyAppend {

        @Test
        void validates_the_expected_version_without_writing_anything() {
            // Given
            append(eventStore, "name", events(2));

            // When
            AppendResult result = eventStore.append("name", ExpectedVersion.exactly(1), List.of());

            // Then
            assertAll(
                    () -> assertThat(result).isEqualTo(new AppendResult.Appended("name", List.of(), 1, -1)),
                    () -> assertThat(eventStore.headPosition()).isEqualTo(1L)
            );
        }

        @Test
        void returns_a_conflict_when_the_expected_version_is_not_fulfilled() {
            AppendResult result = eventStore.append("name", ExpectedVersion.exactly(3), List.of());

            assertThat(result).isEqualTo(new VersionConflict("name", ExpectedVersion.exactly(3), -1));
        }
    }

    @Test
    void only_one_of_many_concurrent_writers_with_the_same_expected_version_succeeds() {
        // Given
        append(eventStore, "name", events(1));
        List<AppendResult> results = new CopyOnWriteArrayList<>();

        // When
        Concurrently.run(16, writer -> results.add(eventStore.append("name", ExpectedVersion.exactly(0), events("writer" + writer, 2))));

        // Then
        assertThat(results).filteredOn(AppendResult::isSuccess).hasSize(1);
        assertThat(results).filteredOn(result -> !result.isSuccess())
                .hasSize(15)
                .allMatch(result -> ((VersionConflict) result).actual() == 2);
        assertThat(eventStore.currentVersion("name")).isEqualTo(2L);
    }
}
