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

package org.eventledger.eventstore.api;

import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertAll;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class ReadFromTest {

    @Test
    void start_resolves_to_the_first_position_unless_empty() {
        assertAll(
                () -> assertThat(ReadFrom.start().resolve(10)).isZero(),
                () -> assertThat(ReadFrom.start().resolve(-1)).isEqualTo(-1L)
        );
    }

    @Test
    void end_resolves_to_the_last_position() {
        assertAll(
                () -> assertThat(ReadFrom.end().resolve(10)).isEqualTo(10L),
                () -> assertThat(ReadFrom.end().resolve(-1)).isEqualTo(-1L)
        );
    }

    @Test
    void position_after_the_last_position_resolves_to_nothing() {
        assertAll(
                () -> assertThat(ReadFrom.position(10).resolve(10)).isEqualTo(10L),
                () -> assertThat(ReadFrom.position(11).resolve(10)).isEqualTo(-1L)
        );
    }

    @Test
    void negative_position_is_an_invalid_range() {
        assertThatThrownBy(() -> ReadFrom.position(-1))
                .isExactlyInstanceOf(InvalidRangeException.class)
                .hasMessage("Position cannot be negative but was -1");
    }

    @Test
    void max_count_must_be_at_least_one() {
        assertAll(
                () -> assertThat(InvalidRangeException.requireValidCount(1)).isEqualTo(1),
                () -> assertThatThrownBy(() -> InvalidRangeException.requireValidCount(0)).isInstanceOf(IllegalArgumentException.class)
        );
    }
}
