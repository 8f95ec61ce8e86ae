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

package org.eventledger;

import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class StreamIdTest {

    @Test
    void stream_id_of_an_entity_is_entity_type_and_entity_id_separated_by_dash() {
        assertThat(StreamId.forEntity("cart", EntityId.of("1"))).isEqualTo(StreamId.of("cart-1"));
    }

    @Test
    void derivation_is_deterministic() {
        EntityId entityId = EntityId.random();

        assertThat(StreamId.forEntity("order", entityId)).isEqualTo(StreamId.forEntity("order", entityId));
    }

    @Test
    void entity_type_cannot_contain_the_separator() {
        assertThatThrownBy(() -> StreamId.forEntity("shopping-cart", EntityId.of("1")))
                .isExactlyInstanceOf(IllegalArgumentException.class)
                .hasMessage("Entity type cannot contain '-' but was \"shopping-cart\"");
    }

    @ParameterizedTest
    @ValueSource(strings = {"", " ", "\t"})
    void blank_values_are_rejected(String blank) {
        assertThatThrownBy(() -> StreamId.of(blank)).isExactlyInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> EntityId.of(blank)).isExactlyInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> StreamId.forEntity(blank, EntityId.of("1"))).isExactlyInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void to_string_is_the_value() {
        assertThat(StreamId.of("cart-1")).hasToString("cart-1");
    }
}
