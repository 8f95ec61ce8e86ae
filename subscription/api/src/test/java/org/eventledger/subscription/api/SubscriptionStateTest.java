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

package org.eventledger.subscription.api;

import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.eventledger.subscription.api.SubscriptionState.CATCHING_UP;
import static org.eventledger.subscription.api.SubscriptionState.CLOSED;
import static org.eventledger.subscription.api.SubscriptionState.LIVE;
import static org.junit.jupiter.api.Assertions.assertAll;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class SubscriptionStateTest {

    @Test
    void catching_up_can_go_live_or_be_closed() {
        assertAll(
                () -> assertThat(CATCHING_UP.canTransitionTo(LIVE)).isTrue(),
                () -> assertThat(CATCHING_UP.canTransitionTo(CLOSED)).isTrue()
        );
    }

    @Test
    void live_can_only_be_closed() {
        assertAll(
                () -> assertThat(LIVE.canTransitionTo(CLOSED)).isTrue(),
                () -> assertThat(LIVE.canTransitionTo(CATCHING_UP)).isFalse()
        );
    }

    @Test
    void closed_is_terminal() {
        for (SubscriptionState next : SubscriptionState.values()) {
            assertThat(CLOSED.canTransitionTo(next)).isFalse();
        }
    }

    @Test
    void start_at_position_cannot_be_negative() {
        assertAll(
                () -> assertThat(StartAt.beginning()).isEqualTo(StartAt.position(0)),
                () -> assertThat(StartAt.now().isNow()).isTrue(),
                () -> assertThatThrownBy(() -> StartAt.position(-1))
                        .isExactlyInstanceOf(IllegalArgumentException.class)
                        .hasMessage("Start position cannot be negative but was -1")
        );
    }
}
