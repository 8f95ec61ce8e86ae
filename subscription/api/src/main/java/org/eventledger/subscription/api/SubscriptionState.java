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

/**
 * The life-cycle of a {@link Subscription}: {@code CATCHING_UP -> LIVE -> CLOSED}. A subscription may also be closed
 * while catching up. {@code CLOSED} is terminal.
 */
public enum SubscriptionState {
    CATCHING_UP,
    LIVE,
    CLOSED;

    public boolean canTransitionTo(SubscriptionState next) {
        switch (this) {
            case CATCHING_UP:
                return next == LIVE || next == CLOSED;
            case LIVE:
                return next == CLOSED;
            default:
                return false;
        }
    }
}
