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

/**
 * Positions of events in the global log, i.e. the order in which events from all streams were committed.
 */
public final class GlobalPosition {

    public static final long START = 0;

    /**
     * The head position of an event store that doesn't contain any events
     */
    public static final long NONE = -1;

    private GlobalPosition() {
    }

    public static boolean isValid(long position) {
        return position >= START;
    }
}
