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
 * Positions of events within a single stream. The first event in a stream has position {@value #START},
 * the next one {@code 1} and so on, without gaps. The position of the last event is also the version of the stream.
 */
public final class StreamPosition {

    /**
     * The position of the first event in a stream
     */
    public static final long START = 0;

    /**
     * The version of a stream that has never been written to
     */
    public static final long NO_STREAM = -1;

    private StreamPosition() {
    }

    public static boolean isValid(long position) {
        return position >= START;
    }
}
