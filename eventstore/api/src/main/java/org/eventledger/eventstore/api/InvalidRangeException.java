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

/**
 * Thrown when a read is requested with a count or position that can never be valid, for example a negative position
 * or a {@code maxCount} less than one. Reading past the end of a stream is <i>not</i> invalid, it yields an empty result.
 */
public class InvalidRangeException extends IllegalArgumentException {

    public InvalidRangeException(String message) {
        super(message);
    }

    /**
     * @throws InvalidRangeException if {@code maxCount} is less than {@code 1}
     */
    public static int requireValidCount(int maxCount) {
        if (maxCount < 1) {
            throw new InvalidRangeException("maxCount must be greater than or equal to 1 but was " + maxCount);
        }
        return maxCount;
    }
}
