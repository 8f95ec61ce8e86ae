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

import org.eventledger.RecordedEvent;
import org.eventledger.eventstore.api.ReadDirection;
import org.eventledger.eventstore.api.ReadFrom;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.eventledger.eventstore.api.InvalidRangeException.requireValidCount;

/**
 * An append-only sequence of events indexed from {@code 0}. There may be one writer at a time (callers serialize writes)
 * and any number of readers that never lock.
 * <p>
 * Events are stored in fixed-size chunks so that appending never copies events. A batch is first stored and then made
 * visible by a single volatile write of the size, readers thus either see all events of a batch or none of them.
 */
class EventLog {
    private static final int CHUNK_SHIFT = 10;
    private static final int CHUNK_SIZE = 1 << CHUNK_SHIFT;
    private static final int CHUNK_MASK = CHUNK_SIZE - 1;

    private volatile RecordedEvent[][] chunks = new RecordedEvent[1][];
    private volatile long size = 0;

    /**
     * @return The number of visible events
     */
    long size() {
        return size;
    }

    /**
     * @return The index of the last visible event, or {@code -1} if empty
     */
    long lastIndex() {
        return size - 1;
    }

    void appendAll(List<RecordedEvent> events) {
        long index = size;
        RecordedEvent[][] current = chunks;
        for (RecordedEvent event : events) {
            int chunk = (int) (index >>> CHUNK_SHIFT);
            if (chunk == current.length) {
                current = Arrays.copyOf(current, current.length * 2);
            }
            if (current[chunk] == null) {
                current[chunk] = new RecordedEvent[CHUNK_SIZE];
            }
            current[chunk][(int) (index & CHUNK_MASK)] = event;
            index++;
        }
        chunks = current;
        size = index;
    }

    RecordedEvent get(long index) {
        long visible = size;
        if (index < 0 || index >= visible) {
            throw new IndexOutOfBoundsException("Index " + index + " is out of bounds for size " + visible);
        }
        return chunks[(int) (index >>> CHUNK_SHIFT)][(int) (index & CHUNK_MASK)];
    }

    /**
     * Read at most {@code maxCount} events starting at {@code from} (inclusive).
     *
     * @return The events in the requested direction, empty if {@code from} is after the last event.
     */
    List<RecordedEvent> read(ReadDirection direction, ReadFrom from, int maxCount) {
        return read(direction, from, maxCount, Long.MAX_VALUE);
    }

    /**
     * Like {@link #read(ReadDirection, ReadFrom, int)} but events after {@code lastIndex} are treated as if they didn't exist.
     */
    List<RecordedEvent> read(ReadDirection direction, ReadFrom from, int maxCount, long lastIndex) {
        requireValidCount(maxCount);
        long last = Math.min(size - 1, lastIndex);
        RecordedEvent[][] snapshot = chunks;
        long start = from.resolve(last);
        if (start < 0) {
            return Collections.emptyList();
        }

        final long end;
        final long step;
        if (direction == ReadDirection.FORWARD) {
            end = Math.min(last, start + maxCount - 1);
            step = 1;
        } else {
            end = Math.max(0, start - maxCount + 1);
            step = -1;
        }

        List<RecordedEvent> result = new ArrayList<>((int) (Math.abs(end - start) + 1));
        for (long index = start; step > 0 ? index <= end : index >= end; index += step) {
            result.add(snapshot[(int) (index >>> CHUNK_SHIFT)][(int) (index & CHUNK_MASK)]);
        }
        return Collections.unmodifiableList(result);
    }
}
