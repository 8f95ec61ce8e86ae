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
import java.util.Collections;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * The store-wide order of all events. Global positions are assigned while holding the {@link #sequencer()}, which is the only
 * point where writers to different streams are serialized. Reads don't lock.
 * <p>
 * Appended events stay invisible until they are {@link #commit(long) committed}. The committed position is the watermark that
 * the stream reads are capped at as well, so that an event becomes visible in the global log and in its stream at once.
 */
class GlobalLog {

    private final ReentrantLock sequencer = new ReentrantLock();
    private final EventLog events = new EventLog();
    private volatile long committedPosition = -1;

    /**
     * @return The lock that must be held while calling {@link #append(List)} and {@link #commit(long)}
     */
    ReentrantLock sequencer() {
        return sequencer;
    }

    /**
     * Assign the next contiguous global positions to the events, in the given order, and store them. The events are not
     * visible to readers until they're {@link #commit(long) committed}.
     *
     * @return The recorded events
     * @throws IllegalStateException If the calling thread doesn't hold the {@link #sequencer()}
     */
    List<RecordedEvent> append(List<PendingEvent> pendingEvents) {
        requireSequencer();
        if (pendingEvents.isEmpty()) {
            return Collections.emptyList();
        }

        long nextPosition = events.size();
        List<RecordedEvent> recorded = new ArrayList<>(pendingEvents.size());
        for (PendingEvent pendingEvent : pendingEvents) {
            recorded.add(pendingEvent.at(nextPosition++));
        }
        events.appendAll(recorded);
        return Collections.unmodifiableList(recorded);
    }

    /**
     * Make all events up to and including {@code globalPosition} visible.
     *
     * @throws IllegalStateException If the calling thread doesn't hold the {@link #sequencer()} or the position hasn't been appended
     */
    void commit(long globalPosition) {
        requireSequencer();
        if (globalPosition < committedPosition || globalPosition > events.lastIndex()) {
            throw new IllegalStateException("Internal error: cannot commit global position " + globalPosition + ", committed position is " + committedPosition + " and last appended is " + events.lastIndex());
        }
        committedPosition = globalPosition;
    }

    /**
     * @return The global position of the last committed event, {@code -1} if nothing is committed
     */
    long headPosition() {
        return committedPosition;
    }

    List<RecordedEvent> readAllForwards(ReadFrom from, int maxCount) {
        return read(ReadDirection.FORWARD, from, maxCount);
    }

    List<RecordedEvent> readAllBackwards(ReadFrom from, int maxCount) {
        return read(ReadDirection.BACKWARD, from, maxCount);
    }

    List<RecordedEvent> read(ReadDirection direction, ReadFrom from, int maxCount) {
        return events.read(direction, from, maxCount, committedPosition);
    }

    private void requireSequencer() {
        if (!sequencer.isHeldByCurrentThread()) {
            throw new IllegalStateException("Internal error: global positions can only be assigned while holding the sequencer");
        }
    }
}
