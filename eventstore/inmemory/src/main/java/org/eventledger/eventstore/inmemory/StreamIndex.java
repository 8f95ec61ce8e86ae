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
import org.eventledger.StreamPosition;
import org.eventledger.eventstore.api.AppendResult;
import org.eventledger.eventstore.api.AppendResult.VersionConflict;
import org.eventledger.eventstore.api.ExpectedVersion;
import org.eventledger.eventstore.api.ReadDirection;
import org.eventledger.eventstore.api.ReadFrom;
import org.jspecify.annotations.Nullable;

import java.util.Collections;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;
import java.util.stream.Collectors;

import static org.eventledger.eventstore.api.InvalidRangeException.requireValidCount;

/**
 * Per-stream storage. Each stream has its own {@link ReentrantLock} that writers hold while checking the expected version
 * and storing events, so that writers to different streams never wait for each other. Reads don't lock.
 * <p>
 * Reads only see events at or below the committed global position, stored events above it belong to a batch that is
 * still being committed.
 */
class StreamIndex {

    private final ConcurrentMap<String, Stream> streams = new ConcurrentHashMap<>();
    private final LongSupplier committedGlobalPosition;

    StreamIndex() {
        this(() -> Long.MAX_VALUE);
    }

    /**
     * @param committedGlobalPosition Supplies the global position of the last committed event
     */
    StreamIndex(LongSupplier committedGlobalPosition) {
        this.committedGlobalPosition = committedGlobalPosition;
    }

    /**
     * @return The position of the last event in the stream, {@code -1} if it has never been written to.
     */
    long currentVersion(String streamId) {
        Stream stream = streams.get(streamId);
        return stream == null ? StreamPosition.NO_STREAM : lastVisibleIndex(stream);
    }

    /**
     * Acquire the lock that guards writes to the given stream. Must be released with {@link #unlock(String, ReentrantLock)}.
     *
     * @return The acquired lock
     */
    ReentrantLock lock(String streamId) {
        while (true) {
            Stream stream = streams.computeIfAbsent(streamId, __ -> new Stream());
            stream.lock.lock();
            if (streams.get(streamId) == stream) {
                return stream.lock;
            }
            // Removed by unlock after we looked it up
            stream.lock.unlock();
        }
    }

    /**
     * Release a lock acquired by {@link #lock(String)}. A stream that is still empty, e.g. after a version conflict, is forgotten.
     */
    void unlock(String streamId, ReentrantLock lock) {
        try {
            Stream stream = streams.get(streamId);
            if (stream != null && stream.lock == lock && stream.events.size() == 0) {
                streams.remove(streamId, stream);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return The number of streams that are known to the index
     */
    int streamCount() {
        return streams.size();
    }

    /**
     * Check the expected version of a stream. The caller must hold the {@link #lock(String) stream lock} for the result
     * to remain valid until the events are {@link #store(String, List) stored}.
     *
     * @return {@code null} if the expectation is fulfilled, the {@link VersionConflict} otherwise.
     */
    @Nullable VersionConflict checkVersion(String streamId, ExpectedVersion expectedVersion) {
        long currentVersion = currentVersion(streamId);
        if (expectedVersion.isSatisfiedBy(currentVersion)) {
            return null;
        }
        return new VersionConflict(streamId, expectedVersion, currentVersion);
    }

    /**
     * Store events at the end of a stream. The caller must hold the {@link #lock(String) stream lock}.
     *
     * @throws IllegalStateException If the stream positions of the events don't continue the stream without gaps
     */
    void store(String streamId, List<RecordedEvent> events) {
        if (events.isEmpty()) {
            return;
        }
        Stream stream = streams.computeIfAbsent(streamId, __ -> new Stream());
        long expectedPosition = stream.events.size();
        for (RecordedEvent event : events) {
            if (!streamId.equals(event.streamId()) || event.streamPosition() != expectedPosition) {
                throw new IllegalStateException("Internal error: event " + event + " cannot be stored at position " + expectedPosition + " of stream " + streamId);
            }
            expectedPosition++;
        }
        stream.events.appendAll(events);
    }

    /**
     * Check the expected version and store the events as one atomic unit.
     *
     * @return {@link AppendResult.Appended} with the stream positions of the events or the {@link VersionConflict}
     */
    AppendResult append(String streamId, ExpectedVersion expectedVersion, List<RecordedEvent> events) {
        ReentrantLock lock = lock(streamId);
        try {
            VersionConflict conflict = checkVersion(streamId, expectedVersion);
            if (conflict != null) {
                return conflict;
            }
            store(streamId, events);
            List<Long> positions = events.stream().map(RecordedEvent::streamPosition).collect(Collectors.toList());
            long lastGlobalPosition = events.isEmpty() ? -1 : events.get(events.size() - 1).globalPosition();
            return new AppendResult.Appended(streamId, positions, currentVersion(streamId), lastGlobalPosition);
        } finally {
            unlock(streamId, lock);
        }
    }

    List<RecordedEvent> readForwards(String streamId, ReadFrom from, int maxCount) {
        return read(streamId, ReadDirection.FORWARD, from, maxCount);
    }

    List<RecordedEvent> readBackwards(String streamId, ReadFrom from, int maxCount) {
        return read(streamId, ReadDirection.BACKWARD, from, maxCount);
    }

    List<RecordedEvent> read(String streamId, ReadDirection direction, ReadFrom from, int maxCount) {
        requireValidCount(maxCount);
        Stream stream = streams.get(streamId);
        if (stream == null) {
            return Collections.emptyList();
        }
        return stream.events.read(direction, from, maxCount, lastVisibleIndex(stream));
    }

    // Events above the watermark were stored after it was read, so they're all at the end of the stream
    private long lastVisibleIndex(Stream stream) {
        long committed = committedGlobalPosition.getAsLong();
        long index = stream.events.lastIndex();
        while (index >= 0 && stream.events.get(index).globalPosition() > committed) {
            index--;
        }
        return index;
    }

    private static class Stream {
        private final ReentrantLock lock = new ReentrantLock();
        private final EventLog events = new EventLog();
    }
}
