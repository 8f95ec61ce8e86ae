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

package org.eventledger.subscription.inmemory;

import org.eventledger.RecordedEvent;
import org.eventledger.eventstore.api.EventStoreQueries;
import org.eventledger.eventstore.api.EventStream;
import org.eventledger.eventstore.api.ReadDirection;
import org.eventledger.eventstore.api.ReadFrom;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Event store reads backed by a list, that also counts the reads. Events are "committed" with {@link #commit(String, String...)}
 * which doesn't publish them, so tests decide what is published to the hub.
 */
class RecordingEventStoreQueries implements EventStoreQueries {
    private final List<RecordedEvent> events = new CopyOnWriteArrayList<>();
    final AtomicInteger reads = new AtomicInteger();

    synchronized List<RecordedEvent> commit(String streamId, String... labels) {
        List<RecordedEvent> committed = new ArrayList<>();
        long streamPosition = currentVersion(streamId);
        for (String label : labels) {
            RecordedEvent event = new RecordedEvent(UUID.randomUUID(), streamId, ++streamPosition, events.size(), "Test", label.getBytes(UTF_8), new byte[0], Instant.now());
            events.add(event);
            committed.add(event);
        }
        return committed;
    }

    @Override
    public List<RecordedEvent> readStream(String streamId, ReadDirection direction, ReadFrom from, int maxCount) {
        reads.incrementAndGet();
        return read(events.stream().filter(e -> e.streamId().equals(streamId)).collect(Collectors.toList()), direction, from, maxCount);
    }

    @Override
    public List<RecordedEvent> readAll(ReadDirection direction, ReadFrom from, int maxCount) {
        reads.incrementAndGet();
        return read(new ArrayList<>(events), direction, from, maxCount);
    }

    @Override
    public long currentVersion(String streamId) {
        return events.stream().filter(e -> e.streamId().equals(streamId)).count() - 1;
    }

    @Override
    public long headPosition() {
        return events.size() - 1;
    }

    @Override
    public EventStream readStream(String streamId) {
        List<RecordedEvent> stream = readStream(streamId, ReadDirection.FORWARD, ReadFrom.start(), Integer.MAX_VALUE);
        return stream.isEmpty() ? EventStream.empty(streamId) : new EventStream(streamId, stream.size() - 1, stream);
    }

    private static List<RecordedEvent> read(List<RecordedEvent> events, ReadDirection direction, ReadFrom from, int maxCount) {
        long start = from.resolve(events.size() - 1);
        if (start < 0) {
            return Collections.emptyList();
        }
        List<RecordedEvent> result = new ArrayList<>();
        for (long i = start; i >= 0 && i < events.size() && result.size() < maxCount; i += direction == ReadDirection.FORWARD ? 1 : -1) {
            result.add(events.get((int) i));
        }
        return result;
    }
}
