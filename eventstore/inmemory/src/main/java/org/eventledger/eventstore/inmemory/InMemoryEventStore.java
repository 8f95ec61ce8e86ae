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

import org.eventledger.EventData;
import org.eventledger.RecordedEvent;
import org.eventledger.eventstore.api.AppendResult;
import org.eventledger.eventstore.api.AppendResult.Appended;
import org.eventledger.eventstore.api.AppendResult.VersionConflict;
import org.eventledger.eventstore.api.EventStore;
import org.eventledger.eventstore.api.EventStream;
import org.eventledger.eventstore.api.ExpectedVersion;
import org.eventledger.eventstore.api.ReadDirection;
import org.eventledger.eventstore.api.ReadFrom;
import org.eventledger.subscription.api.StartAt;
import org.eventledger.subscription.api.Subscription;
import org.eventledger.subscription.api.SubscriptionScope;
import org.eventledger.subscription.inmemory.SubscriptionHub;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;
import static org.eventledger.eventstore.api.InvalidRangeException.requireValidCount;

/**
 * This is an {@link EventStore} that stores events in-memory.
 * <p>
 * Appending to a stream takes the lock of that stream only, so writers to different streams run in parallel. The expected
 * version is checked under the stream lock, after which the store-wide sequencer is held just long enough to assign global
 * positions, store the events in the global log and in the stream, and enqueue them to subscribers. Readers never lock.
 * <p>
 * A batch becomes visible to readers of the global log and of its stream at the same time, when the global log's committed
 * position is moved past it.
 */
public class InMemoryEventStore implements EventStore {
    private static final Logger log = LoggerFactory.getLogger(InMemoryEventStore.class);

    private final GlobalLog globalLog = new GlobalLog();
    private final StreamIndex streamIndex = new StreamIndex(globalLog::headPosition);
    private final SubscriptionHub subscriptionHub;
    private final InMemoryEventStoreConfig config;

    private volatile boolean closed = false;

    /**
     * Create an instance of {@link InMemoryEventStore} with the default {@link InMemoryEventStoreConfig}
     */
    public InMemoryEventStore() {
        this(new InMemoryEventStoreConfig());
    }

    public InMemoryEventStore(InMemoryEventStoreConfig config) {
        if (config == null) {
            throw new IllegalArgumentException(InMemoryEventStoreConfig.class.getSimpleName() + " cannot be null");
        }
        this.config = config;
        this.subscriptionHub = new SubscriptionHub(this, config.subscriptionHubConfig);
    }

    @Override
    public AppendResult append(String streamId, ExpectedVersion expectedVersion, List<EventData> events) {
        requireValidStreamId(streamId);
        requireNonNull(expectedVersion, ExpectedVersion.class.getSimpleName() + " cannot be null");
        requireNonNull(events, "Events cannot be null");
        List<EventData> eventsToAppend = List.copyOf(events);
        requireTrue(!closed, "Cannot append to a closed event store");

        // Generated before taking any lock. If a collaborator fails nothing has been written.
        List<UUID> eventIds = eventsToAppend.stream().map(__ -> requireNonNull(config.eventIdGenerator.get(), "Generated event id cannot be null")).collect(Collectors.toList());
        Instant timestamp = eventsToAppend.isEmpty() ? null : requireNonNull(config.clock.instant(), "Clock returned null");

        ReentrantLock streamLock = streamIndex.lock(streamId);
        try {
            VersionConflict conflict = streamIndex.checkVersion(streamId, expectedVersion);
            if (conflict != null) {
                log.debug("Rejected append to stream {}, expected version {} but was {}", streamId, expectedVersion, conflict.actual());
                return conflict;
            }

            long currentVersion = streamIndex.currentVersion(streamId);
            if (eventsToAppend.isEmpty()) {
                return new Appended(streamId, Collections.emptyList(), currentVersion, -1);
            }

            List<PendingEvent> pendingEvents = new ArrayList<>(eventsToAppend.size());
            for (int i = 0; i < eventsToAppend.size(); i++) {
                pendingEvents.add(new PendingEvent(eventIds.get(i), streamId, currentVersion + 1 + i, eventsToAppend.get(i), timestamp));
            }

            List<RecordedEvent> recordedEvents = commit(streamId, pendingEvents);
            RecordedEvent last = recordedEvents.get(recordedEvents.size() - 1);
            log.debug("Appended {} event(s) to stream {}, stream version is now {} and global position {}", recordedEvents.size(), streamId, last.streamPosition(), last.globalPosition());
            return new Appended(streamId, recordedEvents.stream().map(RecordedEvent::streamPosition).collect(Collectors.toList()), last.streamPosition(), last.globalPosition());
        } finally {
            streamIndex.unlock(streamId, streamLock);
        }
    }

    // Caller must hold the stream lock
    private List<RecordedEvent> commit(String streamId, List<PendingEvent> pendingEvents) {
        ReentrantLock sequencer = globalLog.sequencer();
        sequencer.lock();
        try {
            List<RecordedEvent> recordedEvents = globalLog.append(pendingEvents);
            streamIndex.store(streamId, recordedEvents);
            // Nothing of the batch is visible before this
            globalLog.commit(recordedEvents.get(recordedEvents.size() - 1).globalPosition());
            subscriptionHub.publish(recordedEvents);
            return recordedEvents;
        } finally {
            sequencer.unlock();
        }
    }

    @Override
    public List<RecordedEvent> readStream(String streamId, ReadDirection direction, ReadFrom from, int maxCount) {
        requireValidStreamId(streamId);
        requireNonNull(direction, ReadDirection.class.getSimpleName() + " cannot be null");
        requireNonNull(from, ReadFrom.class.getSimpleName() + " cannot be null");
        requireValidCount(maxCount);
        return streamIndex.read(streamId, direction, from, maxCount);
    }

    @Override
    public List<RecordedEvent> readAll(ReadDirection direction, ReadFrom from, int maxCount) {
        requireNonNull(direction, ReadDirection.class.getSimpleName() + " cannot be null");
        requireNonNull(from, ReadFrom.class.getSimpleName() + " cannot be null");
        requireValidCount(maxCount);
        return globalLog.read(direction, from, maxCount);
    }

    @Override
    public EventStream readStream(String streamId) {
        requireValidStreamId(streamId);
        List<RecordedEvent> events = streamIndex.read(streamId, ReadDirection.FORWARD, ReadFrom.start(), Integer.MAX_VALUE);
        if (events.isEmpty()) {
            return EventStream.empty(streamId);
        }
        return new EventStream(streamId, events.get(events.size() - 1).streamPosition(), events);
    }

    @Override
    public long currentVersion(String streamId) {
        requireValidStreamId(streamId);
        return streamIndex.currentVersion(streamId);
    }

    @Override
    public long headPosition() {
        return globalLog.headPosition();
    }

    @Override
    public Subscription subscribe(SubscriptionScope scope, StartAt startAt) {
        requireTrue(!closed, "Cannot subscribe to a closed event store");
        return subscriptionHub.subscribe(scope, startAt);
    }

    /**
     * @return The number of open subscriptions
     */
    public int activeSubscriptions() {
        return subscriptionHub.activeSubscriptions();
    }

    /**
     * Close all subscriptions. The events remain readable but no more events can be appended.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        subscriptionHub.shutdown();
        log.info("In-memory event store closed with {} event(s)", globalLog.headPosition() + 1);
    }

    private static void requireValidStreamId(String streamId) {
        requireNonNull(streamId, "Stream id cannot be null");
        if (streamId.isBlank()) {
            throw new IllegalArgumentException("Stream id cannot be blank");
        }
    }

    private static void requireTrue(boolean bool, String message) {
        if (!bool) {
            throw new IllegalStateException(message);
        }
    }
}
