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

package org.eventledger.eventstore.specification;

import org.eventledger.EventData;
import org.eventledger.RecordedEvent;
import org.eventledger.eventstore.api.AppendResult;
import org.eventledger.eventstore.api.EventStore;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import java.util.stream.LongStream;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Event fixtures. The payload of each event is a human readable label so that tests can identify events after reading them back.
 */
public final class TestEvents {
    public static final String TEST_EVENT_TYPE = "TestEvent";

    private TestEvents() {
    }

    public static EventData event(String label) {
        return EventData.of(TEST_EVENT_TYPE, label.getBytes(UTF_8));
    }

    /**
     * @return {@code count} events labeled {@code <prefix>-0}, {@code <prefix>-1} and so on
     */
    public static List<EventData> events(String prefix, int count) {
        return IntStream.range(0, count).mapToObj(i -> event(prefix + "-" + i)).collect(Collectors.toList());
    }

    public static List<EventData> events(int count) {
        return events("event", count);
    }

    public static String labelOf(RecordedEvent event) {
        return new String(event.payload(), UTF_8);
    }

    /**
     * Append {@code count} events, one per append, to {@code streamId}.
     */
    public static void appendOneByOne(EventStore eventStore, String streamId, int count) {
        for (int i = 0; i < count; i++) {
            eventStore.append(streamId, List.of(event(streamId + "-" + i))).orElseThrow();
        }
    }

    public static AppendResult.Appended append(EventStore eventStore, String streamId, List<EventData> events) {
        return eventStore.append(streamId, events).orElseThrow();
    }

    /**
     * @return The positions {@code 0..count-1}
     */
    public static List<Long> positions(long count) {
        return LongStream.range(0, count).boxed().collect(Collectors.toList());
    }

    public static List<Long> globalPositionsOf(List<RecordedEvent> events) {
        return events.stream().map(RecordedEvent::globalPosition).collect(Collectors.toList());
    }

    public static List<Long> streamPositionsOf(List<RecordedEvent> events) {
        return events.stream().map(RecordedEvent::streamPosition).collect(Collectors.toList());
    }
}
