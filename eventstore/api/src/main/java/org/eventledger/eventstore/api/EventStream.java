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

import org.eventledger.RecordedEvent;
import org.eventledger.StreamPosition;

import java.util.Iterator;
import java.util.List;
import java.util.StringJoiner;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static java.util.Objects.requireNonNull;

/**
 * A snapshot of all events of a stream, typically used to rebuild the state of an entity.
 *
 * @param id      The id of the event stream
 * @param version The version of the stream at the time it was read, {@code -1} if the stream is empty
 * @param events  The events, in stream order
 */
public record EventStream(String id, long version, List<RecordedEvent> events) implements Iterable<RecordedEvent> {

    public EventStream {
        requireNonNull(id, "Stream id cannot be null");
        requireNonNull(events, "Events cannot be null");
        events = List.copyOf(events);
    }

    public static EventStream empty(String streamId) {
        return new EventStream(streamId, StreamPosition.NO_STREAM, List.of());
    }

    /**
     * @return {@code true} if event stream is empty, {@code false} otherwise.
     */
    public boolean isEmpty() {
        return version == StreamPosition.NO_STREAM;
    }

    @Override
    public Iterator<RecordedEvent> iterator() {
        return events.iterator();
    }

    public Stream<RecordedEvent> stream() {
        return events.stream();
    }

    /**
     * Apply a mapping function to each event, for example to deserialize the payload.
     */
    public <T> List<T> map(Function<RecordedEvent, T> fn) {
        return events.stream().map(fn).collect(Collectors.toList());
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", EventStream.class.getSimpleName() + "[", "]")
                .add("id='" + id + "'")
                .add("version=" + version)
                .add("events=" + events.size())
                .toString();
    }
}
