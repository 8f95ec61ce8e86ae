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

import java.time.Instant;
import java.util.UUID;

/**
 * An event whose stream position has been reserved but that doesn't have a global position yet.
 */
record PendingEvent(UUID eventId, String streamId, long streamPosition, EventData data, Instant timestamp) {

    RecordedEvent at(long globalPosition) {
        return RecordedEvent.record(eventId, streamId, streamPosition, globalPosition, data, timestamp);
    }
}
