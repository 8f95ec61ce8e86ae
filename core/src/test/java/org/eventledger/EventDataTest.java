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

import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.UUID;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertAll;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class EventDataTest {

    @Test
    void payload_and_metadata_are_copied() {
        // Given
        byte[] payload = "payload".getBytes(UTF_8);
        byte[] metadata = "metadata".getBytes(UTF_8);
        EventData eventData = EventData.of("Type", payload, metadata);

        // When
        payload[0] = 'X';
        eventData.metadata()[0] = 'X';

        // Then
        assertThat(eventData).isEqualTo(EventData.of("Type", "payload".getBytes(UTF_8), "metadata".getBytes(UTF_8)));
    }

    @Test
    void metadata_is_empty_when_not_specified() {
        assertThat(EventData.of("Type", new byte[]{1}).metadata()).isEmpty();
    }

    @Test
    void type_cannot_be_blank() {
        assertThatThrownBy(() -> EventData.of(" ", new byte[0]))
                .isExactlyInstanceOf(IllegalArgumentException.class)
                .hasMessage("Event type cannot be blank");
    }

    @Test
    void recorded_event_keeps_the_event_data() {
        // Given
        EventData eventData = EventData.of("Type", "payload".getBytes(UTF_8), "metadata".getBytes(UTF_8));
        UUID eventId = UUID.randomUUID();
        Instant now = Instant.now();

        // When
        RecordedEvent recordedEvent = RecordedEvent.record(eventId, "stream", 1, 5, eventData, now);

        // Then
        assertThat(recordedEvent).isEqualTo(new RecordedEvent(eventId, "stream", 1, 5, "Type", "payload".getBytes(UTF_8), "metadata".getBytes(UTF_8), now));
    }

    @Test
    void recorded_event_shares_no_mutable_bytes_with_its_callers() {
        // Given
        byte[] payload = "payload".getBytes(UTF_8);
        EventData eventData = EventData.of("Type", payload);
        RecordedEvent recordedEvent = RecordedEvent.record(UUID.randomUUID(), "stream", 0, 0, eventData, Instant.now());

        // When
        payload[0] = 'X';
        recordedEvent.payload()[1] = 'X';
        eventData.payload()[2] = 'X';

        // Then
        assertAll(
                () -> assertThat(recordedEvent.payload()).isEqualTo("payload".getBytes(UTF_8)),
                () -> assertThat(eventData.payload()).isEqualTo("payload".getBytes(UTF_8))
        );
    }

    @Test
    void recorded_event_cannot_have_negative_positions() {
        assertThatThrownBy(() -> RecordedEvent.record(UUID.randomUUID(), "stream", -1, 0, EventData.of("Type", new byte[0]), Instant.now()))
                .isExactlyInstanceOf(IllegalArgumentException.class)
                .hasMessage("Stream position cannot be negative but was -1");
    }
}
