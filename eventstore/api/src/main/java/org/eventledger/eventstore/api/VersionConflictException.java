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

import org.eventledger.eventstore.api.AppendResult.VersionConflict;

import java.util.Objects;
import java.util.StringJoiner;

/**
 * The expected version was not fulfilled so events have not been written to the event store.
 * In a typical scenario, if an application reads and writes stream A from two different places at the same time,
 * this is effectively the same as an optimistic locking exception and a retry is appropriate.
 * <p>
 * Only thrown by {@link AppendResult#orElseThrow()}, the event store itself returns a {@link VersionConflict}.
 */
public class VersionConflictException extends RuntimeException {
    public final String streamId;
    public final ExpectedVersion expectedVersion;
    public final long actualVersion;

    public VersionConflictException(VersionConflict conflict) {
        super(String.format("%s was not fulfilled for stream \"%s\". Expected version %s but was %s.",
                ExpectedVersion.class.getSimpleName(), conflict.streamId(), conflict.expected(), conflict.actual()));
        this.streamId = conflict.streamId();
        this.expectedVersion = conflict.expected();
        this.actualVersion = conflict.actual();
    }

    public VersionConflict conflict() {
        return new VersionConflict(streamId, expectedVersion, actualVersion);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof VersionConflictException)) return false;
        VersionConflictException that = (VersionConflictException) o;
        return actualVersion == that.actualVersion && Objects.equals(streamId, that.streamId) && Objects.equals(expectedVersion, that.expectedVersion);
    }

    @Override
    public int hashCode() {
        return Objects.hash(streamId, expectedVersion, actualVersion);
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", VersionConflictException.class.getSimpleName() + "[", "]")
                .add("streamId='" + streamId + "'")
                .add("expectedVersion=" + expectedVersion)
                .add("actualVersion=" + actualVersion)
                .toString();
    }
}
