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

import org.eventledger.eventstore.api.EventStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;

/**
 * Base class of the contract suites that every {@link EventStore} implementation must pass. Extend a suite in the test
 * sources of the implementation and return a new, empty event store from {@link #newEventStore()}.
 */
public abstract class EventStoreSpecification {

    protected EventStore eventStore;

    /**
     * @return A new, empty, event store. It's closed after each test.
     */
    protected abstract EventStore newEventStore();

    @BeforeEach
    void create_event_store() {
        eventStore = newEventStore();
    }

    @AfterEach
    void close_event_store() {
        eventStore.close();
    }
}
