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

import org.eventledger.subscription.inmemory.SubscriptionHubConfig;

import java.time.Clock;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Configuration for {@link InMemoryEventStore}
 */
public class InMemoryEventStoreConfig {

    public final Clock clock;
    public final Supplier<UUID> eventIdGenerator;
    public final SubscriptionHubConfig subscriptionHubConfig;

    /**
     * Create a new {@code InMemoryEventStoreConfig} that uses the system UTC clock, random UUIDs as event ids and
     * the default {@link SubscriptionHubConfig}.
     */
    public InMemoryEventStoreConfig() {
        this(Clock.systemUTC(), UUID::randomUUID, new SubscriptionHubConfig());
    }

    /**
     * @param clock                 The clock used to timestamp events when they're appended
     * @param eventIdGenerator      Generates the id of each appended event
     * @param subscriptionHubConfig Configures buffering and catch-up of subscriptions
     */
    public InMemoryEventStoreConfig(Clock clock, Supplier<UUID> eventIdGenerator, SubscriptionHubConfig subscriptionHubConfig) {
        Objects.requireNonNull(clock, Clock.class.getSimpleName() + " cannot be null");
        Objects.requireNonNull(eventIdGenerator, "Event id generator cannot be null");
        Objects.requireNonNull(subscriptionHubConfig, SubscriptionHubConfig.class.getSimpleName() + " cannot be null");
        this.clock = clock;
        this.eventIdGenerator = eventIdGenerator;
        this.subscriptionHubConfig = subscriptionHubConfig;
    }

    public InMemoryEventStoreConfig clock(Clock clock) {
        return new InMemoryEventStoreConfig(clock, eventIdGenerator, subscriptionHubConfig);
    }

    public InMemoryEventStoreConfig eventIdGenerator(Supplier<UUID> eventIdGenerator) {
        return new InMemoryEventStoreConfig(clock, eventIdGenerator, subscriptionHubConfig);
    }

    public InMemoryEventStoreConfig subscriptionHubConfig(SubscriptionHubConfig subscriptionHubConfig) {
        return new InMemoryEventStoreConfig(clock, eventIdGenerator, subscriptionHubConfig);
    }

    /**
     * Shorthand for changing the {@link SubscriptionHubConfig#bufferCapacity} of the {@link #subscriptionHubConfig}.
     */
    public InMemoryEventStoreConfig subscriptionBufferCapacity(int bufferCapacity) {
        return subscriptionHubConfig(subscriptionHubConfig.bufferCapacity(bufferCapacity));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof InMemoryEventStoreConfig)) return false;
        InMemoryEventStoreConfig that = (InMemoryEventStoreConfig) o;
        return Objects.equals(clock, that.clock) && Objects.equals(eventIdGenerator, that.eventIdGenerator) && Objects.equals(subscriptionHubConfig, that.subscriptionHubConfig);
    }

    @Override
    public int hashCode() {
        return Objects.hash(clock, eventIdGenerator, subscriptionHubConfig);
    }

    @Override
    public String toString() {
        return "InMemoryEventStoreConfig{" +
                "clock=" + clock +
                ", eventIdGenerator=" + eventIdGenerator +
                ", subscriptionHubConfig=" + subscriptionHubConfig +
                '}';
    }
}
