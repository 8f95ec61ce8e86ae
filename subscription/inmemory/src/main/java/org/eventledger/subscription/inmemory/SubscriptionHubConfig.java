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

import java.util.Objects;

/**
 * Configuration for {@link SubscriptionHub}
 */
public class SubscriptionHubConfig {
    public static final int DEFAULT_BUFFER_CAPACITY = 1024;
    public static final int DEFAULT_CATCH_UP_BATCH_SIZE = 256;

    public final int bufferCapacity;
    public final int catchUpBatchSize;

    /**
     * Create a new {@code SubscriptionHubConfig} with a buffer capacity of {@value #DEFAULT_BUFFER_CAPACITY} and
     * a catch-up batch size of {@value #DEFAULT_CATCH_UP_BATCH_SIZE}.
     */
    public SubscriptionHubConfig() {
        this(DEFAULT_BUFFER_CAPACITY, DEFAULT_CATCH_UP_BATCH_SIZE);
    }

    /**
     * @param bufferCapacity   The maximum number of live events that may be queued for a subscription that hasn't consumed them.
     *                         A subscription that falls further behind is closed with a {@code SubscriptionOverrun}.
     * @param catchUpBatchSize The number of historic events read from the event store at a time while a subscription is catching up.
     */
    public SubscriptionHubConfig(int bufferCapacity, int catchUpBatchSize) {
        if (bufferCapacity < 1) {
            throw new IllegalArgumentException("Buffer capacity must be greater than or equal to 1");
        } else if (catchUpBatchSize < 1) {
            throw new IllegalArgumentException("Catch-up batch size must be greater than or equal to 1");
        }
        this.bufferCapacity = bufferCapacity;
        this.catchUpBatchSize = catchUpBatchSize;
    }

    public SubscriptionHubConfig bufferCapacity(int bufferCapacity) {
        return new SubscriptionHubConfig(bufferCapacity, catchUpBatchSize);
    }

    public SubscriptionHubConfig catchUpBatchSize(int catchUpBatchSize) {
        return new SubscriptionHubConfig(bufferCapacity, catchUpBatchSize);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SubscriptionHubConfig)) return false;
        SubscriptionHubConfig that = (SubscriptionHubConfig) o;
        return bufferCapacity == that.bufferCapacity && catchUpBatchSize == that.catchUpBatchSize;
    }

    @Override
    public int hashCode() {
        return Objects.hash(bufferCapacity, catchUpBatchSize);
    }

    @Override
    public String toString() {
        return "SubscriptionHubConfig{" +
                "bufferCapacity=" + bufferCapacity +
                ", catchUpBatchSize=" + catchUpBatchSize +
                '}';
    }
}
