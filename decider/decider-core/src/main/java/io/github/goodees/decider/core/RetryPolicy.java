package io.github.goodees.decider.core;

/*-
 * #%L
 * decider
 * %%
 * Copyright (C) 2017 - 2018 Patrik Duditš
 * %%
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * 
 *      http://www.apache.org/licenses/LICENSE-2.0
 * 
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 * #L%
 */

import io.github.goodees.decider.core.store.StreamStoreException;

/**
 * Decides whether a transaction that lost the race for an append should be decided again on fresh state.
 */
@FunctionalInterface
public interface RetryPolicy {
    int DEFAULT_MAX_RETRIES = 3;

    /**
     * @param streamId the stream
     * @param conflict the conflict reported by the store
     * @param completedAttempts number of appends attempted so far, at least {@code 1}
     * @return true to reload and decide again
     */
    boolean shouldRetry(StreamId streamId, StreamStoreException conflict, int completedAttempts);

    /**
     * Retry at most {@code maxRetries} times, which results in at most {@code maxRetries + 1} appends.
     * @param maxRetries number of retries, not negative
     * @return the policy
     */
    static RetryPolicy maxRetries(int maxRetries) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("Retry count cannot be negative, was " + maxRetries);
        }
        return (streamId, conflict, completedAttempts) -> completedAttempts <= maxRetries;
    }

    static RetryPolicy never() {
        return maxRetries(0);
    }

    static RetryPolicy defaultPolicy() {
        return maxRetries(DEFAULT_MAX_RETRIES);
    }
}
