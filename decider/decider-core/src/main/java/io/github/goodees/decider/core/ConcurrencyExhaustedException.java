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
 * Transaction kept conflicting with concurrent writers until its retry policy gave up. Unlike
 * {@link DomainRuleViolationException} the request itself may be fine, and can be issued again later.
 */
public class ConcurrencyExhaustedException extends Exception {
    private final StreamId streamId;
    private final int attempts;

    public ConcurrencyExhaustedException(StreamId streamId, int attempts, StreamStoreException lastConflict) {
        super("Stream " + streamId + " still conflicting after " + attempts + " attempts", lastConflict);
        this.streamId = streamId;
        this.attempts = attempts;
    }

    public StreamId getStreamId() {
        return streamId;
    }

    /**
     * @return number of appends attempted
     */
    public int getAttempts() {
        return attempts;
    }

    @Override
    public synchronized StreamStoreException getCause() {
        return (StreamStoreException) super.getCause();
    }
}
