package io.github.goodees.decider.core.cache;

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

import io.github.goodees.decider.core.StreamId;
import io.github.goodees.decider.core.StreamState;

import java.util.Optional;

/**
 * Last known state of streams, shared by all deciders of a category. Entries may be stale, the decider reads events
 * appended since the cached version, and a decision based on a stale entry fails its append with a conflict.
 *
 * @param <S> type of state
 */
public interface StateCache<S> {

    Optional<StreamState<S>> get(StreamId streamId);

    /**
     * Store state of a stream, unless newer state is already cached.
     * @param streamId the stream
     * @param state state to cache
     */
    void update(StreamId streamId, StreamState<S> state);

    void invalidate(StreamId streamId);

    /**
     * Cache that keeps nothing, every call loads the stream from version 0.
     * @param <S> type of state
     * @return the cache
     */
    static <S> StateCache<S> none() {
        return new NoCache<>();
    }

    final class NoCache<S> implements StateCache<S> {
        private NoCache() {
        }

        @Override
        public Optional<StreamState<S>> get(StreamId streamId) {
            return Optional.empty();
        }

        @Override
        public void update(StreamId streamId, StreamState<S> state) {
        }

        @Override
        public void invalidate(StreamId streamId) {
        }
    }
}
