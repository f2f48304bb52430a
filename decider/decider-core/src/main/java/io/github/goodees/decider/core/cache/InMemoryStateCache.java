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

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Unbounded cache in a concurrent map. An entry is only ever replaced by state of the same or higher version, so a
 * slow writer cannot put back older state than a faster one already cached. Invalidation drops the state but keeps
 * its version as the floor for later updates.
 */
public class InMemoryStateCache<S> implements StateCache<S> {
    private final ConcurrentMap<StreamId, Entry<S>> entries = new ConcurrentHashMap<>();

    @Override
    public Optional<StreamState<S>> get(StreamId streamId) {
        Entry<S> entry = entries.get(streamId);
        return entry == null ? Optional.empty() : Optional.ofNullable(entry.state);
    }

    @Override
    public void update(StreamId streamId, StreamState<S> state) {
        Objects.requireNonNull(state, "State must be specified");
        entries.merge(streamId, new Entry<>(state, state.getVersion()), InMemoryStateCache::newer);
    }

    private static <S> Entry<S> newer(Entry<S> cached, Entry<S> offered) {
        return offered.version >= cached.version ? offered : cached;
    }

    @Override
    public void invalidate(StreamId streamId) {
        entries.computeIfPresent(streamId, (id, entry) -> new Entry<>(null, entry.version));
    }

    /**
     * @return number of streams with cached state
     */
    public int size() {
        return (int) entries.values().stream().filter(e -> e.state != null).count();
    }

    private static class Entry<S> {
        // null once invalidated
        private final StreamState<S> state;
        private final long version;

        Entry(StreamState<S> state, long version) {
            this.state = state;
            this.version = version;
        }
    }
}
