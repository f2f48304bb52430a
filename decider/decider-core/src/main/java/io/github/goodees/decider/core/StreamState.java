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

import io.github.goodees.decider.core.store.StreamStore;

import java.util.Objects;

/**
 * Folded state of a stream together with the version it reflects.
 *
 * @param <S> type of state
 */
public final class StreamState<S> {
    private final S state;
    private final long version;

    public StreamState(S state, long version) {
        if (version < StreamStore.NO_STREAM) {
            throw new IllegalArgumentException("Invalid version " + version);
        }
        this.state = state;
        this.version = version;
    }

    public static <S> StreamState<S> initial(Fold<S, ?> fold) {
        return new StreamState<>(fold.initial(), StreamStore.NO_STREAM);
    }

    public S getState() {
        return state;
    }

    public long getVersion() {
        return version;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof StreamState)) {
            return false;
        }
        StreamState<?> that = (StreamState<?>) o;
        return version == that.version && Objects.equals(state, that.state);
    }

    @Override
    public int hashCode() {
        return Objects.hash(state, version);
    }

    @Override
    public String toString() {
        return "StreamState{version=" + version + ", state=" + state + '}';
    }
}
