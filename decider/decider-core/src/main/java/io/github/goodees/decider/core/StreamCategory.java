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

import io.github.goodees.decider.core.cache.InMemoryStateCache;
import io.github.goodees.decider.core.cache.StateCache;
import io.github.goodees.decider.core.codec.EventCodec;
import io.github.goodees.decider.core.store.StreamStore;

import java.util.Objects;

/**
 * Streams of one kind of aggregate, e. g. all shopping carts. Category binds together everything needed to run
 * decisions over its streams, and {@linkplain #resolve(String) resolves} a {@link Decider} for a stream.
 *
 * <pre>
 * StreamCategory&lt;CartState, CartEvent&gt; carts = StreamCategory.builder("ShoppingCart", ShoppingCart.FOLD)
 *     .store(store)
 *     .codec(codec)
 *     .build();
 * carts.resolve(cartId).transact(ShoppingCart.confirm(now));
 * </pre>
 *
 * @param <S> type of state
 * @param <E> type of events
 */
public class StreamCategory<S, E> {
    private final String name;
    private final StreamStore store;
    private final EventCodec<E> codec;
    private final Fold<S, E> fold;
    private final StateCache<S> cache;
    private final RetryPolicy retryPolicy;
    private final LoadOption defaultLoadOption;

    private StreamCategory(Builder<S, E> b) {
        this.name = b.name;
        this.store = Objects.requireNonNull(b.store, "Stream store must be specified");
        this.codec = Objects.requireNonNull(b.codec, "Event codec must be specified");
        this.fold = b.fold;
        this.cache = b.cache != null ? b.cache : new InMemoryStateCache<>();
        this.retryPolicy = b.retryPolicy;
        this.defaultLoadOption = b.loadOption;
    }

    public static <S, E> Builder<S, E> builder(String name, Fold<S, E> fold) {
        return new Builder<>(name, fold);
    }

    public Decider<S, E> resolve(String key) {
        return new Decider<>(this, StreamId.of(name, key));
    }

    public Decider<S, E> resolve(StreamId streamId) {
        if (!name.equals(streamId.getCategory())) {
            throw new IllegalArgumentException("Stream " + streamId + " does not belong to category " + name);
        }
        return new Decider<>(this, streamId);
    }

    public String getName() {
        return name;
    }

    StreamStore getStore() {
        return store;
    }

    EventCodec<E> getCodec() {
        return codec;
    }

    Fold<S, E> getFold() {
        return fold;
    }

    public StateCache<S> getCache() {
        return cache;
    }

    RetryPolicy getRetryPolicy() {
        return retryPolicy;
    }

    LoadOption getDefaultLoadOption() {
        return defaultLoadOption;
    }

    public static class Builder<S, E> {
        private final String name;
        private final Fold<S, E> fold;
        private StreamStore store;
        private EventCodec<E> codec;
        private StateCache<S> cache;
        private RetryPolicy retryPolicy = RetryPolicy.defaultPolicy();
        private LoadOption loadOption = LoadOption.CATCH_UP;

        Builder(String name, Fold<S, E> fold) {
            this.name = StreamId.checkCategory(name);
            this.fold = Objects.requireNonNull(fold, "Fold must be specified");
        }

        public Builder<S, E> store(StreamStore store) {
            this.store = store;
            return this;
        }

        public Builder<S, E> codec(EventCodec<E> codec) {
            this.codec = codec;
            return this;
        }

        /**
         * Cache of states, {@link InMemoryStateCache} by default. Use {@link StateCache#none()} to always read whole
         * streams.
         * @param cache the cache
         * @return this builder
         */
        public Builder<S, E> cache(StateCache<S> cache) {
            this.cache = Objects.requireNonNull(cache, "Cache must be specified");
            return this;
        }

        public Builder<S, E> retryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = Objects.requireNonNull(retryPolicy, "Retry policy must be specified");
            return this;
        }

        public Builder<S, E> loadOption(LoadOption loadOption) {
            this.loadOption = Objects.requireNonNull(loadOption, "Load option must be specified");
            return this;
        }

        public StreamCategory<S, E> build() {
            return new StreamCategory<>(this);
        }
    }
}
