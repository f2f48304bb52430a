package io.github.goodees.decider.core.store;

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

import java.util.function.BiFunction;
import java.util.function.Consumer;

/**
 * Accessor that enables single iteration over events read from a stream.
 * The underlying idea is, that the events need not be materialized at once, rather it could for example wrap a JDBC
 * ResultSet. This also means that only one of methods foreach and reduce may be called on single instance, and
 * only once.
 */
public interface StoredEvents extends AutoCloseable {
    /**
     * Iterate over all found events. Consumer may call {@link #stop()} to stop the iteration.
     * @param consumer consumer that will receive the events
     * @throws StreamStoreException when the store fails while iterating
     */
    void foreach(Consumer<? super EventRecord> consumer) throws StreamStoreException;

    /**
     * Perform a reduction over all found events. Reducer may call {@link #stop()} to stop the process.
     * @param initial Initial value for reduction
     * @param reducer the reducer function
     * @param <R> type of result
     * @return result of reduction.
     * @throws StreamStoreException when the store fails while iterating
     */
    <R> R reduce(R initial, BiFunction<R, ? super EventRecord, R> reducer) throws StreamStoreException;

    /**
     * Can be called from within the lambda functions to stop the iteration after current step.
     */
    void stop();

    // will not throw exception
    @Override
    void close();
}
