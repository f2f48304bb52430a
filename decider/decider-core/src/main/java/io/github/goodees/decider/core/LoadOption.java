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

/**
 * How a decider obtains the state before deciding or querying.
 */
public enum LoadOption {
    /**
     * Start from cached state if present, and read events appended since. Without cached state, read entire stream.
     */
    CATCH_UP,
    /**
     * Ignore the cache and read entire stream.
     */
    REQUIRE_LOAD,
    /**
     * Use cached state as is, without reading the store. Only reads the stream when nothing is cached. A transaction
     * based on stale state will conflict and retry as usual.
     */
    ALLOW_STALE
}
