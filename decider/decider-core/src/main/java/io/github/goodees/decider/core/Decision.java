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

import java.util.List;
import java.util.function.Function;

/**
 * Synchronous decision over the state of a stream. A decision captures the command arguments, and based on the state
 * decides what happened. It must not have side effects other than reading from collaborators, since it may be
 * invoked multiple times when concurrent writers conflict.
 *
 * <p>A transition that is not allowed in given state is rejected by throwing {@link DomainRuleViolationException}.</p>
 *
 * @param <S> type of state
 * @param <E> type of events
 * @param <R> type of result
 */
@FunctionalInterface
public interface Decision<S, E, R> {

    Outcome<R, E> decide(S state);

    /**
     * Decision that only produces events.
     * @param decide function from state to events, empty list for no change
     * @param <S> type of state
     * @param <E> type of events
     * @return decision with {@code null} result
     */
    static <S, E> Decision<S, E, Void> of(Function<? super S, ? extends List<? extends E>> decide) {
        return state -> Outcome.events(decide.apply(state));
    }
}
