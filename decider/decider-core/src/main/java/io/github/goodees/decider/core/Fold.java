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
 * Derivation of aggregate state from its events. State is a value: {@link #evolve(Object, Object)} returns a new
 * state and never changes the one passed in.
 *
 * <p>Evolve must be deterministic and total: it may not throw for any event, and must not depend on anything else
 * than the state and the event. Events the aggregate does not handle (e. g. introduced by newer version) leave the
 * state unchanged.</p>
 *
 * @param <S> type of state
 * @param <E> type of events
 * @see io.github.goodees.decider.core.matching.TypeSwitchFold
 */
public interface Fold<S, E> {
    /**
     * State of a stream without events.
     * @return the initial state
     */
    S initial();

    /**
     * Apply single event.
     * @param state state before the event
     * @param event the event
     * @return state after the event
     */
    S evolve(S state, E event);

    /**
     * Apply events in order. {@code fold(fold(s, a), b)} equals {@code fold(s, a ++ b)}.
     * @param state the state to start with
     * @param events events to apply
     * @return state after all events
     */
    default S fold(S state, Iterable<? extends E> events) {
        S result = state;
        for (E event : events) {
            result = evolve(result, event);
        }
        return result;
    }
}
