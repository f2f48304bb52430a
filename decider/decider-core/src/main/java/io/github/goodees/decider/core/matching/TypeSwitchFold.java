package io.github.goodees.decider.core.matching;

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

import io.github.goodees.decider.core.Fold;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.BiFunction;

/**
 * Fold built from handlers of individual event classes. First handler whose class matches the event evolves the
 * state, events without a handler leave it unchanged.
 *
 * <pre>
 * Fold&lt;CartState, CartEvent&gt; fold = TypeSwitchFold.builder(CartState.initial(), CartEvent.class)
 *     .on(Initialized.class, (s, e) -&gt; s.withClientId(e.getClientId()))
 *     .on(Confirmed.class, (s, e) -&gt; s.withStatus(CONFIRMED))
 *     .build();
 * </pre>
 *
 * @param <S> type of state
 * @param <E> base type of events
 */
public class TypeSwitchFold<S, E> implements Fold<S, E> {
    private final S initial;
    private final List<Branch<S, ?>> branches;

    private TypeSwitchFold(Builder<S, E> b) {
        this.initial = b.initial;
        this.branches = new ArrayList<>(b.branches);
    }

    public static <S, E> Builder<S, E> builder(S initial, Class<E> eventType) {
        return new Builder<>(initial);
    }

    @Override
    public S initial() {
        return initial;
    }

    @Override
    public S evolve(S state, E event) {
        for (Branch<S, ?> branch : branches) {
            if (branch.matches(event)) {
                return branch.apply(state, event);
            }
        }
        return state;
    }

    public static class Builder<S, E> {
        private final S initial;
        private final List<Branch<S, ?>> branches = new ArrayList<>();

        Builder(S initial) {
            this.initial = Objects.requireNonNull(initial, "Initial state must be specified");
        }

        public <T extends E> Builder<S, E> on(Class<T> eventClass, BiFunction<S, ? super T, S> handler) {
            branches.add(new Branch<>(eventClass, handler));
            return this;
        }

        public TypeSwitchFold<S, E> build() {
            return new TypeSwitchFold<>(this);
        }
    }

    private static class Branch<S, T> {
        private final Class<T> caseClass;
        private final BiFunction<S, ? super T, S> handler;

        Branch(Class<T> caseClass, BiFunction<S, ? super T, S> handler) {
            this.caseClass = Objects.requireNonNull(caseClass, "Case class cannot be null");
            this.handler = Objects.requireNonNull(handler, "Handler cannot be null");
        }

        boolean matches(Object event) {
            return caseClass.isInstance(event);
        }

        S apply(S state, Object event) {
            return handler.apply(state, caseClass.cast(event));
        }
    }
}
