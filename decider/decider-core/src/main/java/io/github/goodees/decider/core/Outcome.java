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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Result of a decision: events to append, and a value to return to the caller. Only the events are persisted.
 *
 * @param <R> type of result
 * @param <E> type of events
 */
public final class Outcome<R, E> {
    private final R result;
    private final List<E> events;

    private Outcome(R result, List<E> events) {
        this.result = result;
        this.events = events;
    }

    public static <R, E> Outcome<R, E> of(R result, List<? extends E> events) {
        Objects.requireNonNull(events, "Events must be specified, use empty list for no events");
        return new Outcome<>(result, Collections.unmodifiableList(new ArrayList<E>(events)));
    }

    @SafeVarargs
    public static <R, E> Outcome<R, E> of(R result, E... events) {
        return of(result, Arrays.asList(events));
    }

    /**
     * Outcome without a result value.
     * @param events events to append
     * @param <E> type of events
     * @return outcome with {@code null} result
     */
    public static <E> Outcome<Void, E> events(List<? extends E> events) {
        return of(null, events);
    }

    /**
     * Outcome that appends nothing.
     * @param result value to return
     * @param <R> type of result
     * @param <E> type of events
     * @return outcome without events
     */
    public static <R, E> Outcome<R, E> noEvents(R result) {
        return new Outcome<>(result, Collections.emptyList());
    }

    public R getResult() {
        return result;
    }

    public List<E> getEvents() {
        return events;
    }

    @Override
    public String toString() {
        return "Outcome{result=" + result + ", events=" + events + '}';
    }
}
