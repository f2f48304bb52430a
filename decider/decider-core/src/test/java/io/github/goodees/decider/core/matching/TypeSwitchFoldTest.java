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
import io.github.goodees.decider.core.counter.Added;
import io.github.goodees.decider.core.counter.Counter;
import io.github.goodees.decider.core.counter.CounterEvent;
import io.github.goodees.decider.core.counter.MultipliedEvent;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.assertEquals;

public class TypeSwitchFoldTest {
    private final Fold<Integer, CounterEvent> fold = Counter.FOLD;

    @Test
    public void events_are_applied_in_order() {
        assertEquals(Integer.valueOf(14),
            fold.fold(fold.initial(), Arrays.asList(Added.of(5), Added.of(2), MultipliedEvent.of(2))));
        assertEquals(Integer.valueOf(9),
            fold.fold(fold.initial(), Arrays.asList(MultipliedEvent.of(2), Added.of(5), Added.of(4))));
    }

    @Test
    public void folding_in_parts_equals_folding_at_once() {
        List<CounterEvent> first = Arrays.asList(Added.of(3), MultipliedEvent.of(4));
        List<CounterEvent> second = Arrays.asList(Added.of(-2), MultipliedEvent.of(3), Added.of(1));
        List<CounterEvent> all = new ArrayList<>(first);
        all.addAll(second);
        Integer inParts = fold.fold(fold.fold(fold.initial(), first), second);
        assertEquals(fold.fold(fold.initial(), all), inParts);
        assertEquals(Integer.valueOf(31), inParts);
    }

    @Test
    public void unhandled_events_do_not_change_state() {
        CounterEvent unknown = new CounterEvent() {
        };
        assertEquals(Integer.valueOf(5), fold.evolve(5, unknown));
        assertEquals(fold.initial(), fold.fold(fold.initial(), Collections.<CounterEvent>emptyList()));
    }

    @Test
    public void first_matching_handler_wins() {
        Fold<String, Object> describe = TypeSwitchFold.builder("", Object.class)
                .on(Integer.class, (s, i) -> s + "int")
                .on(Number.class, (s, n) -> s + "number")
                .build();
        assertEquals("intnumber", describe.fold("", Arrays.<Object>asList(1, 2L, "text")));
    }
}
