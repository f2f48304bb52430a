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

import java.util.concurrent.CompletionStage;

/**
 * Decision that needs to wait for a collaborator, e. g. price lookup. The collaborator is asked with the state the
 * decision is given, and on a retry it is asked again, as the state it decided on is no longer current.
 *
 * @param <S> type of state
 * @param <E> type of events
 * @param <R> type of result
 * @see Decision
 */
@FunctionalInterface
public interface AsyncDecision<S, E, R> {

    CompletionStage<Outcome<R, E>> decide(S state);
}
