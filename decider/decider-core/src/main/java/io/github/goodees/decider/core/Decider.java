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

import io.github.goodees.decider.core.cache.StateCache;
import io.github.goodees.decider.core.codec.EventCodec;
import io.github.goodees.decider.core.store.EventData;
import io.github.goodees.decider.core.store.EventRecord;
import io.github.goodees.decider.core.store.StoredEvents;
import io.github.goodees.decider.core.store.StreamStore;
import io.github.goodees.decider.core.store.StreamStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

/**
 * Runs decisions against single stream. Decider holds no state of its own, it is obtained from
 * {@link StreamCategory#resolve(String)} for a call, and any number of deciders of the same stream may run at once,
 * in this or other processes. The append with expected version is the only point where they meet.
 *
 * <p>A transaction proceeds as follows:</p>
 * <ol>
 *     <li>State is loaded according to {@link LoadOption}: cached state, and the events appended since its version
 *     folded over it.</li>
 *     <li>The decision is invoked with the state. {@link DomainRuleViolationException} thrown by it ends the
 *     transaction. Decision producing no events ends it as well, without touching the store.</li>
 *     <li>The events are appended, expecting the version the state was loaded at. When that succeeds, the state with
 *     the events folded is cached and the result is returned.</li>
 *     <li>When another writer appended first, cached state is dropped, events appended since the attempt's version
 *     are folded into its state, and the decision is invoked again. This repeats until the append succeeds, or
 *     {@link RetryPolicy} gives up, which ends the transaction with {@link ConcurrencyExhaustedException}.</li>
 * </ol>
 *
 * <p>Synchronous calls check interrupt flag of the calling thread before each store call, and end with
 * {@link CancellationException} when it is set. Asynchronous calls check whether the returned future is cancelled,
 * and cancelling the future cancels the decision stage that is pending.</p>
 *
 * @param <S> type of state
 * @param <E> type of events
 */
public class Decider<S, E> {
    private static final Logger logger = LoggerFactory.getLogger(Decider.class);

    private final StreamId streamId;
    private final StreamStore store;
    private final EventCodec<E> codec;
    private final Fold<S, E> fold;
    private final StateCache<S> cache;
    private final RetryPolicy retryPolicy;
    private final LoadOption defaultLoadOption;

    Decider(StreamCategory<S, E> category, StreamId streamId) {
        this.streamId = streamId;
        this.store = category.getStore();
        this.codec = category.getCodec();
        this.fold = category.getFold();
        this.cache = category.getCache();
        this.retryPolicy = category.getRetryPolicy();
        this.defaultLoadOption = category.getDefaultLoadOption();
    }

    public StreamId getStreamId() {
        return streamId;
    }

    /**
     * Decide and append, retrying on concurrent appends.
     * @param decision the decision
     * @param <R> type of result
     * @return result of the decision that was committed
     * @throws StreamStoreException when the store fails with other fault than version conflict
     * @throws ConcurrencyExhaustedException when the stream kept conflicting until retry policy gave up
     * @throws DomainRuleViolationException when the decision rejects the state
     * @throws CancellationException when the calling thread is interrupted
     */
    public <R> R transact(Decision<S, E, R> decision) throws StreamStoreException, ConcurrencyExhaustedException {
        return transact(decision, defaultLoadOption);
    }

    public <R> R transact(Decision<S, E, R> decision, LoadOption loadOption)
            throws StreamStoreException, ConcurrencyExhaustedException {
        checkInterrupted();
        StreamState<S> current = load(loadOption);
        int attempts = 0;
        while (true) {
            Outcome<R, E> outcome = decision.decide(current.getState());
            Objects.requireNonNull(outcome, () -> streamId + " decision produced no outcome");
            if (outcome.getEvents().isEmpty()) {
                return outcome.getResult();
            }
            checkInterrupted();
            try {
                append(current, outcome.getEvents());
                return outcome.getResult();
            } catch (StreamStoreException e) {
                attempts++;
                checkRetry(e, attempts);
            }
            checkInterrupted();
            current = catchUp(current);
        }
    }

    /**
     * Decide with asynchronous collaborator and append. Store calls are made on the calling thread, and on the
     * threads completing the decision's stages. The future completes exceptionally with the same exceptions
     * {@link #transact(Decision)} throws, or with failure of the decision's stage.
     * @param decision the decision
     * @param <R> type of result
     * @return future result of the decision that was committed
     */
    public <R> CompletableFuture<R> transactAsync(AsyncDecision<S, E, R> decision) {
        return transactAsync(decision, defaultLoadOption);
    }

    public <R> CompletableFuture<R> transactAsync(AsyncDecision<S, E, R> decision, LoadOption loadOption) {
        CompletableFuture<R> result = new CompletableFuture<>();
        AtomicReference<Future<?>> pending = new AtomicReference<>();
        result.whenComplete((r, t) -> {
            Future<?> stage = pending.get();
            if (result.isCancelled() && stage != null) {
                stage.cancel(true);
            }
        });
        try {
            attemptAsync(decision, load(loadOption), 0, result, pending);
        } catch (StreamStoreException | RuntimeException e) {
            result.completeExceptionally(e);
        }
        return result;
    }

    private <R> void attemptAsync(AsyncDecision<S, E, R> decision, StreamState<S> state, int attempts,
            CompletableFuture<R> result, AtomicReference<Future<?>> pending) {
        if (result.isDone()) {
            return;
        }
        CompletableFuture<Outcome<R, E>> stage;
        try {
            stage = decision.decide(state.getState()).toCompletableFuture();
        } catch (RuntimeException e) {
            result.completeExceptionally(e);
            return;
        }
        pending.set(stage);
        if (result.isCancelled()) {
            stage.cancel(true);
            return;
        }
        stage.whenComplete((outcome, failure) -> {
            try {
                completeAttempt(decision, state, attempts, outcome, failure, result, pending);
            } catch (RuntimeException e) {
                result.completeExceptionally(e);
            }
        });
    }

    private <R> void completeAttempt(AsyncDecision<S, E, R> decision, StreamState<S> state, int attempts,
            Outcome<R, E> outcome, Throwable failure, CompletableFuture<R> result,
            AtomicReference<Future<?>> pending) {
        if (failure != null) {
            result.completeExceptionally(unwrap(failure));
            return;
        }
        Objects.requireNonNull(outcome, () -> streamId + " decision produced no outcome");
        if (outcome.getEvents().isEmpty()) {
            result.complete(outcome.getResult());
            return;
        }
        if (result.isCancelled()) {
            return;
        }
        StreamState<S> fresh;
        try {
            append(state, outcome.getEvents());
            result.complete(outcome.getResult());
            return;
        } catch (StreamStoreException e) {
            try {
                checkRetry(e, attempts + 1);
                if (result.isCancelled()) {
                    return;
                }
                fresh = catchUp(state);
            } catch (StreamStoreException | ConcurrencyExhaustedException failed) {
                result.completeExceptionally(failed);
                return;
            }
        }
        attemptAsync(decision, fresh, attempts + 1, result, pending);
    }

    /**
     * Render current state.
     * @param render function of the state
     * @param <T> type of result
     * @return the rendered value
     * @throws StreamStoreException when reading the stream fails
     */
    public <T> T query(Function<? super S, ? extends T> render) throws StreamStoreException {
        return query(render, defaultLoadOption);
    }

    public <T> T query(Function<? super S, ? extends T> render, LoadOption loadOption) throws StreamStoreException {
        checkInterrupted();
        return render.apply(load(loadOption).getState());
    }

    /**
     * Render current state together with version it was loaded at.
     * @param render function of state and version
     * @param <T> type of result
     * @return the rendered value
     * @throws StreamStoreException when reading the stream fails
     */
    public <T> T queryState(Function<? super StreamState<S>, ? extends T> render) throws StreamStoreException {
        checkInterrupted();
        return render.apply(load(defaultLoadOption));
    }

    StreamState<S> load(LoadOption loadOption) throws StreamStoreException {
        switch (loadOption) {
            case REQUIRE_LOAD:
                return catchUp(StreamState.initial(fold));
            case ALLOW_STALE:
                StreamState<S> cached = cache.get(streamId).orElse(null);
                return cached != null ? cached : catchUp(StreamState.initial(fold));
            case CATCH_UP:
            default:
                return catchUp(cache.get(streamId).orElseGet(() -> StreamState.initial(fold)));
        }
    }

    /**
     * Fold events appended after version of given state. Records the codec does not know still move the version.
     */
    private StreamState<S> catchUp(StreamState<S> base) throws StreamStoreException {
        StreamState<S> loaded;
        try (StoredEvents events = store.readForward(streamId, base.getVersion())) {
            loaded = events.reduce(base, this::applyRecord);
        }
        if (loaded.getVersion() != base.getVersion()) {
            logger.debug("{} caught up from version {} to {}", streamId, base.getVersion(), loaded.getVersion());
        }
        cache.update(streamId, loaded);
        return loaded;
    }

    private StreamState<S> applyRecord(StreamState<S> state, EventRecord record) {
        S next = codec.tryDecode(record)
                .map(event -> fold.evolve(state.getState(), event))
                .orElse(state.getState());
        return new StreamState<>(next, record.getVersion());
    }

    private void append(StreamState<S> base, List<E> events) throws StreamStoreException {
        List<EventData> encoded = new ArrayList<>(events.size());
        for (E event : events) {
            encoded.add(codec.encode(event));
        }
        long newVersion = store.append(streamId, base.getVersion(), encoded);
        cache.update(streamId, new StreamState<>(fold.fold(base.getState(), events), newVersion));
    }

    /**
     * Decide what follows a failed append. Returns when the decision should be attempted again.
     */
    private void checkRetry(StreamStoreException e, int completedAttempts)
            throws StreamStoreException, ConcurrencyExhaustedException {
        if (!e.isVersionConflict()) {
            throw e;
        }
        cache.invalidate(streamId);
        if (!retryPolicy.shouldRetry(streamId, e, completedAttempts)) {
            logger.warn("{} gave up after {} conflicting appends", streamId, completedAttempts);
            throw new ConcurrencyExhaustedException(streamId, completedAttempts, e);
        }
        logger.debug("{} append {} conflicted at version {}, deciding again", streamId, completedAttempts,
            e.getActualVersion());
    }

    private void checkInterrupted() {
        if (Thread.currentThread().isInterrupted()) {
            throw new CancellationException(streamId + " call interrupted");
        }
    }

    private static Throwable unwrap(Throwable t) {
        Throwable result = t;
        while ((result instanceof CompletionException || result instanceof ExecutionException)
                && result.getCause() != null) {
            result = result.getCause();
        }
        return result;
    }
}
