/**
 * Event sourced aggregates with optimistic concurrency.
 *
 * <p>An aggregate is described by three pure parts: a {@link io.github.goodees.decider.core.Fold} deriving its state
 * from events, {@linkplain io.github.goodees.decider.core.Decision decisions} producing new events from the state,
 * and an {@link io.github.goodees.decider.core.codec.EventCodec} storing the events. The events of single aggregate
 * instance form a stream in a {@link io.github.goodees.decider.core.store.StreamStore}.</p>
 *
 * <p>No thread or process owns a stream. A {@link io.github.goodees.decider.core.Decider} loads the state, decides,
 * and appends the events expecting the stream is still at the version it has loaded. When another writer appended
 * first, the decider folds the new events and decides again. The store's conditional append is therefore the only
 * point of coordination, and the same stream can be served by any number of application instances.</p>
 *
 * <p>{@link io.github.goodees.decider.core.StreamCategory} binds the parts of one kind of aggregate together and
 * resolves deciders for individual streams.</p>
 */
package io.github.goodees.decider.core;
