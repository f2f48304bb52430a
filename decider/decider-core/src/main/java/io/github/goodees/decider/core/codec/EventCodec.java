package io.github.goodees.decider.core.codec;

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

import io.github.goodees.decider.core.store.EventData;
import io.github.goodees.decider.core.store.EventRecord;

import java.util.Optional;

/**
 * Conversion between events of an aggregate and their stored form.
 *
 * <p>The stream of an aggregate may contain events this codec does not know, e. g. written by newer version of the
 * system before a rollback, or by other aggregate version sharing the stream. Such records are skipped by returning
 * empty result from {@link #tryDecode(EventRecord)}, rather than failing the whole aggregate.</p>
 * <p>Additive changes of an event (new optional properties) must be readable from older payloads. Incompatible changes
 * are versioned by the event type itself: the changed event gets a new type tag, and the codec keeps reading the
 * old one.</p>
 *
 * @param <E> base type of aggregate's events
 */
public interface EventCodec<E> {
    /**
     * Encode an event for append.
     * @param event event to encode
     * @return type tag, payload and metadata of the event
     * @throws IllegalArgumentException when the event is not supported by the codec
     */
    EventData encode(E event);

    /**
     * Decode stored record.
     * @param record record read from a stream
     * @return the event, or empty if the type of record is not known to this codec
     * @throws IllegalArgumentException when the type is known, but payload cannot be read
     */
    Optional<E> tryDecode(EventRecord record);
}
