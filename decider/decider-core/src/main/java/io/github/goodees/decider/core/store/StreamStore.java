package io.github.goodees.decider.core.store;

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

import io.github.goodees.decider.core.StreamId;

import java.util.List;

/**
 * Append-only storage of event streams.
 *
 * <p>The version of a stream is the number of events in it. It serves as optimistic concurrency token: events are
 * only appended when the writer's expected version still matches the stream. Two writers deciding on top of same
 * version will therefore never both succeed, the one that comes second gets a
 * {@linkplain StreamStoreException.Fault#VERSION_CONFLICT version conflict}.</p>
 * <p>Appends are atomic. Either all of the events get stored, or none.</p>
 */
public interface StreamStore {
    /**
     * Version of a stream that has no events yet.
     */
    long NO_STREAM = 0;

    /**
     * Read events of a stream that were appended after specified version.
     * @param streamId the stream
     * @param afterVersion events past this version are returned. {@link #NO_STREAM} returns entire history
     * @return accessor for the events in order they were appended. Empty for non-existent stream.
     * @throws StreamStoreException when the store cannot be read
     */
    StoredEvents readForward(StreamId streamId, long afterVersion) throws StreamStoreException;

    /**
     * Append events to a stream, provided it is at expected version.
     * @param streamId the stream
     * @param expectedVersion the version writer based its decision on. {@link #NO_STREAM} requires the stream not to
     *                        exist yet
     * @param events events to append, they will receive versions {@code expectedVersion + 1} onwards
     * @return version of the stream after the append
     * @throws StreamStoreException with fault {@link StreamStoreException.Fault#VERSION_CONFLICT} when stream is not at
     *                              expected version, or other fault when the append fails
     */
    long append(StreamId streamId, long expectedVersion, List<EventData> events) throws StreamStoreException;

    /**
     * Current version of a stream.
     * @param streamId the stream
     * @return number of events in the stream, {@link #NO_STREAM} if it does not exist
     * @throws StreamStoreException when the store cannot be read
     */
    long currentVersion(StreamId streamId) throws StreamStoreException;
}
