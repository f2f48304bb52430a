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

/**
 * Exception generated when reading or appending to a stream fails.
 */
public class StreamStoreException extends Exception {
    public static final long UNKNOWN_VERSION = -1;

    private final Fault fault;
    private final long actualVersion;

    public enum Fault {
        /**
         * The stream was appended to since the expected version. Transient, the append may be decided again.
         */
        VERSION_CONFLICT,
        /**
         * The store could not be reached or its transaction failed.
         */
        UNAVAILABLE,
        /**
         * Invalid use of the store.
         */
        PROGRAMMATIC_ERROR
    }

    protected StreamStoreException(Fault fault, String message, long actualVersion, Throwable cause) {
        super(message, cause);
        this.fault = fault;
        this.actualVersion = actualVersion;
    }

    public Fault getFault() {
        return fault;
    }

    /**
     * The version store has seen when conflict was detected.
     * @return actual version of the stream, or {@link #UNKNOWN_VERSION} if the store could not tell
     */
    public long getActualVersion() {
        return actualVersion;
    }

    public boolean isVersionConflict() {
        return fault == Fault.VERSION_CONFLICT;
    }

    public static StreamStoreException versionConflict(StreamId streamId, long expectedVersion, long actualVersion) {
        return new StreamStoreException(Fault.VERSION_CONFLICT, "Stream " + streamId + " append expected version "
                + expectedVersion + " while actual version is " + actualVersion, actualVersion, null);
    }

    public static StreamStoreException concurrentAppend(StreamId streamId, long expectedVersion, Throwable cause) {
        return new StreamStoreException(Fault.VERSION_CONFLICT, "Stream " + streamId
                + " was appended concurrently past version " + expectedVersion, UNKNOWN_VERSION, cause);
    }

    public static StreamStoreException unavailable(StreamId streamId, Throwable cause) {
        return new StreamStoreException(Fault.UNAVAILABLE,
            "Access to stream " + streamId + " failed. " + cause.getMessage(), UNKNOWN_VERSION, cause);
    }

    public static StreamStoreException invalidVersion(StreamId streamId, long expectedVersion) {
        return new StreamStoreException(Fault.PROGRAMMATIC_ERROR, "Stream " + streamId
                + " cannot be appended at version " + expectedVersion, UNKNOWN_VERSION, null);
    }
}
