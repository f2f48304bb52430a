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

import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;

/**
 * An event as stored in a stream. The version is the position of the event in its stream: first event has version
 * {@code 1}, and every following one is greater by exactly one.
 */
public final class EventRecord {
    private final StreamId streamId;
    private final long version;
    private final String type;
    private final byte[] payload;
    private final byte[] metadata;
    private final Instant recordedAt;

    public EventRecord(StreamId streamId, long version, String type, byte[] payload, byte[] metadata,
            Instant recordedAt) {
        this.streamId = Objects.requireNonNull(streamId, "Stream must be specified");
        if (version < 1) {
            throw new IllegalArgumentException("Stored event of " + streamId + " has invalid version " + version);
        }
        this.version = version;
        this.type = Objects.requireNonNull(type, "Event type must be specified");
        this.payload = Objects.requireNonNull(payload, "Payload must be specified").clone();
        this.metadata = metadata == null ? new byte[0] : metadata.clone();
        this.recordedAt = Objects.requireNonNull(recordedAt, "Timestamp must be specified");
    }

    /**
     * Record for event data appended at given version.
     * @param streamId the stream
     * @param version position assigned by the store
     * @param data appended data
     * @param recordedAt time of append
     * @return the record
     */
    public static EventRecord of(StreamId streamId, long version, EventData data, Instant recordedAt) {
        return new EventRecord(streamId, version, data.getType(), data.getPayload(), data.getMetadata(), recordedAt);
    }

    public StreamId getStreamId() {
        return streamId;
    }

    public long getVersion() {
        return version;
    }

    public String getType() {
        return type;
    }

    public byte[] getPayload() {
        return payload.clone();
    }

    public byte[] getMetadata() {
        return metadata.clone();
    }

    public Instant getRecordedAt() {
        return recordedAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof EventRecord)) {
            return false;
        }
        EventRecord that = (EventRecord) o;
        return version == that.version && streamId.equals(that.streamId) && type.equals(that.type)
                && Arrays.equals(payload, that.payload) && Arrays.equals(metadata, that.metadata)
                && recordedAt.equals(that.recordedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(streamId, version, type, recordedAt);
    }

    @Override
    public String toString() {
        return "EventRecord{" + streamId + "@" + version + ", type=" + type + ", recordedAt=" + recordedAt + '}';
    }
}
