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

import java.util.Arrays;
import java.util.Objects;

/**
 * An encoded event about to be appended. The store assigns it a position and timestamp.
 */
public final class EventData {
    private static final byte[] EMPTY = new byte[0];

    private final String type;
    private final byte[] payload;
    private final byte[] metadata;

    public EventData(String type, byte[] payload, byte[] metadata) {
        this.type = Objects.requireNonNull(type, "Event type must be specified");
        this.payload = Objects.requireNonNull(payload, "Payload must be specified").clone();
        this.metadata = metadata == null ? EMPTY : metadata.clone();
    }

    public EventData(String type, byte[] payload) {
        this(type, payload, null);
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

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof EventData)) {
            return false;
        }
        EventData that = (EventData) o;
        return type.equals(that.type) && Arrays.equals(payload, that.payload) && Arrays.equals(metadata, that.metadata);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * type.hashCode() + Arrays.hashCode(payload)) + Arrays.hashCode(metadata);
    }

    @Override
    public String toString() {
        return "EventData{type=" + type + ", payload=" + payload.length + "B, metadata=" + metadata.length + "B}";
    }
}
