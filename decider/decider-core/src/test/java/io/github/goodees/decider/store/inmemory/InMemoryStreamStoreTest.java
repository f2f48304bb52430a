package io.github.goodees.decider.store.inmemory;

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
import io.github.goodees.decider.core.store.EventData;
import io.github.goodees.decider.core.store.EventRecord;
import io.github.goodees.decider.core.store.StoredEvents;
import io.github.goodees.decider.core.store.StreamStore;
import io.github.goodees.decider.core.store.StreamStoreException;
import org.junit.Test;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class InMemoryStreamStoreTest {
    private final Instant now = Instant.parse("2018-03-01T10:15:30Z");
    private final InMemoryStreamStore store = new InMemoryStreamStore(Clock.fixed(now, ZoneOffset.UTC));
    private final StreamId id = StreamId.of("Cart", "1");

    private static EventData event(String payload) {
        return new EventData("Test", payload.getBytes(StandardCharsets.UTF_8));
    }

    private List<EventRecord> read(long afterVersion) throws StreamStoreException {
        List<EventRecord> result = new ArrayList<>();
        try (StoredEvents events = store.readForward(id, afterVersion)) {
            events.foreach(result::add);
        }
        return result;
    }

    @Test
    public void appends_get_consecutive_versions() throws StreamStoreException {
        assertEquals(2, store.append(id, StreamStore.NO_STREAM, Arrays.asList(event("a"), event("b"))));
        assertEquals(3, store.append(id, 2, Collections.singletonList(event("c"))));
        List<EventRecord> records = read(0);
        assertEquals(3, records.size());
        for (int i = 0; i < records.size(); i++) {
            assertEquals(i + 1, records.get(i).getVersion());
            assertEquals(now, records.get(i).getRecordedAt());
        }
        assertArrayEquals("c".getBytes(StandardCharsets.UTF_8), records.get(2).getPayload());
    }

    @Test
    public void read_forward_starts_after_version() throws StreamStoreException {
        store.append(id, 0, Arrays.asList(event("a"), event("b"), event("c")));
        List<EventRecord> records = read(2);
        assertEquals(1, records.size());
        assertEquals(3, records.get(0).getVersion());
        assertTrue(read(3).isEmpty());
    }

    @Test
    public void missing_stream_is_empty() throws StreamStoreException {
        assertTrue(read(0).isEmpty());
        assertEquals(StreamStore.NO_STREAM, store.currentVersion(id));
    }

    @Test
    public void stale_expected_version_conflicts() throws StreamStoreException {
        store.append(id, 0, Arrays.asList(event("a"), event("b")));
        try {
            store.append(id, 1, Collections.singletonList(event("c")));
            fail("Conflict expected");
        } catch (StreamStoreException e) {
            assertTrue(e.isVersionConflict());
            assertEquals(2, e.getActualVersion());
            assertEquals(2, store.currentVersion(id));
        }
    }

    @Test
    public void existing_stream_cannot_be_created_again() throws StreamStoreException {
        store.append(id, 0, Collections.singletonList(event("a")));
        try {
            store.append(id, StreamStore.NO_STREAM, Collections.singletonList(event("b")));
            fail("Conflict expected");
        } catch (StreamStoreException e) {
            assertEquals(StreamStoreException.Fault.VERSION_CONFLICT, e.getFault());
        }
    }

    @Test
    public void empty_append_returns_expected_version() throws StreamStoreException {
        assertEquals(5, store.append(id, 5, Collections.<EventData>emptyList()));
        assertEquals(StreamStore.NO_STREAM, store.currentVersion(id));
    }

    @Test
    public void negative_version_is_programmatic_error() {
        try {
            store.append(id, -2, Collections.singletonList(event("a")));
            fail("Failure expected");
        } catch (StreamStoreException e) {
            assertEquals(StreamStoreException.Fault.PROGRAMMATIC_ERROR, e.getFault());
        }
    }

    @Test
    public void iteration_can_be_stopped() throws StreamStoreException {
        store.append(id, 0, Arrays.asList(event("a"), event("b"), event("c")));
        try (StoredEvents events = store.readForward(id, 0)) {
            long last = events.reduce(0L, (v, r) -> {
                if (r.getVersion() == 2) {
                    events.stop();
                }
                return r.getVersion();
            });
            assertEquals(2, last);
        }
    }
}
