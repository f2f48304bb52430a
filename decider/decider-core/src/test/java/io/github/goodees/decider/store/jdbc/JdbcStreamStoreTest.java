package io.github.goodees.decider.store.jdbc;

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
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ErrorCollector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class JdbcStreamStoreTest extends JdbcTest {
    private static final Logger logger = LoggerFactory.getLogger(JdbcStreamStoreTest.class);
    @Rule
    public ErrorCollector collector = new ErrorCollector();

    private StreamId id() {
        return StreamId.of("Test", name());
    }

    private static EventData event(String payload) {
        return new EventData("Test", payload.getBytes(StandardCharsets.UTF_8),
            "{}".getBytes(StandardCharsets.UTF_8));
    }

    private List<EventRecord> read(long afterVersion) throws StreamStoreException {
        List<EventRecord> result = new ArrayList<>();
        try (StoredEvents events = store.readForward(id(), afterVersion)) {
            events.foreach(result::add);
        }
        return result;
    }

    @Test
    public void events_of_new_stream_are_persisted() throws StreamStoreException {
        assertEquals(2, store.append(id(), StreamStore.NO_STREAM, Arrays.asList(event("a"), event("b"))));
        assertDb(2, "select count(*) from stream_event where STREAM_ID = ?", id().toString());
        assertDb(2, "select VERSION from stream_version where STREAM_ID = ?", id().toString());
        assertEquals(2, store.currentVersion(id()));
    }

    @Test
    public void events_of_existing_stream_are_persisted() throws StreamStoreException {
        store.append(id(), 0, Arrays.asList(event("a"), event("b")));
        assertEquals(4, store.append(id(), 2, Arrays.asList(event("c"), event("d"))));
        assertDb(4, "select count(*) from stream_event where STREAM_ID = ?", id().toString());
        assertDb(4, "select max(VERSION) from stream_event where STREAM_ID = ?", id().toString());
        assertDb(4, "select VERSION from stream_version where STREAM_ID = ?", id().toString());
    }

    @Test
    public void events_are_read_in_order_with_their_data() throws StreamStoreException {
        Instant now = Instant.parse("2018-03-01T10:15:30Z");
        store = new JdbcStreamStore(ds, schema, JdbcStreamStore.TxHandler.LOCAL, Clock.fixed(now, ZoneOffset.UTC));
        store.setFetchSize(2);
        assertEquals(2, store.getFetchSize());
        store.append(id(), 0, Arrays.asList(event("a"), event("b"), event("c")));
        store.append(id(), 3, Arrays.asList(event("d"), event("e")));
        List<EventRecord> records = read(1);
        assertEquals(4, records.size());
        for (int i = 0; i < records.size(); i++) {
            EventRecord record = records.get(i);
            assertEquals(i + 2, record.getVersion());
            assertEquals(id(), record.getStreamId());
            assertEquals("Test", record.getType());
            assertEquals(now, record.getRecordedAt());
        }
        assertArrayEquals("e".getBytes(StandardCharsets.UTF_8), records.get(3).getPayload());
        assertArrayEquals("{}".getBytes(StandardCharsets.UTF_8), records.get(3).getMetadata());
    }

    @Test
    public void missing_stream_reads_empty() throws StreamStoreException {
        assertTrue(read(0).isEmpty());
        assertEquals(StreamStore.NO_STREAM, store.currentVersion(id()));
    }

    @Test
    public void stale_append_conflicts_and_stores_nothing() throws StreamStoreException {
        store.append(id(), 0, Arrays.asList(event("a"), event("b")));
        try {
            store.append(id(), 1, Collections.singletonList(event("c")));
            fail("Conflict expected");
        } catch (StreamStoreException e) {
            assertEquals(StreamStoreException.Fault.VERSION_CONFLICT, e.getFault());
            assertEquals(2, e.getActualVersion());
            assertDb(2, "select count(*) from stream_event where STREAM_ID = ?", id().toString());
            assertDb(2, "select VERSION from stream_version where STREAM_ID = ?", id().toString());
        }
    }

    @Test
    public void append_to_missing_stream_conflicts() {
        try {
            store.append(id(), 3, Collections.singletonList(event("a")));
            fail("Conflict expected");
        } catch (StreamStoreException e) {
            assertTrue(e.isVersionConflict());
            assertEquals(StreamStore.NO_STREAM, e.getActualVersion());
            assertDb(0, "select count(*) from stream_version where STREAM_ID = ?", id().toString());
        }
    }

    @Test
    public void version_ahead_of_events_conflicts_early() {
        template.update("insert into stream_version (STREAM_ID, VERSION) values (?, 10)", id().toString());
        try {
            store.append(id(), 0, Collections.singletonList(event("a")));
            fail("Conflict expected");
        } catch (StreamStoreException e) {
            assertEquals(StreamStoreException.Fault.VERSION_CONFLICT, e.getFault());
            assertEquals(10, e.getActualVersion());
            assertDb(0, "select count(*) from stream_event where STREAM_ID = ?", id().toString());
        }
    }

    @Test
    public void failed_database_is_unavailable() {
        JdbcStreamStore broken = new JdbcStreamStore(ds, new DefaultJdbcSchema("no_such_table", "stream_version"));
        try {
            broken.append(id(), 0, Collections.singletonList(event("a")));
            fail("Failure expected");
        } catch (StreamStoreException e) {
            assertEquals(StreamStoreException.Fault.UNAVAILABLE, e.getFault());
            assertDb(0, "select count(*) from stream_version where STREAM_ID = ?", id().toString());
        }
    }

    @Test
    public void container_transactions_are_left_to_connection() throws StreamStoreException {
        JdbcStreamStore containerStore = new JdbcStreamStore(ds, schema, JdbcStreamStore.TxHandler.CONTAINER,
            Clock.systemUTC());
        assertEquals(1, containerStore.append(id(), 0, Collections.singletonList(event("a"))));
        assertDb(1, "select count(*) from stream_event where STREAM_ID = ?", id().toString());
        assertEquals(1, store.currentVersion(id()));
    }

    @Test
    public void negative_version_is_programmatic_error() {
        try {
            store.append(id(), -1, Collections.singletonList(event("a")));
            fail("Failure expected");
        } catch (StreamStoreException e) {
            assertEquals(StreamStoreException.Fault.PROGRAMMATIC_ERROR, e.getFault());
        }
    }

    @Test
    public void losing_concurrent_append_conflicts() throws Exception {
        /*
            WRITER 2                          WRITER 1

            read version 1
            < release "writer 2 has version" >
                                              < wait for "writer 2 has version" >
                                              append at version 1, commit
                                              < release "writer 1 committed" >
            < wait for "writer 1 committed" >
            insert event 2 -> duplicate key

            Writer 1 wins, writer 2 fails with conflict.
         */
        store.append(id(), 0, Collections.singletonList(event("a")));
        CountDownLatch writer2hasVersion = new CountDownLatch(1);
        CountDownLatch writer1committed = new CountDownLatch(1);
        AtomicReference<StreamStoreException> writer2failure = new AtomicReference<>();

        JdbcSchema race = new DefaultJdbcSchema("stream_event", "stream_version") {
            @Override
            protected long readStreamVersion(ResultSet rs) throws SQLException {
                try {
                    return super.readStreamVersion(rs);
                } finally {
                    logger.info("Writer 2 has read stream version");
                    writer2hasVersion.countDown();
                }
            }

            @Override
            protected PreparedStatement insertEvent(Connection connection, StreamId streamId) throws SQLException {
                try {
                    logger.info("Writer 2 waits for writer 1 to commit");
                    writer1committed.await(10, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    collector.addError(e);
                }
                return super.insertEvent(connection, streamId);
            }
        };
        JdbcStreamStore writer2store = new JdbcStreamStore(ds, race);
        Thread writer2 = new Thread(() -> {
            try {
                writer2store.append(id(), 1, Collections.singletonList(event("from writer 2")));
                collector.addError(new AssertionError("Writer 2 should have lost"));
            } catch (StreamStoreException e) {
                writer2failure.set(e);
            }
        }, "writer-2");
        writer2.start();

        assertTrue(writer2hasVersion.await(10, TimeUnit.SECONDS));
        assertEquals(2, store.append(id(), 1, Collections.singletonList(event("from writer 1"))));
        writer1committed.countDown();
        writer2.join(10000);

        StreamStoreException failure = writer2failure.get();
        assertNotNull(failure);
        assertEquals(StreamStoreException.Fault.VERSION_CONFLICT, failure.getFault());
        List<EventRecord> records = read(0);
        assertEquals(2, records.size());
        assertArrayEquals("from writer 1".getBytes(StandardCharsets.UTF_8), records.get(1).getPayload());
        assertDb(2, "select VERSION from stream_version where STREAM_ID = ?", id().toString());
    }
}
