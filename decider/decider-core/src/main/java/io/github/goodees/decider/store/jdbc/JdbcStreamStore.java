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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.function.BiFunction;
import java.util.function.Consumer;

/**
 * Stream store backed by relational database.
 *
 * <p>Every stream has a row in version table, that is moved from expected to new version in the same transaction
 * that inserts the events. The update is conditional on the expected version, so of two concurrent appends only one
 * can commit. Integrity violations during append (e. g. two writers creating the same stream, or inserting the same
 * event position) are reported as version conflicts as well.</p>
 */
public class JdbcStreamStore implements StreamStore {
    private static final Logger logger = LoggerFactory.getLogger(JdbcStreamStore.class);
    private static final String INTEGRITY_VIOLATION_CLASS = "23";

    private final DataSource dataSource;
    private final JdbcSchema schema;
    private final TxHandler txHandler;
    private final Clock clock;
    private int fetchSize = 100;

    public JdbcStreamStore(DataSource dataSource, JdbcSchema schema) {
        this(dataSource, schema, TxHandler.LOCAL, Clock.systemUTC());
    }

    public JdbcStreamStore(DataSource dataSource, JdbcSchema schema, TxHandler txHandler, Clock clock) {
        this.dataSource = Objects.requireNonNull(dataSource, "Data source must be specified");
        this.schema = Objects.requireNonNull(schema, "Schema must be specified");
        this.txHandler = Objects.requireNonNull(txHandler, "Transaction handler must be specified");
        this.clock = Objects.requireNonNull(clock, "Clock must be specified");
    }

    /**
     * Number of rows fetched per database round trip when reading a stream.
     * @param fetchSize positive fetch size
     */
    public void setFetchSize(int fetchSize) {
        if (fetchSize < 1) {
            throw new IllegalArgumentException("Fetch size must be positive, was " + fetchSize);
        }
        this.fetchSize = fetchSize;
    }

    public int getFetchSize() {
        return fetchSize;
    }

    @Override
    public long append(StreamId streamId, long expectedVersion, List<EventData> events) throws StreamStoreException {
        if (expectedVersion < NO_STREAM) {
            throw StreamStoreException.invalidVersion(streamId, expectedVersion);
        }
        if (events.isEmpty()) {
            return expectedVersion;
        }
        AppendTemplate template = new AppendTemplate(streamId, expectedVersion, events);
        try (Connection connection = dataSource.getConnection()) {
            return template.append(txHandler.enroll(connection));
        } catch (SQLException e) {
            if (isIntegrityViolation(e)) {
                throw StreamStoreException.concurrentAppend(streamId, expectedVersion, e);
            }
            throw StreamStoreException.unavailable(streamId, e);
        }
    }

    @Override
    public long currentVersion(StreamId streamId) throws StreamStoreException {
        try (Connection connection = dataSource.getConnection();
                PreparedStatement select = schema.selectStreamVersion(connection, streamId);
                ResultSet rs = select.executeQuery()) {
            return rs.next() ? schema.readStreamVersion(rs) : NO_STREAM;
        } catch (SQLException e) {
            throw StreamStoreException.unavailable(streamId, e);
        }
    }

    @Override
    public StoredEvents readForward(StreamId streamId, long afterVersion) throws StreamStoreException {
        try {
            return new JdbcStoredEvents(streamId, afterVersion);
        } catch (SQLException e) {
            throw StreamStoreException.unavailable(streamId, e);
        }
    }

    static boolean isIntegrityViolation(SQLException e) {
        String state = e.getSQLState();
        return state != null && state.startsWith(INTEGRITY_VIOLATION_CLASS);
    }

    protected class AppendTemplate {
        private final StreamId streamId;
        private final long expectedVersion;
        private final List<EventData> events;
        private final long newVersion;

        AppendTemplate(StreamId streamId, long expectedVersion, List<EventData> events) {
            this.streamId = streamId;
            this.expectedVersion = expectedVersion;
            this.events = events;
            this.newVersion = expectedVersion + events.size();
        }

        long append(Connection connection) throws SQLException, StreamStoreException {
            try {
                checkSourceVersion(connection);
                storeEvents(connection);
                updateVersion(connection);
                txHandler.commit(connection);
                return newVersion;
            } catch (SQLException | StreamStoreException | RuntimeException e) {
                rollback(connection, e);
                throw e;
            }
        }

        private void rollback(Connection connection, Exception cause) {
            try {
                txHandler.rollback(connection);
            } catch (SQLException re) {
                cause.addSuppressed(re);
            }
        }

        private void checkSourceVersion(Connection connection) throws SQLException, StreamStoreException {
            try (PreparedStatement selectVersion = schema.selectStreamVersion(connection, streamId);
                    ResultSet rs = selectVersion.executeQuery()) {
                if (!rs.next()) {
                    if (expectedVersion != NO_STREAM) {
                        throw StreamStoreException.versionConflict(streamId, expectedVersion, NO_STREAM);
                    }
                    // no stream version - create a new one.
                    try (PreparedStatement createVersion = schema.createStreamVersion(connection, streamId,
                        NO_STREAM)) {
                        createVersion.executeUpdate();
                    }
                } else {
                    long version = schema.readStreamVersion(rs);
                    if (version != expectedVersion) {
                        throw StreamStoreException.versionConflict(streamId, expectedVersion, version);
                    }
                }
            }
        }

        private void storeEvents(Connection connection) throws SQLException {
            Instant now = clock.instant();
            try (PreparedStatement insertEvent = schema.insertEvent(connection, streamId)) {
                long version = expectedVersion;
                for (EventData event : events) {
                    schema.prepareInsert(insertEvent, streamId, ++version, event, now);
                    insertEvent.addBatch();
                }
                insertEvent.executeBatch();
            }
        }

        private void updateVersion(Connection connection) throws SQLException, StreamStoreException {
            try (PreparedStatement updateVersion = schema.updateStreamVersion(connection, streamId, expectedVersion,
                newVersion)) {
                if (updateVersion.executeUpdate() != 1) {
                    throw StreamStoreException.concurrentAppend(streamId, expectedVersion, null);
                }
            }
        }
    }

    class JdbcStoredEvents implements StoredEvents {
        private final StreamId streamId;
        private Connection connection;
        private PreparedStatement statement;
        private ResultSet resultSet;
        private boolean iterating;
        private boolean stop;

        JdbcStoredEvents(StreamId streamId, long afterVersion) throws SQLException {
            this.streamId = streamId;
            try {
                connection = dataSource.getConnection();
                statement = schema.selectEvents(connection, streamId, afterVersion);
                statement.setFetchSize(fetchSize);
                resultSet = statement.executeQuery();
            } catch (SQLException e) {
                close();
                throw e;
            }
        }

        @Override
        public void foreach(Consumer<? super EventRecord> consumer) throws StreamStoreException {
            reduce(null, (r, record) -> {
                consumer.accept(record);
                return r;
            });
        }

        @Override
        public <R> R reduce(R initial, BiFunction<R, ? super EventRecord, R> reducer) throws StreamStoreException {
            if (iterating) {
                throw new IllegalStateException("Iteration has already been done");
            }
            iterating = true;
            try {
                R result = initial;
                while (!stop && resultSet.next()) {
                    result = reducer.apply(result, schema.readEvent(streamId, resultSet));
                }
                return result;
            } catch (SQLException e) {
                throw StreamStoreException.unavailable(streamId, e);
            }
        }

        @Override
        public void stop() {
            stop = true;
        }

        @Override
        public void close() {
            cleanup(resultSet);
            cleanup(statement);
            cleanup(connection);
        }

        protected void cleanup(AutoCloseable resource) {
            if (resource != null) {
                try {
                    resource.close();
                } catch (Exception e) {
                    logger.error("Failed to release resources of stream {} read", streamId, e);
                }
            }
        }
    }

    /**
     * Transaction demarcation of appends.
     */
    public interface TxHandler {

        Connection enroll(Connection connection) throws SQLException;

        void commit(Connection connection) throws SQLException;

        void rollback(Connection connection) throws SQLException;

        /**
         * Local JDBC transaction per append. Auto commit is restored when transaction ends.
         */
        TxHandler LOCAL = new TxHandler() {
            @Override
            public Connection enroll(Connection connection) throws SQLException {
                connection.setAutoCommit(false);
                return connection;
            }

            @Override
            public void commit(Connection connection) throws SQLException {
                connection.commit();
                connection.setAutoCommit(true);
            }

            @Override
            public void rollback(Connection connection) throws SQLException {
                connection.rollback();
                connection.setAutoCommit(true);
            }
        };

        /**
         * Transactions are managed by the container the store runs in.
         */
        TxHandler CONTAINER = new TxHandler() {
            @Override
            public Connection enroll(Connection connection) {
                return connection;
            }

            @Override
            public void commit(Connection connection) {
            }

            @Override
            public void rollback(Connection connection) {
            }
        };
    }
}
