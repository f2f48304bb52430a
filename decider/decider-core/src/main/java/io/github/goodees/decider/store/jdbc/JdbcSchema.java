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

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;

/**
 * SQL dialect and table layout used by {@link JdbcStreamStore}. The store owns connections, transactions and
 * the optimistic concurrency protocol; schema only builds the statements and maps result sets.
 * @see DefaultJdbcSchema
 */
public abstract class JdbcSchema {

    protected abstract PreparedStatement selectStreamVersion(Connection connection, StreamId streamId)
            throws SQLException;

    protected abstract long readStreamVersion(ResultSet rs) throws SQLException;

    protected abstract PreparedStatement createStreamVersion(Connection connection, StreamId streamId, long version)
            throws SQLException;

    /**
     * Statement moving the stream version from expected to new version. It must update exactly one row if and only if
     * the stream still is at expected version.
     */
    protected abstract PreparedStatement updateStreamVersion(Connection connection, StreamId streamId,
            long expectedVersion, long newVersion) throws SQLException;

    protected abstract PreparedStatement insertEvent(Connection connection, StreamId streamId) throws SQLException;

    protected abstract void prepareInsert(PreparedStatement insertEvent, StreamId streamId, long version,
            EventData event, Instant recordedAt) throws SQLException;

    /**
     * Select events of the stream past given version ordered by version.
     */
    protected abstract PreparedStatement selectEvents(Connection connection, StreamId streamId, long afterVersion)
            throws SQLException;

    protected abstract EventRecord readEvent(StreamId streamId, ResultSet rs) throws SQLException;
}
