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
import java.sql.Timestamp;
import java.time.Instant;

/**
 * JDBC schema with event and version table, that can be shared by multiple categories. Following tables are
 * expected to exist:
 * <ul>
 * <li><em>eventTable</em>(STREAM_ID, VERSION, RECORDED_AT, EVENT_TYPE, PAYLOAD, METADATA) primary key
 * (STREAM_ID, VERSION)</li>
 * <li><em>versionTable</em>(STREAM_ID, VERSION) primary key (STREAM_ID)</li>
 * </ul>
 * PAYLOAD and METADATA are binary columns, STREAM_ID holds the {@linkplain StreamId#toString() stream name}.
 */
public class DefaultJdbcSchema extends JdbcSchema {

    private final String eventTable;
    private final String versionTable;

    public DefaultJdbcSchema(String eventTable, String versionTable) {
        this.eventTable = eventTable;
        this.versionTable = versionTable;
    }

    protected String getEventTable() {
        return eventTable;
    }

    protected String getVersionTable() {
        return versionTable;
    }

    @Override
    protected PreparedStatement selectStreamVersion(Connection connection, StreamId streamId) throws SQLException {
        PreparedStatement st = connection.prepareStatement("SELECT VERSION FROM " + getVersionTable()
                + " WHERE STREAM_ID=?");
        st.setString(1, streamId.toString());
        return st;
    }

    @Override
    protected long readStreamVersion(ResultSet rs) throws SQLException {
        return rs.getLong(1);
    }

    @Override
    protected PreparedStatement createStreamVersion(Connection connection, StreamId streamId, long version)
            throws SQLException {
        PreparedStatement st = connection.prepareStatement("INSERT INTO " + getVersionTable()
                + " (STREAM_ID, VERSION) VALUES (?, ?)");
        st.setString(1, streamId.toString());
        st.setLong(2, version);
        return st;
    }

    @Override
    protected PreparedStatement updateStreamVersion(Connection connection, StreamId streamId, long expectedVersion,
            long newVersion) throws SQLException {
        PreparedStatement st = connection.prepareStatement("UPDATE " + getVersionTable()
                + " SET VERSION=? WHERE STREAM_ID=? AND VERSION=?");
        st.setLong(1, newVersion);
        st.setString(2, streamId.toString());
        st.setLong(3, expectedVersion);
        return st;
    }

    @Override
    protected PreparedStatement insertEvent(Connection connection, StreamId streamId) throws SQLException {
        return connection.prepareStatement("INSERT INTO " + getEventTable()
                + " (STREAM_ID, VERSION, RECORDED_AT, EVENT_TYPE, PAYLOAD, METADATA) VALUES (?,?,?,?,?,?)");
    }

    @Override
    protected void prepareInsert(PreparedStatement insertEvent, StreamId streamId, long version, EventData event,
            Instant recordedAt) throws SQLException {
        insertEvent.setString(1, streamId.toString());
        insertEvent.setLong(2, version);
        insertEvent.setTimestamp(3, Timestamp.from(recordedAt));
        insertEvent.setString(4, event.getType());
        insertEvent.setBytes(5, event.getPayload());
        insertEvent.setBytes(6, event.getMetadata());
    }

    @Override
    protected PreparedStatement selectEvents(Connection connection, StreamId streamId, long afterVersion)
            throws SQLException {
        PreparedStatement st = connection.prepareStatement("SELECT VERSION, RECORDED_AT, EVENT_TYPE, PAYLOAD, METADATA "
                + "FROM " + getEventTable() + " WHERE STREAM_ID=? AND VERSION > ? ORDER BY VERSION");
        st.setString(1, streamId.toString());
        st.setLong(2, afterVersion);
        return st;
    }

    @Override
    protected EventRecord readEvent(StreamId streamId, ResultSet rs) throws SQLException {
        return new EventRecord(streamId, rs.getLong(1), rs.getString(3), rs.getBytes(4), rs.getBytes(5),
            rs.getTimestamp(2).toInstant());
    }
}
