package io.github.goodees.evoke.store.jdbc;

/*-
 * #%L
 * evoke
 * %%
 * Copyright (C) 2017 Patrik Duditš
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

import io.github.goodees.evoke.core.registry.EncodedEvent;
import io.github.goodees.evoke.core.saga.SagaInstance;
import io.github.goodees.evoke.core.saga.SagaStatus;
import io.github.goodees.evoke.core.store.LogOrder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.Calendar;
import java.util.TimeZone;

/**
 * JDBC schema with one table for events and one for saga instances. Following tables are expected to exist:
 * <ul>
 * <li><em>eventTable</em>(EVENT_SEQUENCE, AGGREGATE_ID, EVENT_TYPE, PAYLOAD, RECORDED_AT) primary key
 * (EVENT_SEQUENCE) generated by the database</li>
 * <li><em>sagaInstanceTable</em>(SAGA_INSTANCE_ID, EVENT_ID, SAGA_NAME, STATUS, LAST_ERROR, CREATED_AT, UPDATED_AT)
 * primary key (SAGA_INSTANCE_ID) generated by the database</li>
 * </ul>
 * {@link #createTablesIfMissing(DataSource)} creates them with H2 compatible DDL. Timestamps are stored as UTC
 * regardless of default time zone of the JVM.
 */
public class DefaultJdbcSchema extends JdbcSchema {
    private static final Logger logger = LoggerFactory.getLogger(DefaultJdbcSchema.class);
    private static final String EVENT_COLUMNS = "EVENT_SEQUENCE, AGGREGATE_ID, EVENT_TYPE, PAYLOAD, RECORDED_AT";
    private static final String SAGA_COLUMNS =
            "SAGA_INSTANCE_ID, EVENT_ID, SAGA_NAME, STATUS, LAST_ERROR, CREATED_AT, UPDATED_AT";

    private final String eventTable;
    private final String sagaInstanceTable;

    public DefaultJdbcSchema(String eventTable, String sagaInstanceTable) {
        this.eventTable = eventTable;
        this.sagaInstanceTable = sagaInstanceTable;
    }

    public DefaultJdbcSchema() {
        this("EVENTS", "SAGA_INSTANCES");
    }

    protected String getEventTable() {
        return eventTable;
    }

    protected String getSagaInstanceTable() {
        return sagaInstanceTable;
    }

    /**
     * Create tables and indexes unless they exist.
     * @param dataSource database to initialize
     * @throws SQLException when DDL fails
     */
    public void createTablesIfMissing(DataSource dataSource) throws SQLException {
        try (Connection connection = dataSource.getConnection();
                Statement st = connection.createStatement()) {
            st.execute("CREATE TABLE IF NOT EXISTS " + getEventTable() + " ("
                    + "EVENT_SEQUENCE BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY, "
                    + "AGGREGATE_ID VARCHAR(255) NOT NULL, "
                    + "EVENT_TYPE VARCHAR(255) NOT NULL, "
                    + "PAYLOAD CLOB NOT NULL, "
                    + "RECORDED_AT TIMESTAMP NOT NULL)");
            st.execute("CREATE INDEX IF NOT EXISTS " + getEventTable() + "_AGGREGATE_IDX ON " + getEventTable()
                    + " (AGGREGATE_ID, EVENT_SEQUENCE)");
            st.execute("CREATE TABLE IF NOT EXISTS " + getSagaInstanceTable() + " ("
                    + "SAGA_INSTANCE_ID BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY, "
                    + "EVENT_ID BIGINT NOT NULL, "
                    + "SAGA_NAME VARCHAR(255) NOT NULL, "
                    + "STATUS VARCHAR(16) NOT NULL, "
                    + "LAST_ERROR CLOB, "
                    + "CREATED_AT TIMESTAMP NOT NULL, "
                    + "UPDATED_AT TIMESTAMP NOT NULL)");
            st.execute("CREATE INDEX IF NOT EXISTS " + getSagaInstanceTable() + "_EVENT_IDX ON "
                    + getSagaInstanceTable() + " (EVENT_ID)");
            if (!connection.getAutoCommit()) {
                connection.commit();
            }
            logger.info("Tables {} and {} are ready", getEventTable(), getSagaInstanceTable());
        }
    }

    @Override
    protected PreparedStatement insertEvent(Connection connection) throws SQLException {
        return connection.prepareStatement("INSERT INTO " + getEventTable()
                + " (AGGREGATE_ID, EVENT_TYPE, PAYLOAD, RECORDED_AT) VALUES (?,?,?,?)",
            new String[] {"EVENT_SEQUENCE"});
    }

    @Override
    protected void prepareInsert(PreparedStatement insertEvent, String aggregateId, EncodedEvent event,
            Instant recordedAt) throws SQLException {
        insertEvent.setString(1, aggregateId);
        insertEvent.setString(2, event.getEventType());
        insertEvent.setString(3, event.getPayload());
        setInstant(insertEvent, 4, recordedAt);
    }

    @Override
    protected long readGeneratedSequence(ResultSet generatedKeys) throws SQLException {
        return generatedKeys.getLong(1);
    }

    @Override
    protected PreparedStatement selectEvent(Connection connection, long sequence) throws SQLException {
        PreparedStatement st = connection.prepareStatement("SELECT " + EVENT_COLUMNS + " FROM " + getEventTable()
                + " WHERE EVENT_SEQUENCE=?");
        st.setLong(1, sequence);
        return st;
    }

    @Override
    protected PreparedStatement selectStream(Connection connection, String aggregateId) throws SQLException {
        PreparedStatement st = connection.prepareStatement("SELECT " + EVENT_COLUMNS + " FROM " + getEventTable()
                + " WHERE AGGREGATE_ID=? ORDER BY EVENT_SEQUENCE");
        st.setString(1, aggregateId);
        return st;
    }

    @Override
    protected PreparedStatement selectAll(Connection connection, LogOrder order) throws SQLException {
        return connection.prepareStatement("SELECT " + EVENT_COLUMNS + " FROM " + getEventTable()
                + " ORDER BY EVENT_SEQUENCE " + (order == LogOrder.DESCENDING ? "DESC" : "ASC"));
    }

    @Override
    protected PreparedStatement selectFrom(Connection connection, long sequence) throws SQLException {
        PreparedStatement st = connection.prepareStatement("SELECT " + EVENT_COLUMNS + " FROM " + getEventTable()
                + " WHERE EVENT_SEQUENCE >= ? ORDER BY EVENT_SEQUENCE");
        st.setLong(1, sequence);
        return st;
    }

    @Override
    protected PreparedStatement selectAggregateIds(Connection connection, String prefix) throws SQLException {
        PreparedStatement st = connection.prepareStatement("SELECT DISTINCT AGGREGATE_ID FROM " + getEventTable()
                + " WHERE AGGREGATE_ID LIKE ? ESCAPE '\\' ORDER BY AGGREGATE_ID");
        st.setString(1, escapeLike(prefix) + "%");
        return st;
    }

    static String escapeLike(String value) {
        return value.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }

    @Override
    protected long readSequence(ResultSet rs) throws SQLException {
        return rs.getLong(1);
    }

    @Override
    protected String readAggregateId(ResultSet rs) throws SQLException {
        return rs.getString(2);
    }

    @Override
    protected String readEventType(ResultSet rs) throws SQLException {
        return rs.getString(3);
    }

    @Override
    protected String readPayload(ResultSet rs) throws SQLException {
        return rs.getString(4);
    }

    @Override
    protected Instant readRecordedAt(ResultSet rs) throws SQLException {
        return readInstant(rs, 5);
    }

    @Override
    protected PreparedStatement insertSagaInstance(Connection connection, long eventId, String sagaName,
            Instant createdAt) throws SQLException {
        PreparedStatement st = connection.prepareStatement("INSERT INTO " + getSagaInstanceTable()
                + " (EVENT_ID, SAGA_NAME, STATUS, CREATED_AT, UPDATED_AT) VALUES (?,?,?,?,?)",
            new String[] {"SAGA_INSTANCE_ID"});
        st.setLong(1, eventId);
        st.setString(2, sagaName);
        st.setString(3, SagaStatus.RUNNING.code());
        setInstant(st, 4, createdAt);
        setInstant(st, 5, createdAt);
        return st;
    }

    @Override
    protected long readGeneratedSagaInstanceId(ResultSet generatedKeys) throws SQLException {
        return generatedKeys.getLong(1);
    }

    @Override
    protected PreparedStatement finishSagaInstance(Connection connection, long instanceId, SagaStatus status,
            String error, Instant updatedAt) throws SQLException {
        PreparedStatement st = connection.prepareStatement("UPDATE " + getSagaInstanceTable()
                + " SET STATUS=?, LAST_ERROR=?, UPDATED_AT=? WHERE SAGA_INSTANCE_ID=? AND STATUS=?");
        st.setString(1, status.code());
        st.setString(2, error);
        setInstant(st, 3, updatedAt);
        st.setLong(4, instanceId);
        st.setString(5, SagaStatus.RUNNING.code());
        return st;
    }

    @Override
    protected PreparedStatement selectSagaInstance(Connection connection, long instanceId) throws SQLException {
        PreparedStatement st = connection.prepareStatement("SELECT " + SAGA_COLUMNS + " FROM "
                + getSagaInstanceTable() + " WHERE SAGA_INSTANCE_ID=?");
        st.setLong(1, instanceId);
        return st;
    }

    @Override
    protected PreparedStatement selectSagaInstancesByEvent(Connection connection, long eventId)
            throws SQLException {
        PreparedStatement st = connection.prepareStatement("SELECT " + SAGA_COLUMNS + " FROM "
                + getSagaInstanceTable() + " WHERE EVENT_ID=? ORDER BY SAGA_INSTANCE_ID");
        st.setLong(1, eventId);
        return st;
    }

    @Override
    protected PreparedStatement selectSagaInstancesByStatus(Connection connection, SagaStatus status)
            throws SQLException {
        PreparedStatement st = connection.prepareStatement("SELECT " + SAGA_COLUMNS + " FROM "
                + getSagaInstanceTable() + " WHERE STATUS=? ORDER BY SAGA_INSTANCE_ID");
        st.setString(1, status.code());
        return st;
    }

    @Override
    protected SagaInstance readSagaInstance(ResultSet rs) throws SQLException {
        return new SagaInstance(rs.getLong(1), rs.getLong(2), rs.getString(3), SagaStatus.fromCode(rs.getString(4)),
            rs.getString(5), readInstant(rs, 6), readInstant(rs, 7));
    }

    protected static void setInstant(PreparedStatement st, int index, Instant instant) throws SQLException {
        st.setTimestamp(index, Timestamp.from(instant), utc());
    }

    protected static Instant readInstant(ResultSet rs, int index) throws SQLException {
        return rs.getTimestamp(index, utc()).toInstant();
    }

    private static Calendar utc() {
        return Calendar.getInstance(TimeZone.getTimeZone("UTC"));
    }
}
