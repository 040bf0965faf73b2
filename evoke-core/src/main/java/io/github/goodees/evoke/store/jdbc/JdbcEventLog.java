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

import io.github.goodees.evoke.core.EventLogException;
import io.github.goodees.evoke.core.RecordedEvent;
import io.github.goodees.evoke.core.registry.EncodedEvent;
import io.github.goodees.evoke.core.store.AbstractEventLog;
import io.github.goodees.evoke.core.store.EventLogConfiguration;
import io.github.goodees.evoke.core.store.LogOrder;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Event log stored in relational database. Sequence numbers are generated by the database, so they survive restarts
 * and continue where the previous process stopped.
 *
 * <p>Every append runs in one transaction on one connection: rows are inserted and read back within it, so that
 * projections see the event exactly as it will be loaded later. Transaction demarcation is delegated to
 * {@link TxHandler}; by default the log commits connections itself, and switches them back to auto-commit before
 * closing them.</p>
 */
public class JdbcEventLog extends AbstractEventLog {
    private final DataSource dataSource;
    private final JdbcSchema schema;
    private final TxHandler txHandler;

    public JdbcEventLog(DataSource dataSource, JdbcSchema schema, EventLogConfiguration configuration) {
        this(dataSource, schema, configuration, LOCAL_TRANSACTIONS);
    }

    public JdbcEventLog(DataSource dataSource, JdbcSchema schema, EventLogConfiguration configuration,
            TxHandler txHandler) {
        super(configuration);
        this.dataSource = Objects.requireNonNull(dataSource, "Data source must be specified");
        this.schema = Objects.requireNonNull(schema, "Schema must be specified");
        this.txHandler = Objects.requireNonNull(txHandler, "Transaction handler must be specified");
    }

    @Override
    protected AppendTransaction beginAppend(String aggregateId) throws EventLogException {
        Connection connection = null;
        try {
            connection = dataSource.getConnection();
            return new JdbcAppendTransaction(txHandler.enroll(connection));
        } catch (SQLException e) {
            cleanup(connection);
            throw EventLogException.storeFailed("Starting append to " + aggregateId, e);
        } catch (RuntimeException e) {
            cleanup(connection);
            throw e;
        }
    }

    @Override
    public List<RecordedEvent> loadStream(String aggregateId) throws EventLogException {
        Objects.requireNonNull(aggregateId, "Aggregate id must be specified");
        return query("Loading stream " + aggregateId, c -> schema.selectStream(c, aggregateId));
    }

    @Override
    public List<RecordedEvent> loadAll(LogOrder order) throws EventLogException {
        return query("Loading log", c -> schema.selectAll(c, order));
    }

    @Override
    public List<RecordedEvent> loadFrom(long sequence) throws EventLogException {
        return query("Loading log from " + sequence, c -> schema.selectFrom(c, sequence));
    }

    @Override
    public List<String> findAggregateIds(String prefix) throws EventLogException {
        Objects.requireNonNull(prefix, "Prefix must be specified");
        try (Connection connection = dataSource.getConnection();
                PreparedStatement st = schema.selectAggregateIds(connection, prefix);
                ResultSet rs = st.executeQuery()) {
            List<String> result = new ArrayList<>();
            while (rs.next()) {
                result.add(rs.getString(1));
            }
            return result;
        } catch (SQLException e) {
            throw EventLogException.storeFailed("Finding aggregates " + prefix, e);
        }
    }

    private List<RecordedEvent> query(String operation, StatementFactory factory) throws EventLogException {
        try (Connection connection = dataSource.getConnection();
                PreparedStatement st = factory.prepare(connection);
                ResultSet rs = st.executeQuery()) {
            return readEvents(rs);
        } catch (SQLException e) {
            throw EventLogException.storeFailed(operation, e);
        }
    }

    private List<RecordedEvent> readEvents(ResultSet rs) throws SQLException, EventLogException {
        List<RecordedEvent> result = new ArrayList<>();
        while (rs.next()) {
            result.add(readEvent(rs));
        }
        return result;
    }

    private RecordedEvent readEvent(ResultSet rs) throws SQLException, EventLogException {
        return decode(schema.readSequence(rs), schema.readAggregateId(rs), schema.readEventType(rs),
            schema.readPayload(rs), schema.readRecordedAt(rs));
    }

    protected void cleanup(AutoCloseable resource) {
        if (resource != null) {
            try {
                resource.close();
            } catch (Exception e) {
                logger.warn("Suppressing cleanup exception", e);
            }
        }
    }

    class JdbcAppendTransaction implements AppendTransaction {
        private final Connection connection;
        private final PreparedStatement insert;
        private boolean committed;

        JdbcAppendTransaction(Connection connection) throws SQLException {
            this.connection = connection;
            try {
                this.insert = schema.insertEvent(connection);
            } catch (SQLException | RuntimeException e) {
                release();
                cleanup(connection);
                throw e;
            }
        }

        @Override
        public RecordedEvent insert(String aggregateId, EncodedEvent event, Instant recordedAt)
                throws EventLogException {
            try {
                schema.prepareInsert(insert, aggregateId, event, recordedAt);
                insert.executeUpdate();
                long sequence;
                try (ResultSet keys = insert.getGeneratedKeys()) {
                    if (!keys.next()) {
                        throw new SQLException("No sequence generated for event of " + aggregateId);
                    }
                    sequence = schema.readGeneratedSequence(keys);
                }
                try (PreparedStatement select = schema.selectEvent(connection, sequence);
                        ResultSet rs = select.executeQuery()) {
                    if (!rs.next()) {
                        throw new SQLException("Inserted event " + sequence + " cannot be read back");
                    }
                    return readEvent(rs);
                }
            } catch (SQLException e) {
                throw EventLogException.storeFailed("Appending to " + aggregateId, e);
            }
        }

        @Override
        public void commit() throws EventLogException {
            try {
                txHandler.commit(connection);
                committed = true;
            } catch (SQLException e) {
                throw EventLogException.storeFailed("Commit", e);
            }
        }

        @Override
        public void close() throws EventLogException {
            boolean finished = committed;
            try {
                if (!committed) {
                    txHandler.rollback(connection);
                    finished = true;
                }
            } catch (SQLException e) {
                throw EventLogException.storeFailed("Rollback", e);
            } finally {
                cleanup(insert);
                // switching to auto-commit would commit a transaction that failed to roll back
                if (finished) {
                    release();
                }
                cleanup(connection);
            }
        }

        private void release() {
            try {
                txHandler.release(connection);
            } catch (SQLException e) {
                logger.warn("Connection could not be released", e);
            }
        }
    }

    interface StatementFactory {
        PreparedStatement prepare(Connection connection) throws SQLException;
    }

    /**
     * Demarcation of append transactions. Implement when connections take part in externally managed transactions.
     */
    public interface TxHandler {

        Connection enroll(Connection connection) throws SQLException;

        void commit(Connection connection) throws SQLException;

        void rollback(Connection connection) throws SQLException;

        /**
         * Return connection to the state it was enrolled in. Called before the connection is closed.
         */
        default void release(Connection connection) throws SQLException {
        }
    }

    public static final TxHandler LOCAL_TRANSACTIONS = new TxHandler() {
        @Override
        public Connection enroll(Connection connection) throws SQLException {
            connection.setAutoCommit(false);
            return connection;
        }

        @Override
        public void commit(Connection connection) throws SQLException {
            connection.commit();
        }

        @Override
        public void rollback(Connection connection) throws SQLException {
            connection.rollback();
        }

        @Override
        public void release(Connection connection) throws SQLException {
            connection.setAutoCommit(true);
        }
    };
}
