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
import io.github.goodees.evoke.core.saga.SagaInstance;
import io.github.goodees.evoke.core.saga.SagaInstanceStore;
import io.github.goodees.evoke.core.saga.SagaStatus;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Saga instances stored in relational database, each change committed on its own.
 */
public class JdbcSagaInstanceStore implements SagaInstanceStore {
    private final DataSource dataSource;
    private final JdbcSchema schema;
    private final Clock clock;

    public JdbcSagaInstanceStore(DataSource dataSource, JdbcSchema schema) {
        this(dataSource, schema, Clock.systemUTC());
    }

    public JdbcSagaInstanceStore(DataSource dataSource, JdbcSchema schema, Clock clock) {
        this.dataSource = Objects.requireNonNull(dataSource, "Data source must be specified");
        this.schema = Objects.requireNonNull(schema, "Schema must be specified");
        this.clock = Objects.requireNonNull(clock, "Clock must be specified");
    }

    @Override
    public SagaInstance start(long eventId, String sagaName) throws EventLogException {
        Instant now = clock.instant();
        try (Connection connection = dataSource.getConnection();
                PreparedStatement st = schema.insertSagaInstance(connection, eventId, sagaName, now)) {
            st.executeUpdate();
            long id;
            try (ResultSet keys = st.getGeneratedKeys()) {
                if (!keys.next()) {
                    throw new SQLException("No id generated for saga instance " + sagaName);
                }
                id = schema.readGeneratedSagaInstanceId(keys);
            }
            commitIfManual(connection);
            return SagaInstance.running(id, eventId, sagaName, now);
        } catch (SQLException e) {
            throw EventLogException.storeFailed("Starting saga " + sagaName + " for event " + eventId, e);
        }
    }

    @Override
    public SagaInstance complete(long instanceId) throws EventLogException {
        return finish(instanceId, SagaStatus.COMPLETED, null);
    }

    @Override
    public SagaInstance fail(long instanceId, String error) throws EventLogException {
        return finish(instanceId, SagaStatus.ERROR, error);
    }

    private SagaInstance finish(long instanceId, SagaStatus status, String error) throws EventLogException {
        int updated;
        try (Connection connection = dataSource.getConnection();
                PreparedStatement st = schema.finishSagaInstance(connection, instanceId, status, error,
                    clock.instant())) {
            updated = st.executeUpdate();
            commitIfManual(connection);
        } catch (SQLException e) {
            throw EventLogException.storeFailed("Updating saga instance " + instanceId, e);
        }
        if (updated != 1) {
            throw new IllegalStateException("Saga instance " + instanceId + " is not running and cannot become "
                    + status.code());
        }
        return find(instanceId).orElseThrow(() -> new IllegalStateException("Saga instance " + instanceId
                + " disappeared"));
    }

    // every change is durable on its own, also on connections handed out without auto-commit
    private static void commitIfManual(Connection connection) throws SQLException {
        if (!connection.getAutoCommit()) {
            connection.commit();
        }
    }

    @Override
    public Optional<SagaInstance> find(long instanceId) throws EventLogException {
        List<SagaInstance> result = query("Finding saga instance " + instanceId,
            c -> schema.selectSagaInstance(c, instanceId));
        return result.isEmpty() ? Optional.empty() : Optional.of(result.get(0));
    }

    @Override
    public List<SagaInstance> findByEvent(long eventId) throws EventLogException {
        return query("Finding saga instances of event " + eventId,
            c -> schema.selectSagaInstancesByEvent(c, eventId));
    }

    @Override
    public List<SagaInstance> findByStatus(SagaStatus status) throws EventLogException {
        Objects.requireNonNull(status, "Status must be specified");
        return query("Finding " + status.code() + " saga instances",
            c -> schema.selectSagaInstancesByStatus(c, status));
    }

    private List<SagaInstance> query(String operation, JdbcEventLog.StatementFactory factory)
            throws EventLogException {
        try (Connection connection = dataSource.getConnection();
                PreparedStatement st = factory.prepare(connection);
                ResultSet rs = st.executeQuery()) {
            List<SagaInstance> result = new ArrayList<>();
            while (rs.next()) {
                result.add(schema.readSagaInstance(rs));
            }
            return result;
        } catch (SQLException e) {
            throw EventLogException.storeFailed(operation, e);
        }
    }
}
