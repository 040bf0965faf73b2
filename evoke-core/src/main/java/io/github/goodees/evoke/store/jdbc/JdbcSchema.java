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

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;

/**
 * SQL dialect and table layout used by {@link JdbcEventLog} and {@link JdbcSagaInstanceStore}. Statements returned
 * by select methods are expected to produce columns readable by the matching read methods.
 */
public abstract class JdbcSchema {

    /**
     * Statement inserting single event, returning generated sequence.
     */
    protected abstract PreparedStatement insertEvent(Connection connection) throws SQLException;

    protected abstract void prepareInsert(PreparedStatement insertEvent, String aggregateId, EncodedEvent event,
            Instant recordedAt) throws SQLException;

    protected abstract long readGeneratedSequence(ResultSet generatedKeys) throws SQLException;

    protected abstract PreparedStatement selectEvent(Connection connection, long sequence) throws SQLException;

    protected abstract PreparedStatement selectStream(Connection connection, String aggregateId) throws SQLException;

    protected abstract PreparedStatement selectAll(Connection connection, LogOrder order) throws SQLException;

    protected abstract PreparedStatement selectFrom(Connection connection, long sequence) throws SQLException;

    protected abstract PreparedStatement selectAggregateIds(Connection connection, String prefix)
            throws SQLException;

    protected abstract long readSequence(ResultSet rs) throws SQLException;

    protected abstract String readAggregateId(ResultSet rs) throws SQLException;

    protected abstract String readEventType(ResultSet rs) throws SQLException;

    protected abstract String readPayload(ResultSet rs) throws SQLException;

    protected abstract Instant readRecordedAt(ResultSet rs) throws SQLException;

    protected abstract PreparedStatement insertSagaInstance(Connection connection, long eventId, String sagaName,
            Instant createdAt) throws SQLException;

    protected abstract long readGeneratedSagaInstanceId(ResultSet generatedKeys) throws SQLException;

    /**
     * Statement changing status of an instance, that only matches instances that are still running.
     */
    protected abstract PreparedStatement finishSagaInstance(Connection connection, long instanceId,
            SagaStatus status, String error, Instant updatedAt) throws SQLException;

    protected abstract PreparedStatement selectSagaInstance(Connection connection, long instanceId)
            throws SQLException;

    protected abstract PreparedStatement selectSagaInstancesByEvent(Connection connection, long eventId)
            throws SQLException;

    protected abstract PreparedStatement selectSagaInstancesByStatus(Connection connection, SagaStatus status)
            throws SQLException;

    protected abstract SagaInstance readSagaInstance(ResultSet rs) throws SQLException;
}
