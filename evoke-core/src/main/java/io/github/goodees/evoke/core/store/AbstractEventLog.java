package io.github.goodees.evoke.core.store;

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

import io.github.goodees.evoke.core.Event;
import io.github.goodees.evoke.core.EventLogException;
import io.github.goodees.evoke.core.RecordedEvent;
import io.github.goodees.evoke.core.registry.EncodedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Common logic of appending to an event log. Backends only provide the transaction that stores encoded events and
 * reads them back, while this class guarantees the order of the append:
 * <ol>
 *     <li>all events of the batch are encoded, so that unregistered or unserializable events fail before anything
 *     is written</li>
 *     <li>under exclusive lock a transaction is started, and for every event a row is inserted, decoded back and
 *     passed to projections</li>
 *     <li>the transaction commits, the lock is released</li>
 *     <li>sagas are invoked for every recorded event</li>
 * </ol>
 * Failure in steps 1 to 3 rolls back the whole batch. Once committed, the append succeeds: a saga instance store
 * that fails in step 4 is only logged, as the events cannot be taken back.
 */
public abstract class AbstractEventLog implements EventLog {
    protected final Logger logger = LoggerFactory.getLogger(getClass());

    private final EventLogConfiguration configuration;
    private final ReentrantLock writeLock = new ReentrantLock();

    protected AbstractEventLog(EventLogConfiguration configuration) {
        this.configuration = Objects.requireNonNull(configuration, "Configuration must be specified");
    }

    public EventLogConfiguration getConfiguration() {
        return configuration;
    }

    @Override
    public List<RecordedEvent> append(String aggregateId, List<? extends Event> events) throws EventLogException {
        Objects.requireNonNull(aggregateId, "Aggregate id must be specified");
        if (events == null || events.isEmpty()) {
            throw EventLogException.noEvents(aggregateId);
        }
        List<EncodedEvent> encoded = new ArrayList<>(events.size());
        for (Event event : events) {
            encoded.add(configuration.registry().encode(event));
        }

        List<RecordedEvent> recorded;
        writeLock.lock();
        try {
            recorded = appendInTransaction(aggregateId, encoded);
        } finally {
            writeLock.unlock();
        }
        try {
            configuration.sagas().dispatch(recorded, false);
        } catch (EventLogException | RuntimeException e) {
            logger.error("Sagas of committed events {} could not be tracked", sequences(recorded), e);
        }
        return recorded;
    }

    private static List<Long> sequences(List<RecordedEvent> recorded) {
        List<Long> result = new ArrayList<>(recorded.size());
        for (RecordedEvent event : recorded) {
            result.add(event.getSequence());
        }
        return result;
    }

    private List<RecordedEvent> appendInTransaction(String aggregateId, List<EncodedEvent> encoded)
            throws EventLogException {
        Instant recordedAt = configuration.clock().instant();
        try (AppendTransaction tx = beginAppend(aggregateId)) {
            List<RecordedEvent> recorded = new ArrayList<>(encoded.size());
            for (EncodedEvent event : encoded) {
                RecordedEvent rec = tx.insert(aggregateId, event, recordedAt);
                logger.debug("Recorded {}", rec);
                configuration.projections().dispatch(rec, false);
                recorded.add(rec);
            }
            tx.commit();
            return recorded;
        }
    }

    @Override
    public int replayFrom(long sequence, RecordedEventPublisher publisher) throws EventLogException {
        Objects.requireNonNull(publisher, "Publisher must be specified");
        writeLock.lock();
        try {
            List<RecordedEvent> events = loadFrom(sequence);
            for (RecordedEvent event : events) {
                publisher.publish(event, true);
            }
            return events.size();
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Build recorded event from stored values.
     * @return recorded event with decoded payload
     * @throws EventLogException when type is not registered or payload cannot be decoded
     */
    protected RecordedEvent decode(long sequence, String aggregateId, String eventType, String payload,
            Instant recordedAt) throws EventLogException {
        Event event = configuration.registry().decode(eventType, payload);
        return new RecordedEvent(sequence, aggregateId, eventType, event, recordedAt);
    }

    /**
     * Start a transaction for appending events. Called while holding the exclusive append lock.
     * @param aggregateId aggregate the events will be appended to
     * @return new transaction
     * @throws EventLogException when storage cannot start a transaction
     */
    protected abstract AppendTransaction beginAppend(String aggregateId) throws EventLogException;

    /**
     * Single append. Events inserted become visible to readers only after {@link #commit()}. Closing
     * the transaction without commit discards them.
     */
    protected interface AppendTransaction extends AutoCloseable {
        /**
         * Store an event, assigning it next sequence number.
         * @param aggregateId the aggregate
         * @param event encoded event
         * @param recordedAt recording time
         * @return the event decoded from its stored form
         * @throws EventLogException when storing or decoding fails
         */
        RecordedEvent insert(String aggregateId, EncodedEvent event, Instant recordedAt) throws EventLogException;

        void commit() throws EventLogException;

        // rolls back unless committed
        @Override
        void close() throws EventLogException;
    }
}
