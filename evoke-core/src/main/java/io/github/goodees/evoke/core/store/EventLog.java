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

import java.util.Arrays;
import java.util.List;

/**
 * Append-only log of events for many aggregates.
 *
 * <p>Every appended event gets a sequence number that is unique and strictly increasing across the entire log.
 * Appends are serialized within the log instance, so concurrent callers never interleave their sequence assignment.
 * Reads may run concurrently with an append, and only see events whose append has committed.</p>
 *
 * <p>Appending a batch is atomic: either all events of the batch are committed, or none. Synchronous projections
 * registered in the configured {@link io.github.goodees.evoke.core.projection.ProjectionDispatcher} run within the
 * same transaction, sagas of the {@link io.github.goodees.evoke.core.saga.SagaOrchestrator} run after commit.</p>
 */
public interface EventLog {

    /**
     * Append events to the stream of an aggregate.
     * @param aggregateId id of the aggregate
     * @param events events in the order they happened
     * @return the events as recorded, in the same order
     * @throws EventLogException NO_EVENTS for empty batch, UNREGISTERED_TYPE or MALFORMED_PAYLOAD when an event
     *         cannot be encoded, HANDLER_FAILED when a projection fails, STORE_FAILED on storage failure. In all of
     *         these cases nothing of the batch is committed. Failures of sagas, including failures to store their
     *         instances, happen after commit and are never thrown from here.
     */
    List<RecordedEvent> append(String aggregateId, List<? extends Event> events) throws EventLogException;

    default List<RecordedEvent> append(String aggregateId, Event... events) throws EventLogException {
        return append(aggregateId, Arrays.asList(events));
    }

    /**
     * Read all events of an aggregate. An aggregate without events has an empty stream, this is not an error.
     * @param aggregateId id of the aggregate
     * @return events ordered by ascending sequence
     * @throws EventLogException when a stored event cannot be decoded, or storage fails
     */
    List<RecordedEvent> loadStream(String aggregateId) throws EventLogException;

    /**
     * Read the entire log.
     * @param order order of the result
     * @return all events
     * @throws EventLogException when a stored event cannot be decoded, or storage fails
     */
    List<RecordedEvent> loadAll(LogOrder order) throws EventLogException;

    /**
     * Read all events starting at a sequence number.
     * @param sequence the first sequence number of interest
     * @return events with sequence equal or greater, ascending
     * @throws EventLogException when a stored event cannot be decoded, or storage fails
     */
    List<RecordedEvent> loadFrom(long sequence) throws EventLogException;

    /**
     * Deliver all events starting at a sequence number to a publisher, while no append may proceed.
     * @param sequence the first sequence number of interest
     * @param publisher the receiver, called with {@code replay} set to true
     * @return number of events delivered
     * @throws EventLogException when publisher fails, or reading fails. Delivery stops at the failing event.
     */
    int replayFrom(long sequence, RecordedEventPublisher publisher) throws EventLogException;

    /**
     * List distinct aggregate ids starting with prefix.
     * @param prefix the prefix, empty string for all
     * @return sorted aggregate ids
     * @throws EventLogException on storage failure
     */
    List<String> findAggregateIds(String prefix) throws EventLogException;

    /**
     * Resolve a shortened aggregate id into the single full id it abbreviates. The prefix is matched lower-cased.
     * @param prefix shortened id
     * @return full aggregate id
     * @throws EventLogException AGGREGATE_NOT_FOUND when nothing matches, AMBIGUOUS_AGGREGATE when multiple ids match
     */
    default String resolveAggregateId(String prefix) throws EventLogException {
        List<String> ids = findAggregateIds(prefix.toLowerCase());
        if (ids.isEmpty()) {
            throw EventLogException.aggregateNotFound(prefix);
        }
        if (ids.size() > 1) {
            throw EventLogException.ambiguousAggregate(prefix, ids);
        }
        return ids.get(0);
    }
}
