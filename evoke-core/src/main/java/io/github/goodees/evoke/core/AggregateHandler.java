package io.github.goodees.evoke.core;

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

import io.github.goodees.evoke.core.bus.CommandHandler;
import io.github.goodees.evoke.core.store.EventLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * Executes commands against aggregates rebuilt from the log.
 *
 * <p>Every command goes through the same steps:
 * <ol>
 *     <li>a fresh aggregate is created by the factory for the command's aggregate id</li>
 *     <li>its entire stream is loaded and applied in order of sequence. An aggregate without history stays in its
 *     initial state</li>
 *     <li>the aggregate decides about the command, producing new events</li>
 *     <li>the events are appended to the aggregate's stream</li>
 * </ol>
 * No aggregate is cached between commands, the log is the only state.
 *
 * <p>Commands for the same aggregate id are executed one at a time by one handler instance, so that no decision is
 * made on a state that another command is about to extend.</p>
 *
 * @param <C> type of command
 * @param <A> type of aggregate
 */
public class AggregateHandler<C extends Command, A extends Aggregate<? super C>> implements CommandHandler<C> {
    private static final Logger logger = LoggerFactory.getLogger(AggregateHandler.class);
    private static final int LOCK_STRIPES = 64;

    private final EventLog eventLog;
    private final Function<String, A> factory;
    private final ReentrantLock[] locks = new ReentrantLock[LOCK_STRIPES];

    public AggregateHandler(EventLog eventLog, Function<String, A> factory) {
        this.eventLog = Objects.requireNonNull(eventLog, "Event log must be specified");
        this.factory = Objects.requireNonNull(factory, "Aggregate factory must be specified");
        for (int i = 0; i < locks.length; i++) {
            locks[i] = new ReentrantLock();
        }
    }

    /**
     * Execute command.
     * @param command the command
     * @return recorded events, empty when aggregate decided nothing happens
     * @throws EventLogException STATE_ERROR when history cannot be applied, COMMAND_REJECTED when aggregate refuses
     *         the command, or any failure of the append
     */
    @Override
    public List<RecordedEvent> handle(C command) throws EventLogException {
        String aggregateId = Objects.requireNonNull(command.aggregateId(), "Command must specify aggregate id");
        ReentrantLock lock = lockFor(aggregateId);
        lock.lock();
        try {
            A aggregate = load(aggregateId);
            List<? extends Event> events = decide(aggregateId, aggregate, command);
            if (events == null || events.isEmpty()) {
                logger.debug("{} produced no events for {}", aggregateId, command);
                return Collections.emptyList();
            }
            return eventLog.append(aggregateId, events);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Rebuild current state of an aggregate.
     * @param aggregateId the aggregate id
     * @return aggregate with all events applied
     * @throws EventLogException STATE_ERROR when the aggregate fails to apply an event, or failure to read the stream
     */
    public A load(String aggregateId) throws EventLogException {
        A aggregate = factory.apply(aggregateId);
        for (RecordedEvent event : eventLog.loadStream(aggregateId)) {
            try {
                aggregate.apply(event.getEvent());
            } catch (RuntimeException e) {
                throw EventLogException.stateError(aggregateId, event.getSequence(), e);
            }
        }
        return aggregate;
    }

    private List<? extends Event> decide(String aggregateId, A aggregate, C command) throws EventLogException {
        try {
            return aggregate.handleCommand(command);
        } catch (EventLogException e) {
            throw e;
        } catch (Exception e) {
            throw EventLogException.commandRejected(aggregateId, e);
        }
    }

    private ReentrantLock lockFor(String aggregateId) {
        return locks[Math.floorMod(aggregateId.hashCode(), locks.length)];
    }
}
