package io.github.goodees.evoke.core.replay;

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
import io.github.goodees.evoke.core.projection.ProjectionDispatcher;
import io.github.goodees.evoke.core.saga.SagaOrchestrator;
import io.github.goodees.evoke.core.store.AbstractEventLog;
import io.github.goodees.evoke.core.store.EventLog;
import io.github.goodees.evoke.core.store.RecordedEventPublisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Drives historical events through handlers again, to rebuild projections or bootstrap new ones.
 *
 * <p>Events are delivered in order of sequence with the replay flag set, while the log accepts no appends. Replay
 * stops at the first failing handler.</p>
 */
public class ReplayEngine {
    private static final Logger logger = LoggerFactory.getLogger(ReplayEngine.class);

    private final EventLog eventLog;
    private final ProjectionDispatcher projections;
    private final SagaOrchestrator sagas;

    public ReplayEngine(EventLog eventLog, ProjectionDispatcher projections, SagaOrchestrator sagas) {
        this.eventLog = Objects.requireNonNull(eventLog, "Event log must be specified");
        this.projections = Objects.requireNonNull(projections, "Projection dispatcher must be specified");
        this.sagas = Objects.requireNonNull(sagas, "Saga orchestrator must be specified");
    }

    /**
     * Create engine replaying into the handlers the log itself dispatches to.
     * @param eventLog the log
     */
    public ReplayEngine(AbstractEventLog eventLog) {
        this(eventLog, eventLog.getConfiguration().projections(), eventLog.getConfiguration().sagas());
    }

    /**
     * Replay entire log to projections.
     * @return number of replayed events
     * @throws EventLogException when a projection fails
     */
    public int replayAll() throws EventLogException {
        return replayFrom(0, SagaReplayPolicy.SKIP);
    }

    /**
     * Replay log to projections.
     * @param sequence first sequence to replay
     * @return number of replayed events
     * @throws EventLogException when a projection fails
     */
    public int replayFrom(long sequence) throws EventLogException {
        return replayFrom(sequence, SagaReplayPolicy.SKIP);
    }

    /**
     * Replay log to projections, and possibly sagas.
     * @param sequence first sequence to replay
     * @param policy whether to run sagas as well
     * @return number of replayed events
     * @throws EventLogException when a projection fails, or saga instances cannot be stored
     */
    public int replayFrom(long sequence, SagaReplayPolicy policy) throws EventLogException {
        Objects.requireNonNull(policy, "Saga replay policy must be specified");
        return replayFrom(sequence, (event, replay) -> {
            projections.dispatch(event, replay);
            if (policy == SagaReplayPolicy.RERUN) {
                sagas.dispatch(event, replay);
            }
        });
    }

    /**
     * Replay log into a single receiver, e. g. a projection being introduced.
     * @param sequence first sequence to replay
     * @param target the receiver
     * @return number of replayed events
     * @throws EventLogException when target fails
     */
    public int replayFrom(long sequence, RecordedEventPublisher target) throws EventLogException {
        logger.info("Replaying events from sequence {}", sequence);
        try {
            int count = eventLog.replayFrom(sequence, target);
            logger.info("Replayed {} events from sequence {}", count, sequence);
            return count;
        } catch (EventLogException e) {
            logger.error("Replay from sequence {} failed", sequence, e);
            throw e;
        }
    }
}
