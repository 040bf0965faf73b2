package io.github.goodees.evoke.core.saga;

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

import java.util.List;
import java.util.Optional;

/**
 * Persistence of saga instances. Every method is a single atomic statement against the storage, independent of any
 * event append transaction.
 */
public interface SagaInstanceStore {
    /**
     * Record that a saga is about to run for an event.
     * @param eventId sequence of the event
     * @param sagaName name of the saga
     * @return new instance in {@link SagaStatus#RUNNING} state
     * @throws EventLogException when storage fails
     */
    SagaInstance start(long eventId, String sagaName) throws EventLogException;

    /**
     * Mark running instance completed.
     * @param instanceId id of the instance
     * @return updated instance
     * @throws EventLogException when storage fails
     * @throws IllegalStateException when instance is not running
     */
    SagaInstance complete(long instanceId) throws EventLogException;

    /**
     * Mark running instance failed.
     * @param instanceId id of the instance
     * @param error failure description
     * @return updated instance
     * @throws EventLogException when storage fails
     * @throws IllegalStateException when instance is not running
     */
    SagaInstance fail(long instanceId, String error) throws EventLogException;

    Optional<SagaInstance> find(long instanceId) throws EventLogException;

    List<SagaInstance> findByEvent(long eventId) throws EventLogException;

    List<SagaInstance> findByStatus(SagaStatus status) throws EventLogException;
}
