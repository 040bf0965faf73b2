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

import io.github.goodees.evoke.core.projection.ProjectionDispatcher;
import io.github.goodees.evoke.core.registry.TypeRegistry;
import io.github.goodees.evoke.core.saga.SagaOrchestrator;

import java.time.Clock;

/**
 * Dependencies of an event log backend.
 */
public interface EventLogConfiguration {
    /**
     * Registry used for encoding appended events, and decoding every event read.
     * @return the registry
     */
    TypeRegistry registry();

    /**
     * Handlers that run within the append transaction.
     * @return the dispatcher
     */
    ProjectionDispatcher projections();

    /**
     * Handlers that run after append has committed.
     * @return the orchestrator
     */
    SagaOrchestrator sagas();

    /**
     * Source of recording timestamps.
     * @return the clock
     */
    Clock clock();
}
