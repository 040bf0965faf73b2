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
import io.github.goodees.evoke.core.store.inmemory.InMemorySagaInstanceStore;

import java.time.Clock;
import java.util.Objects;

/**
 * General event log configuration, as alternative to defining own implementation. Its dependencies are passed to
 * constructor.
 */
public class SimpleEventLogConfiguration implements EventLogConfiguration {
    private final TypeRegistry registry;
    private final ProjectionDispatcher projections;
    private final SagaOrchestrator sagas;
    private final Clock clock;

    /**
     * Create event log configuration.
     * @param registry registry of event types
     * @param projections synchronous handlers
     * @param sagas post commit handlers
     * @param clock clock for recording timestamps
     */
    public SimpleEventLogConfiguration(TypeRegistry registry, ProjectionDispatcher projections,
                                       SagaOrchestrator sagas, Clock clock) {
        this.registry = Objects.requireNonNull(registry, "Type registry must be specified");
        this.projections = Objects.requireNonNull(projections, "Projection dispatcher must be specified");
        this.sagas = Objects.requireNonNull(sagas, "Saga orchestrator must be specified");
        this.clock = Objects.requireNonNull(clock, "Clock must be specified");
    }

    /**
     * Create event log configuration using system UTC clock.
     * @param registry registry of event types
     * @param projections synchronous handlers
     * @param sagas post commit handlers
     */
    public SimpleEventLogConfiguration(TypeRegistry registry, ProjectionDispatcher projections,
                                       SagaOrchestrator sagas) {
        this(registry, projections, sagas, Clock.systemUTC());
    }

    /**
     * Create event log configuration without any projections or sagas. Sagas registered later to {@link #sagas()}
     * track their instances in memory.
     * @param registry registry of event types
     */
    public SimpleEventLogConfiguration(TypeRegistry registry) {
        this(registry, new ProjectionDispatcher(), new SagaOrchestrator(new InMemorySagaInstanceStore()));
    }

    @Override
    public TypeRegistry registry() {
        return registry;
    }

    @Override
    public ProjectionDispatcher projections() {
        return projections;
    }

    @Override
    public SagaOrchestrator sagas() {
        return sagas;
    }

    @Override
    public Clock clock() {
        return clock;
    }
}
