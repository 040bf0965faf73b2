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

import io.github.goodees.evoke.core.Event;
import io.github.goodees.evoke.core.EventLogException;
import io.github.goodees.evoke.core.EventType;
import io.github.goodees.evoke.core.RecordedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Runs named side effects after events were committed.
 *
 * <p>For every event, each saga registered for its type runs in registration order on the caller's thread. Before
 * a saga is invoked, a {@link SagaInstance} is stored as running; afterwards it is marked completed or failed with
 * the error message. Failure of a saga is only recorded: it doesn't stop the following sagas and is not reported to
 * the caller. There are no automatic retries.</p>
 *
 * <p>Failure of the instance store itself is reported to the caller of {@code dispatch}, as the outcome of sagas could
 * not be tracked. The event log logs such failure of a committed append instead of reporting it.</p>
 */
public class SagaOrchestrator {
    private static final Logger logger = LoggerFactory.getLogger(SagaOrchestrator.class);

    private final SagaInstanceStore instanceStore;
    private final ConcurrentMap<String, List<Registration>> sagas = new ConcurrentHashMap<>();

    public SagaOrchestrator(SagaInstanceStore instanceStore) {
        this.instanceStore = Objects.requireNonNull(instanceStore, "Saga instance store must be specified");
    }

    public SagaInstanceStore getInstanceStore() {
        return instanceStore;
    }

    /**
     * Register a saga for event type.
     * @param name name of the saga, stored with every instance. Unique per event type
     * @param eventType type of events to react to
     * @param handler the side effect
     * @throws EventLogException DUPLICATE_HANDLER when saga of that name already reacts to the event type
     */
    public void registerAsync(String name, String eventType, SagaHandler handler) throws EventLogException {
        Objects.requireNonNull(name, "Saga name must be specified");
        Objects.requireNonNull(eventType, "Event type must be specified");
        Objects.requireNonNull(handler, "Saga handler must be specified");
        List<Registration> registrations = sagas.computeIfAbsent(eventType, t -> new CopyOnWriteArrayList<>());
        synchronized (registrations) {
            for (Registration registration : registrations) {
                if (registration.name.equals(name)) {
                    throw EventLogException.duplicateHandler("Saga " + name, eventType);
                }
            }
            registrations.add(new Registration(name, handler));
        }
    }

    public void registerAsync(String name, Class<? extends Event> eventClass, SagaHandler handler)
            throws EventLogException {
        registerAsync(name, EventType.defaultTypeName(eventClass), handler);
    }

    public boolean hasSagas(String eventType) {
        return !sagas.getOrDefault(eventType, Collections.emptyList()).isEmpty();
    }

    /**
     * Run sagas for committed events, in order of events.
     * @param events committed events
     * @param replay whether events are replayed
     * @return instances created, in order of invocation
     * @throws EventLogException when instance store fails
     */
    public List<SagaInstance> dispatch(List<RecordedEvent> events, boolean replay) throws EventLogException {
        List<SagaInstance> result = new ArrayList<>();
        for (RecordedEvent event : events) {
            result.addAll(dispatch(event, replay));
        }
        return result;
    }

    /**
     * Run sagas for single committed event.
     * @param event committed event
     * @param replay whether event is replayed
     * @return instances created, in order of invocation
     * @throws EventLogException when instance store fails
     */
    public List<SagaInstance> dispatch(RecordedEvent event, boolean replay) throws EventLogException {
        List<Registration> registrations = sagas.getOrDefault(event.getEventType(), Collections.emptyList());
        if (registrations.isEmpty()) {
            return Collections.emptyList();
        }
        List<SagaInstance> result = new ArrayList<>(registrations.size());
        for (Registration saga : registrations) {
            SagaInstance instance = instanceStore.start(event.getSequence(), saga.name);
            String failure = invoke(saga, event, replay);
            if (failure == null) {
                result.add(instanceStore.complete(instance.getId()));
            } else {
                result.add(instanceStore.fail(instance.getId(), failure));
            }
        }
        return result;
    }

    private String invoke(Registration saga, RecordedEvent event, boolean replay) {
        try {
            saga.handler.handle(event, replay);
            logger.debug("Saga {} completed for {}", saga.name, event);
            return null;
        } catch (Exception e) {
            logger.error("Saga {} failed for {}", saga.name, event, e);
            return e.getMessage() != null ? e.getMessage() : e.getClass().getName();
        }
    }

    private static class Registration {
        private final String name;
        private final SagaHandler handler;

        Registration(String name, SagaHandler handler) {
            this.name = name;
            this.handler = handler;
        }
    }
}
