package io.github.goodees.evoke.core.projection;

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
import io.github.goodees.evoke.core.store.RecordedEventPublisher;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Synchronous projections keyed by event type. The event log calls it within its append transaction; handlers of
 * an event type run in registration order and the first failure stops the dispatch.
 */
public class ProjectionDispatcher implements RecordedEventPublisher {
    private final ConcurrentMap<String, List<ProjectionHandler>> handlers = new ConcurrentHashMap<>();

    public void registerSync(String eventType, ProjectionHandler handler) {
        Objects.requireNonNull(eventType, "Event type must be specified");
        Objects.requireNonNull(handler, "Projection handler must be specified");
        handlers.computeIfAbsent(eventType, t -> new CopyOnWriteArrayList<>()).add(handler);
    }

    public void registerSync(Class<? extends Event> eventClass, ProjectionHandler handler) {
        registerSync(EventType.defaultTypeName(eventClass), handler);
    }

    public boolean hasHandlers(String eventType) {
        return !handlers.getOrDefault(eventType, Collections.emptyList()).isEmpty();
    }

    /**
     * Pass event to every handler registered for its type.
     * @param event the event
     * @param replay whether event is replayed
     * @throws EventLogException HANDLER_FAILED wrapping the failure of a handler
     */
    public void dispatch(RecordedEvent event, boolean replay) throws EventLogException {
        for (ProjectionHandler handler : handlers.getOrDefault(event.getEventType(), Collections.emptyList())) {
            try {
                handler.handle(event, replay);
            } catch (Exception e) {
                throw EventLogException.handlerFailed(event.getEventType(), event.getSequence(), e);
            }
        }
    }

    @Override
    public void publish(RecordedEvent event, boolean replay) throws EventLogException {
        dispatch(event, replay);
    }
}
