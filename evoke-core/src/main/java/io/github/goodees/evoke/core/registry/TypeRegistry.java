package io.github.goodees.evoke.core.registry;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.github.goodees.evoke.core.Event;
import io.github.goodees.evoke.core.EventLogException;
import io.github.goodees.evoke.core.EventType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Table of event shapes that can be stored in and read back from the log. Each shape is bound to a type name, the
 * payload is serialized into JSON by Jackson.
 *
 * <p>All shapes should be registered at startup, before any events are appended or read. Registration is thread safe,
 * but registering the same name twice replaces the earlier binding, so concurrent registration of a name is a race the
 * caller must avoid.</p>
 *
 * <p>The registered class is what Jackson deserializes into. For abstract event types (e. g. Immutables value
 * interfaces) it needs to carry {@code @JsonDeserialize(as = ...)} pointing at the concrete implementation.</p>
 */
public class TypeRegistry {
    private static final Logger logger = LoggerFactory.getLogger(TypeRegistry.class);

    private final ConcurrentMap<String, Class<? extends Event>> types = new ConcurrentHashMap<>();
    private final ObjectMapper mapper;

    /**
     * Create registry with default JSON mapping.
     * @see #defaultMapper()
     */
    public TypeRegistry() {
        this(defaultMapper());
    }

    public TypeRegistry(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "Object mapper must be specified");
    }

    /**
     * Mapper with JDK8 and Java time support, ISO dates and tolerance for properties unknown to the current event
     * shape.
     * @return new object mapper
     */
    public static ObjectMapper defaultMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModules(new Jdk8Module(), new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    /**
     * Register event shape under its default type name.
     * @param eventClass class of the event
     * @return the type name it was registered under
     * @see EventType#defaultTypeName(Class)
     */
    public String register(Class<? extends Event> eventClass) {
        String typeName = EventType.defaultTypeName(eventClass);
        register(typeName, eventClass);
        return typeName;
    }

    /**
     * Register event shape under explicit type name. Use this when the event overrides {@link Event#getType()}.
     * @param typeName the type name
     * @param eventClass class to deserialize payloads of that type into
     */
    public void register(String typeName, Class<? extends Event> eventClass) {
        Objects.requireNonNull(typeName, "Type name must be specified");
        Objects.requireNonNull(eventClass, "Event class must be specified");
        Class<? extends Event> previous = types.put(typeName, eventClass);
        if (previous != null && !previous.equals(eventClass)) {
            logger.warn("Event type {} re-registered from {} to {}", typeName, previous.getName(),
                eventClass.getName());
        }
    }

    public boolean isRegistered(String typeName) {
        return types.containsKey(typeName);
    }

    public Set<String> registeredTypes() {
        return Collections.unmodifiableSet(new TreeSet<>(types.keySet()));
    }

    /**
     * Convert event into its stored form.
     * @param event the event
     * @return type name and JSON payload
     * @throws EventLogException UNREGISTERED_TYPE when event's type is not registered, or registered to a class
     *         the event is not instance of; MALFORMED_PAYLOAD when event cannot be serialized
     */
    public EncodedEvent encode(Event event) throws EventLogException {
        Objects.requireNonNull(event, "Event must be specified");
        String typeName = event.getType();
        Class<? extends Event> registered = lookup(typeName);
        if (!registered.isInstance(event)) {
            throw EventLogException.incompatibleType(typeName, registered, event.getClass());
        }
        try {
            return new EncodedEvent(typeName, mapper.writeValueAsString(event));
        } catch (JsonProcessingException e) {
            throw EventLogException.malformedPayload(typeName, e);
        }
    }

    /**
     * Read a payload back into fresh instance of the shape registered under type name.
     * @param typeName stored type name
     * @param payload stored payload
     * @return the event
     * @throws EventLogException UNREGISTERED_TYPE when name is not known, MALFORMED_PAYLOAD when payload doesn't
     *         deserialize
     */
    public Event decode(String typeName, String payload) throws EventLogException {
        Class<? extends Event> registered = lookup(typeName);
        try {
            Event event = mapper.readValue(payload, registered);
            if (event == null) {
                throw EventLogException.malformedPayload(typeName, new IllegalArgumentException("null payload"));
            }
            return event;
        } catch (JsonProcessingException | RuntimeException e) {
            throw EventLogException.malformedPayload(typeName, e);
        }
    }

    public Event decode(EncodedEvent encoded) throws EventLogException {
        return decode(encoded.getEventType(), encoded.getPayload());
    }

    private Class<? extends Event> lookup(String typeName) throws EventLogException {
        Class<? extends Event> registered = typeName == null ? null : types.get(typeName);
        if (registered == null) {
            throw EventLogException.unregisteredType(typeName);
        }
        return registered;
    }
}
