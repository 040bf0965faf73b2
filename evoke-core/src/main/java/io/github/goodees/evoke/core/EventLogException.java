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

import java.util.Collection;

/**
 * Exception generated when an operation on the event log, its handlers or its aggregates fails. The {@link Fault}
 * tells callers which kind of failure occurred without inspecting messages.
 */
public class EventLogException extends Exception {
    private final Fault fault;

    public enum Fault {
        /** Append was called with an empty batch. */
        NO_EVENTS,
        /** No handler is registered for the command. */
        UNKNOWN_COMMAND,
        /** A handler with the same key has already been registered. */
        DUPLICATE_HANDLER,
        /** The event type name is not known to the registry. */
        UNREGISTERED_TYPE,
        /** The payload could not be serialized or deserialized. */
        MALFORMED_PAYLOAD,
        /** A synchronous projection handler failed; the append was rolled back. */
        HANDLER_FAILED,
        /** Aggregate decision logic refused the command. */
        COMMAND_REJECTED,
        /** Aggregate failed to apply a past event while being rehydrated. */
        STATE_ERROR,
        /** No aggregate matches the requested id. */
        AGGREGATE_NOT_FOUND,
        /** More than one aggregate matches the requested id prefix. */
        AMBIGUOUS_AGGREGATE,
        /** The storage backend failed. */
        STORE_FAILED
    }

    protected EventLogException(Fault type, String message, Throwable cause) {
        super(message, cause);
        this.fault = type;
    }

    public Fault getFault() {
        return fault;
    }

    public static EventLogException noEvents(String aggregateId) {
        return new EventLogException(Fault.NO_EVENTS, "No events to append to aggregate " + aggregateId, null);
    }

    public static EventLogException unknownCommand(Command command) {
        return new EventLogException(Fault.UNKNOWN_COMMAND, "No handler for command "
                + command.getClass().getSimpleName(), null);
    }

    public static EventLogException duplicateHandler(String kind, String key) {
        return new EventLogException(Fault.DUPLICATE_HANDLER, kind + " already registered for " + key, null);
    }

    public static EventLogException unregisteredType(String eventType) {
        return new EventLogException(Fault.UNREGISTERED_TYPE, "Event type not registered: " + eventType
                + " (register it with TypeRegistry.register before use)", null);
    }

    public static EventLogException incompatibleType(String eventType, Class<?> registered, Class<?> actual) {
        return new EventLogException(Fault.UNREGISTERED_TYPE, "Event type " + eventType + " is registered to "
                + registered.getName() + " but was given " + actual.getName(), null);
    }

    public static EventLogException malformedPayload(String eventType, Throwable cause) {
        return new EventLogException(Fault.MALFORMED_PAYLOAD, "Malformed payload of event type " + eventType + ". "
                + cause.getMessage(), cause);
    }

    public static EventLogException handlerFailed(String eventType, long sequence, Throwable cause) {
        return new EventLogException(Fault.HANDLER_FAILED, "Handler for " + eventType + " failed on event "
                + sequence + ". " + cause.getMessage(), cause);
    }

    public static EventLogException commandRejected(String aggregateId, Throwable cause) {
        return new EventLogException(Fault.COMMAND_REJECTED, "Aggregate " + aggregateId + " rejected command. "
                + cause.getMessage(), cause);
    }

    public static EventLogException stateError(String aggregateId, long sequence, Throwable cause) {
        return new EventLogException(Fault.STATE_ERROR, "Aggregate " + aggregateId + " could not apply event "
                + sequence + ". " + cause.getMessage(), cause);
    }

    public static EventLogException aggregateNotFound(String prefix) {
        return new EventLogException(Fault.AGGREGATE_NOT_FOUND, "No aggregate found for " + prefix, null);
    }

    public static EventLogException ambiguousAggregate(String prefix, Collection<String> candidates) {
        return new EventLogException(Fault.AMBIGUOUS_AGGREGATE, "Aggregate id " + prefix + " is ambiguous: "
                + candidates, null);
    }

    public static EventLogException storeFailed(String operation, Throwable cause) {
        return new EventLogException(Fault.STORE_FAILED, operation + " failed. " + cause.getMessage(), cause);
    }
}
