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

import java.time.Instant;
import java.util.Objects;

/**
 * An event as it was durably recorded in the log. Instances are created by the log only, and always carry the payload
 * as decoded from stored form, so that the value returned from an append equals the value of any later read.
 */
public final class RecordedEvent {
    private final long sequence;
    private final String aggregateId;
    private final String eventType;
    private final Event event;
    private final Instant recordedAt;

    public RecordedEvent(long sequence, String aggregateId, String eventType, Event event, Instant recordedAt) {
        this.sequence = sequence;
        this.aggregateId = Objects.requireNonNull(aggregateId, "Aggregate id must be specified");
        this.eventType = Objects.requireNonNull(eventType, "Event type must be specified");
        this.event = Objects.requireNonNull(event, "Event must be specified");
        this.recordedAt = Objects.requireNonNull(recordedAt, "Recording time must be specified");
    }

    /**
     * Position in the log. Unique and strictly increasing across the whole log, not per aggregate.
     * @return the sequence number
     */
    public long getSequence() {
        return sequence;
    }

    public String getAggregateId() {
        return aggregateId;
    }

    /**
     * The registry key the payload was stored under.
     * @return type name
     * @see Event#getType()
     */
    public String getEventType() {
        return eventType;
    }

    public Event getEvent() {
        return event;
    }

    /**
     * The payload cast to expected shape.
     * @param type expected class of the payload
     * @param <T> expected type
     * @return the payload
     * @throws IllegalArgumentException when payload is of different type
     */
    public <T extends Event> T getEvent(Class<T> type) {
        if (!type.isInstance(event)) {
            throw new IllegalArgumentException("Event " + sequence + " of type " + eventType + " is not a "
                    + type.getName());
        }
        return type.cast(event);
    }

    public Instant getRecordedAt() {
        return recordedAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;

        RecordedEvent that = (RecordedEvent) o;

        return sequence == that.sequence
                && aggregateId.equals(that.aggregateId)
                && eventType.equals(that.eventType)
                && event.equals(that.event)
                && recordedAt.equals(that.recordedAt);
    }

    @Override
    public int hashCode() {
        int result = Long.hashCode(sequence);
        result = 31 * result + aggregateId.hashCode();
        return result;
    }

    @Override
    public String toString() {
        return "RecordedEvent{" + sequence + " " + aggregateId + " " + eventType + " " + event + "}";
    }
}
