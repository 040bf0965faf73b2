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

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Record of one invocation of a saga for one event. Instances are never deleted; replaying an event to sagas creates
 * new instances.
 */
public final class SagaInstance {
    private final long id;
    private final long eventId;
    private final String sagaName;
    private final SagaStatus status;
    private final String lastError;
    private final Instant createdAt;
    private final Instant updatedAt;

    public SagaInstance(long id, long eventId, String sagaName, SagaStatus status, String lastError,
            Instant createdAt, Instant updatedAt) {
        this.id = id;
        this.eventId = eventId;
        this.sagaName = Objects.requireNonNull(sagaName, "Saga name must be specified");
        this.status = Objects.requireNonNull(status, "Status must be specified");
        this.lastError = lastError;
        this.createdAt = Objects.requireNonNull(createdAt);
        this.updatedAt = Objects.requireNonNull(updatedAt);
    }

    public static SagaInstance running(long id, long eventId, String sagaName, Instant createdAt) {
        return new SagaInstance(id, eventId, sagaName, SagaStatus.RUNNING, null, createdAt, createdAt);
    }

    /**
     * Transition to completed state.
     * @param at time of transition
     * @return completed copy of this instance
     * @throws IllegalStateException when this instance has already finished
     */
    public SagaInstance completed(Instant at) {
        checkRunning(SagaStatus.COMPLETED);
        return new SagaInstance(id, eventId, sagaName, SagaStatus.COMPLETED, null, createdAt, at);
    }

    /**
     * Transition to error state.
     * @param error description of the failure
     * @param at time of transition
     * @return failed copy of this instance
     * @throws IllegalStateException when this instance has already finished
     */
    public SagaInstance failed(String error, Instant at) {
        checkRunning(SagaStatus.ERROR);
        return new SagaInstance(id, eventId, sagaName, SagaStatus.ERROR, error, createdAt, at);
    }

    private void checkRunning(SagaStatus target) {
        if (status.isTerminal()) {
            throw new IllegalStateException("Saga instance " + id + " is already " + status.code()
                    + " and cannot become " + target.code());
        }
    }

    public long getId() {
        return id;
    }

    /**
     * Sequence of the event this saga instance reacted to.
     * @return event sequence
     */
    public long getEventId() {
        return eventId;
    }

    public String getSagaName() {
        return sagaName;
    }

    public SagaStatus getStatus() {
        return status;
    }

    public Optional<String> getLastError() {
        return Optional.ofNullable(lastError);
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        SagaInstance that = (SagaInstance) o;
        return id == that.id
                && eventId == that.eventId
                && sagaName.equals(that.sagaName)
                && status == that.status
                && Objects.equals(lastError, that.lastError)
                && createdAt.equals(that.createdAt)
                && updatedAt.equals(that.updatedAt);
    }

    @Override
    public int hashCode() {
        return Long.hashCode(id);
    }

    @Override
    public String toString() {
        return "SagaInstance{" + id + " " + sagaName + "@" + eventId + " " + status.code()
                + (lastError == null ? "" : " " + lastError) + "}";
    }
}
