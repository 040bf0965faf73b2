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

import java.util.Objects;

/**
 * Generic stored form of an event: registry key and serialized payload.
 */
public final class EncodedEvent {
    private final String eventType;
    private final String payload;

    public EncodedEvent(String eventType, String payload) {
        this.eventType = Objects.requireNonNull(eventType);
        this.payload = Objects.requireNonNull(payload);
    }

    public String getEventType() {
        return eventType;
    }

    public String getPayload() {
        return payload;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        EncodedEvent that = (EncodedEvent) o;
        return eventType.equals(that.eventType) && payload.equals(that.payload);
    }

    @Override
    public int hashCode() {
        return 31 * eventType.hashCode() + payload.hashCode();
    }

    @Override
    public String toString() {
        return eventType + " " + payload;
    }
}
