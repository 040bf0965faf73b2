package io.github.goodees.evoke.core.store.inmemory;

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

import io.github.goodees.evoke.core.saga.SagaInstance;
import io.github.goodees.evoke.core.saga.SagaInstanceStore;
import io.github.goodees.evoke.core.saga.SagaStatus;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

import static java.util.stream.Collectors.toList;

/**
 * Stores saga instances in memory. Pairs with {@link InMemoryEventLog}.
 */
public class InMemorySagaInstanceStore implements SagaInstanceStore {
    private final ConcurrentMap<Long, SagaInstance> instances = new ConcurrentHashMap<>();
    private final AtomicLong ids = new AtomicLong();
    private final Clock clock;

    public InMemorySagaInstanceStore() {
        this(Clock.systemUTC());
    }

    public InMemorySagaInstanceStore(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "Clock must be specified");
    }

    @Override
    public SagaInstance start(long eventId, String sagaName) {
        SagaInstance instance = SagaInstance.running(ids.incrementAndGet(), eventId, sagaName, clock.instant());
        instances.put(instance.getId(), instance);
        return instance;
    }

    @Override
    public SagaInstance complete(long instanceId) {
        return transition(instanceId, i -> i.completed(clock.instant()));
    }

    @Override
    public SagaInstance fail(long instanceId, String error) {
        return transition(instanceId, i -> i.failed(error, clock.instant()));
    }

    private SagaInstance transition(long instanceId, UnaryOperator<SagaInstance> change) {
        SagaInstance result = instances.computeIfPresent(instanceId, (id, instance) -> change.apply(instance));
        if (result == null) {
            throw new IllegalStateException("Unknown saga instance " + instanceId);
        }
        return result;
    }

    @Override
    public Optional<SagaInstance> find(long instanceId) {
        return Optional.ofNullable(instances.get(instanceId));
    }

    @Override
    public List<SagaInstance> findByEvent(long eventId) {
        return select(i -> i.getEventId() == eventId);
    }

    @Override
    public List<SagaInstance> findByStatus(SagaStatus status) {
        return select(i -> i.getStatus() == status);
    }

    private List<SagaInstance> select(Predicate<SagaInstance> filter) {
        return instances.values().stream()
                .filter(filter)
                .sorted(Comparator.comparingLong(SagaInstance::getId))
                .collect(toList());
    }
}
