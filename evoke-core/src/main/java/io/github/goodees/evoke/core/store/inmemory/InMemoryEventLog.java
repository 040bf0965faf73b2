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

import io.github.goodees.evoke.core.EventLogException;
import io.github.goodees.evoke.core.RecordedEvent;
import io.github.goodees.evoke.core.registry.EncodedEvent;
import io.github.goodees.evoke.core.registry.TypeRegistry;
import io.github.goodees.evoke.core.store.AbstractEventLog;
import io.github.goodees.evoke.core.store.EventLogConfiguration;
import io.github.goodees.evoke.core.store.LogOrder;
import io.github.goodees.evoke.core.store.SimpleEventLogConfiguration;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import static java.util.stream.Collectors.toList;

/**
 * Event log kept in memory. Nothing survives the process, it is meant for tests and ephemeral pipelines.
 *
 * <p>Payloads are still encoded and decoded through the registry, so the log behaves like the durable one with regard
 * to registration and payload shape.</p>
 */
public class InMemoryEventLog extends AbstractEventLog {
    private final ReadWriteLock storageLock = new ReentrantReadWriteLock();
    private final List<RecordedEvent> events = new ArrayList<>();
    private final Map<String, List<RecordedEvent>> streams = new HashMap<>();
    // guarded by the append lock of the base class
    private long nextSequence = 1;

    public InMemoryEventLog(EventLogConfiguration configuration) {
        super(configuration);
    }

    public InMemoryEventLog(TypeRegistry registry) {
        this(new SimpleEventLogConfiguration(registry));
    }

    @Override
    protected AppendTransaction beginAppend(String aggregateId) {
        return new StagedAppend();
    }

    @Override
    public List<RecordedEvent> loadStream(String aggregateId) {
        storageLock.readLock().lock();
        try {
            List<RecordedEvent> stream = streams.get(aggregateId);
            return stream == null ? Collections.emptyList() : new ArrayList<>(stream);
        } finally {
            storageLock.readLock().unlock();
        }
    }

    @Override
    public List<RecordedEvent> loadAll(LogOrder order) {
        List<RecordedEvent> result;
        storageLock.readLock().lock();
        try {
            result = new ArrayList<>(events);
        } finally {
            storageLock.readLock().unlock();
        }
        if (order == LogOrder.DESCENDING) {
            Collections.reverse(result);
        }
        return result;
    }

    @Override
    public List<RecordedEvent> loadFrom(long sequence) {
        storageLock.readLock().lock();
        try {
            return events.stream().filter(e -> e.getSequence() >= sequence).collect(toList());
        } finally {
            storageLock.readLock().unlock();
        }
    }

    @Override
    public List<String> findAggregateIds(String prefix) {
        storageLock.readLock().lock();
        try {
            return streams.keySet().stream().filter(id -> id.startsWith(prefix)).sorted().collect(toList());
        } finally {
            storageLock.readLock().unlock();
        }
    }

    /**
     * Keeps inserted events aside until commit, when they are published to readers at once.
     */
    class StagedAppend implements AppendTransaction {
        private final List<RecordedEvent> staged = new ArrayList<>();
        private final long firstSequence = nextSequence;
        private boolean committed;

        @Override
        public RecordedEvent insert(String aggregateId, EncodedEvent event, Instant recordedAt)
                throws EventLogException {
            long sequence = nextSequence++;
            RecordedEvent recorded = decode(sequence, aggregateId, event.getEventType(), event.getPayload(),
                recordedAt);
            staged.add(recorded);
            return recorded;
        }

        @Override
        public void commit() {
            storageLock.writeLock().lock();
            try {
                for (RecordedEvent event : staged) {
                    events.add(event);
                    streams.computeIfAbsent(event.getAggregateId(), id -> new ArrayList<>()).add(event);
                }
                committed = true;
            } finally {
                storageLock.writeLock().unlock();
            }
        }

        @Override
        public void close() {
            if (!committed) {
                nextSequence = firstSequence;
                if (!staged.isEmpty()) {
                    logger.debug("Discarding {} uncommitted events", staged.size());
                }
            }
        }
    }
}
