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

import io.github.goodees.evoke.core.EventLogException;
import io.github.goodees.evoke.core.RecordedEvent;
import io.github.goodees.evoke.core.projection.ProjectionDispatcher;
import io.github.goodees.evoke.core.registry.TypeRegistry;
import io.github.goodees.evoke.core.saga.SagaInstance;
import io.github.goodees.evoke.core.saga.SagaInstanceStore;
import io.github.goodees.evoke.core.saga.SagaOrchestrator;
import io.github.goodees.evoke.core.saga.SagaStatus;
import io.github.goodees.evoke.core.saga.UnavailableSagaInstanceStore;
import io.github.goodees.evoke.example.order.OrderCreatedEvent;
import io.github.goodees.evoke.example.order.OrderEvents;
import io.github.goodees.evoke.example.order.OrderShippedEvent;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ErrorCollector;
import org.junit.rules.TestName;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.LongStream;

import static io.github.goodees.evoke.example.order.OrderEvents.cancelled;
import static io.github.goodees.evoke.example.order.OrderEvents.couponApplied;
import static io.github.goodees.evoke.example.order.OrderEvents.created;
import static io.github.goodees.evoke.example.order.OrderEvents.shipped;
import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

/**
 * Behavior every event log backend has to provide.
 */
public abstract class AbstractEventLogTest {
    protected static final Instant NOW = Instant.parse("2017-05-01T10:15:30Z");

    @Rule
    public TestName testName = new TestName();
    @Rule
    public ErrorCollector collector = new ErrorCollector();

    protected TypeRegistry registry;
    protected ProjectionDispatcher projections;
    protected SagaInstanceStore sagaStore;
    protected SagaOrchestrator sagas;
    protected EventLog eventLog;

    protected abstract SagaInstanceStore createSagaStore(Clock clock);

    protected abstract EventLog createEventLog(EventLogConfiguration configuration);

    @Before
    public void setUpLog() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        registry = OrderEvents.registry();
        projections = new ProjectionDispatcher();
        sagaStore = createSagaStore(clock);
        sagas = new SagaOrchestrator(sagaStore);
        eventLog = createEventLog(new SimpleEventLogConfiguration(registry, projections, sagas, clock));
    }

    protected String name() {
        return testName.getMethodName();
    }

    @Test
    public void appended_events_are_loaded_in_order() throws EventLogException {
        eventLog.append("A", created("A"));
        eventLog.append("A", shipped("A"));

        List<RecordedEvent> stream = eventLog.loadStream("A");
        assertEquals(2, stream.size());
        assertEquals(1, stream.get(0).getSequence());
        assertEquals("OrderCreated", stream.get(0).getEventType());
        assertEquals(2, stream.get(1).getSequence());
        assertEquals("OrderShipped", stream.get(1).getEventType());
        assertEquals(shipped("A"), stream.get(1).getEvent());
        assertEquals(NOW, stream.get(1).getRecordedAt());
    }

    @Test
    public void append_returns_events_as_they_are_loaded() throws EventLogException {
        List<RecordedEvent> recorded = eventLog.append(name(), created(name()), shipped(name()));

        assertEquals(eventLog.loadStream(name()), recorded);
        assertEquals(name(), recorded.get(0).getAggregateId());
        assertTrue(recorded.get(0).getSequence() < recorded.get(1).getSequence());
    }

    @Test
    public void sequence_is_global_across_aggregates() throws EventLogException {
        eventLog.append("A", created("A"));
        eventLog.append("B", created("B"));
        eventLog.append("A", shipped("A"));

        assertEquals(Arrays.asList(1L, 3L), sequences(eventLog.loadStream("A")));
        assertEquals(Collections.singletonList(2L), sequences(eventLog.loadStream("B")));
    }

    @Test
    public void stream_of_unknown_aggregate_is_empty() throws EventLogException {
        assertTrue(eventLog.loadStream(name()).isEmpty());
    }

    @Test
    public void empty_append_is_rejected() {
        try {
            eventLog.append(name(), Collections.emptyList());
            fail("should have failed");
        } catch (EventLogException e) {
            assertEquals(EventLogException.Fault.NO_EVENTS, e.getFault());
        }
    }

    @Test
    public void unregistered_event_type_writes_nothing() throws EventLogException {
        eventLog.append(name(), created(name()));
        try {
            eventLog.append(name(), shipped(name()), couponApplied(name()));
            fail("should have failed");
        } catch (EventLogException e) {
            assertEquals(EventLogException.Fault.UNREGISTERED_TYPE, e.getFault());
        }
        assertEquals(1, eventLog.loadAll(LogOrder.ASCENDING).size());
    }

    @Test
    public void failing_projection_rolls_back_whole_batch() throws EventLogException {
        List<Long> projected = new ArrayList<>();
        projections.registerSync(OrderCreatedEvent.class, (event, replay) -> projected.add(event.getSequence()));
        projections.registerSync(OrderShippedEvent.class, (event, replay) -> {
            throw new IllegalStateException("read model unavailable");
        });
        sagas.registerAsync("notify", OrderCreatedEvent.class, (event, replay) -> fail("saga must not run"));

        try {
            eventLog.append(name(), created(name()), shipped(name()));
            fail("should have failed");
        } catch (EventLogException e) {
            assertEquals(EventLogException.Fault.HANDLER_FAILED, e.getFault());
            assertThat(e.getMessage(), containsString("read model unavailable"));
        }
        // handlers own their side effects, the earlier event was already projected
        assertEquals(Collections.singletonList(1L), projected);
        assertTrue(eventLog.loadStream(name()).isEmpty());
        assertTrue(eventLog.loadAll(LogOrder.ASCENDING).isEmpty());
        assertTrue(sagaStore.findByStatus(SagaStatus.RUNNING).isEmpty());
        assertTrue(sagaStore.findByStatus(SagaStatus.COMPLETED).isEmpty());
    }

    @Test
    public void log_accepts_appends_after_rolled_back_one() throws EventLogException {
        projections.registerSync(OrderShippedEvent.class, (event, replay) -> {
            throw new IllegalStateException("no shipping");
        });
        try {
            eventLog.append(name(), shipped(name()));
            fail("should have failed");
        } catch (EventLogException e) {
            assertEquals(EventLogException.Fault.HANDLER_FAILED, e.getFault());
        }
        List<RecordedEvent> recorded = eventLog.append(name(), created(name()));
        assertEquals(eventLog.loadAll(LogOrder.ASCENDING), recorded);
    }

    @Test
    public void projections_receive_live_events() throws EventLogException {
        List<String> seen = new ArrayList<>();
        projections.registerSync(OrderCreatedEvent.class,
            (event, replay) -> seen.add(event.getEventType() + "@" + event.getSequence() + ":" + replay));
        projections.registerSync(OrderCreatedEvent.class, (event, replay) -> seen.add("second"));

        eventLog.append(name(), created(name()), shipped(name()));

        assertEquals(Arrays.asList("OrderCreated@1:false", "second"), seen);
    }

    @Test
    public void failing_saga_does_not_affect_others_nor_append() throws EventLogException {
        sagas.registerAsync("billing", OrderCreatedEvent.class, (event, replay) -> {
            throw new IllegalStateException("billing down");
        });
        sagas.registerAsync("mailing", OrderCreatedEvent.class, (event, replay) -> { });

        List<RecordedEvent> recorded = eventLog.append(name(), created(name()));

        assertEquals(1, eventLog.loadStream(name()).size());
        List<SagaInstance> instances = sagaStore.findByEvent(recorded.get(0).getSequence());
        assertEquals(2, instances.size());
        SagaInstance billing = instances.get(0);
        assertEquals("billing", billing.getSagaName());
        assertEquals(SagaStatus.ERROR, billing.getStatus());
        assertEquals("billing down", billing.getLastError().get());
        SagaInstance mailing = instances.get(1);
        assertEquals("mailing", mailing.getSagaName());
        assertEquals(SagaStatus.COMPLETED, mailing.getStatus());
        assertEquals(NOW, mailing.getUpdatedAt());
    }

    @Test
    public void unavailable_saga_store_does_not_fail_committed_append() throws EventLogException {
        SagaOrchestrator untracked = new SagaOrchestrator(new UnavailableSagaInstanceStore());
        List<String> calls = new ArrayList<>();
        untracked.registerAsync("billing", OrderCreatedEvent.class, (event, replay) -> calls.add("billing"));
        EventLog log = createEventLog(new SimpleEventLogConfiguration(registry, projections, untracked,
            Clock.fixed(NOW, ZoneOffset.UTC)));

        List<RecordedEvent> recorded = log.append(name(), created(name()));

        assertEquals(1, recorded.size());
        assertEquals(recorded, log.loadStream(name()));
        assertTrue(calls.isEmpty());
    }

    @Test
    public void sagas_see_committed_events() throws EventLogException {
        List<Integer> visible = new ArrayList<>();
        sagas.registerAsync("audit", OrderShippedEvent.class,
            (event, replay) -> visible.add(eventLog.loadStream(event.getAggregateId()).size()));

        eventLog.append(name(), created(name()), shipped(name()));

        assertEquals(Collections.singletonList(2), visible);
    }

    @Test
    public void concurrent_appends_never_share_sequence() throws Exception {
        int n = 25;
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            List<Future<List<Long>>> results = new ArrayList<>();
            for (String aggregate : Arrays.asList("left", "right")) {
                Callable<List<Long>> writer = () -> {
                    start.await();
                    List<Long> sequences = new ArrayList<>();
                    for (int i = 0; i < n; i++) {
                        sequences.addAll(sequences(eventLog.append(aggregate, created(aggregate))));
                    }
                    return sequences;
                };
                results.add(executor.submit(writer));
            }
            start.countDown();
            List<Long> all = new ArrayList<>();
            for (Future<List<Long>> result : results) {
                List<Long> sequences = result.get(30, TimeUnit.SECONDS);
                collector.checkThat(sequences, is(sorted(sequences)));
                all.addAll(sequences);
            }
            Set<Long> expected = LongStream.rangeClosed(1, 2 * n).boxed()
                    .collect(Collectors.toCollection(TreeSet::new));
            assertEquals(2 * n, all.size());
            assertEquals(expected, new TreeSet<>(all));
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    public void log_can_be_read_in_both_orders() throws EventLogException {
        eventLog.append("A", created("A"));
        eventLog.append("B", created("B"));
        eventLog.append("A", cancelled("A", "changed mind"));

        assertEquals(Arrays.asList(1L, 2L, 3L), sequences(eventLog.loadAll(LogOrder.ASCENDING)));
        assertEquals(Arrays.asList(3L, 2L, 1L), sequences(eventLog.loadAll(LogOrder.DESCENDING)));
        assertEquals(Arrays.asList(2L, 3L), sequences(eventLog.loadFrom(2)));
        assertTrue(eventLog.loadFrom(4).isEmpty());
    }

    @Test
    public void replay_delivers_events_with_replay_flag() throws EventLogException {
        eventLog.append("A", created("A"), shipped("A"));
        List<String> delivered = new ArrayList<>();

        int count = eventLog.replayFrom(2, (event, replay) -> delivered.add(event.getSequence() + ":" + replay));

        assertEquals(1, count);
        assertEquals(Collections.singletonList("2:true"), delivered);
    }

    @Test
    public void aggregate_ids_are_found_by_prefix() throws EventLogException {
        eventLog.append("order-abc", created("order-abc"));
        eventLog.append("order-abd", created("order-abd"));
        eventLog.append("order-abc", shipped("order-abc"));
        eventLog.append("a_1", created("a_1"));
        eventLog.append("ab1", created("ab1"));

        assertEquals(Arrays.asList("order-abc", "order-abd"), eventLog.findAggregateIds("order-"));
        assertEquals(Collections.singletonList("a_1"), eventLog.findAggregateIds("a_"));
        assertEquals(4, eventLog.findAggregateIds("").size());
        assertEquals("order-abc", eventLog.resolveAggregateId("ORDER-ABC"));
        assertEquals("order-abd", eventLog.resolveAggregateId("order-abd"));
    }

    @Test
    public void resolving_aggregate_id_reports_absent_and_ambiguous_ids() throws EventLogException {
        eventLog.append("order-abc", created("order-abc"));
        eventLog.append("order-abd", created("order-abd"));
        try {
            eventLog.resolveAggregateId("order-ab");
            fail("should have failed");
        } catch (EventLogException e) {
            assertEquals(EventLogException.Fault.AMBIGUOUS_AGGREGATE, e.getFault());
            assertThat(e.getMessage(), containsString("order-abd"));
        }
        try {
            eventLog.resolveAggregateId("invoice");
            fail("should have failed");
        } catch (EventLogException e) {
            assertEquals(EventLogException.Fault.AGGREGATE_NOT_FOUND, e.getFault());
        }
    }

    protected static List<Long> sequences(List<RecordedEvent> events) {
        return events.stream().map(RecordedEvent::getSequence).collect(Collectors.toList());
    }

    private static List<Long> sorted(List<Long> values) {
        List<Long> copy = new ArrayList<>(values);
        Collections.sort(copy);
        return copy;
    }
}
