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

import io.github.goodees.evoke.core.store.inmemory.InMemoryEventLog;
import io.github.goodees.evoke.example.order.Order;
import io.github.goodees.evoke.example.order.OrderCommand;
import io.github.goodees.evoke.example.order.OrderEvents;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TestName;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static io.github.goodees.evoke.example.order.OrderEvents.created;
import static io.github.goodees.evoke.example.order.OrderEvents.shipped;
import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class AggregateHandlerTest {
    @Rule
    public TestName testName = new TestName();

    private InMemoryEventLog eventLog;
    private AggregateHandler<OrderCommand, Order> handler;

    @Before
    public void setUp() {
        eventLog = new InMemoryEventLog(OrderEvents.registry());
        handler = new AggregateHandler<>(eventLog, Order::new);
    }

    private String name() {
        return testName.getMethodName();
    }

    @Test
    public void new_aggregate_starts_from_initial_state() throws EventLogException {
        Order order = handler.load(name());

        assertEquals(Order.State.NEW, order.getState());
        assertEquals(0, order.getAppliedEvents());
    }

    @Test
    public void command_appends_decided_events() throws EventLogException {
        List<RecordedEvent> created = handler.handle(new OrderCommand.Create(name(), "bob"));
        List<RecordedEvent> shipped = handler.handle(new OrderCommand.Ship(name(), "TRK-1"));

        assertEquals(1, created.size());
        assertEquals("OrderCreated", created.get(0).getEventType());
        assertEquals(2, shipped.get(0).getSequence());
        Order order = handler.load(name());
        assertEquals(Order.State.SHIPPED, order.getState());
        assertEquals("bob", order.getCustomer());
        assertEquals(2, order.getAppliedEvents());
    }

    @Test
    public void command_without_outcome_appends_nothing() throws EventLogException {
        handler.handle(new OrderCommand.Create(name(), "bob"));

        assertTrue(handler.handle(new OrderCommand.Create(name(), "eve")).isEmpty());
        assertEquals(1, eventLog.loadStream(name()).size());
    }

    @Test
    public void rejected_command_appends_nothing() throws EventLogException {
        try {
            handler.handle(new OrderCommand.Ship(name(), "TRK-1"));
            fail("should have failed");
        } catch (EventLogException e) {
            assertEquals(EventLogException.Fault.COMMAND_REJECTED, e.getFault());
            assertThat(e.getMessage(), containsString("cannot be shipped in state NEW"));
        }
        assertTrue(eventLog.loadStream(name()).isEmpty());
    }

    @Test
    public void history_that_cannot_be_applied_is_state_error() throws EventLogException {
        eventLog.append(name(), shipped(name()));
        try {
            handler.handle(new OrderCommand.Cancel(name(), "too late"));
            fail("should have failed");
        } catch (EventLogException e) {
            assertEquals(EventLogException.Fault.STATE_ERROR, e.getFault());
        }
        assertEquals(1, eventLog.loadStream(name()).size());
    }

    @Test
    public void append_failures_pass_through() throws EventLogException {
        eventLog.getConfiguration().projections().registerSync("OrderCancelled", (event, replay) -> {
            throw new IllegalStateException("read model down");
        });
        eventLog.append(name(), created(name()));
        try {
            handler.handle(new OrderCommand.Cancel(name(), "changed mind"));
            fail("should have failed");
        } catch (EventLogException e) {
            assertEquals(EventLogException.Fault.HANDLER_FAILED, e.getFault());
        }
    }

    @Test
    public void concurrent_commands_for_one_aggregate_are_serialized() throws Exception {
        handler.handle(new OrderCommand.Create(name(), "bob"));
        int attempts = 8;
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger rejected = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(attempts);
        try {
            List<Future<?>> results = new ArrayList<>();
            for (int i = 0; i < attempts; i++) {
                String tracking = "TRK-" + i;
                results.add(executor.submit(() -> {
                    start.await();
                    try {
                        handler.handle(new OrderCommand.Ship(name(), tracking));
                    } catch (EventLogException e) {
                        assertEquals(EventLogException.Fault.COMMAND_REJECTED, e.getFault());
                        rejected.incrementAndGet();
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> result : results) {
                result.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }
        assertEquals(attempts - 1, rejected.get());
        assertEquals(2, eventLog.loadStream(name()).size());
    }
}
