package io.github.goodees.evoke.example.order;

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

import io.github.goodees.evoke.core.Aggregate;
import io.github.goodees.evoke.core.Event;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Collections;
import java.util.List;

/**
 * Order that can be created, shipped and cancelled once shipping is off the table.
 */
public class Order implements Aggregate<OrderCommand> {
    public enum State {
        NEW, CREATED, SHIPPED, CANCELLED
    }

    private final String id;
    private State state = State.NEW;
    private String customer;
    private int appliedEvents;

    public Order(String id) {
        this.id = id;
    }

    @Override
    public void apply(Event event) {
        if (event instanceof OrderCreatedEvent) {
            requireState(State.NEW, event);
            customer = ((OrderCreatedEvent) event).customer();
            state = State.CREATED;
        } else if (event instanceof OrderShippedEvent) {
            requireState(State.CREATED, event);
            state = State.SHIPPED;
        } else if (event instanceof OrderCancelledEvent) {
            requireState(State.CREATED, event);
            state = State.CANCELLED;
        } else {
            throw new IllegalArgumentException("Order " + id + " cannot apply " + event.getType());
        }
        appliedEvents++;
    }

    private void requireState(State expected, Event event) {
        if (state != expected) {
            throw new IllegalStateException("Order " + id + " in state " + state + " cannot apply " + event.getType());
        }
    }

    @Override
    public List<? extends Event> handleCommand(OrderCommand command) {
        if (command instanceof OrderCommand.Create) {
            if (state != State.NEW) {
                // creating twice is idempotent
                return Collections.emptyList();
            }
            return Collections.singletonList(OrderCreatedEvent.builder().orderId(id)
                    .customer(((OrderCommand.Create) command).getCustomer()).total(BigDecimal.ZERO).build());
        } else if (command instanceof OrderCommand.Ship) {
            if (state != State.CREATED) {
                throw new IllegalStateException("Order " + id + " cannot be shipped in state " + state);
            }
            return Collections.singletonList(OrderShippedEvent.builder().orderId(id)
                    .shippedOn(LocalDate.of(2017, 5, 2))
                    .trackingNumber(((OrderCommand.Ship) command).getTrackingNumber()).build());
        } else if (command instanceof OrderCommand.Cancel) {
            if (state != State.CREATED) {
                throw new IllegalStateException("Order " + id + " cannot be cancelled in state " + state);
            }
            return Collections.singletonList(OrderCancelledEvent.builder().orderId(id)
                    .reason(((OrderCommand.Cancel) command).getReason()).build());
        }
        throw new IllegalArgumentException("Unsupported command " + command);
    }

    public String getId() {
        return id;
    }

    public State getState() {
        return state;
    }

    public String getCustomer() {
        return customer;
    }

    public int getAppliedEvents() {
        return appliedEvents;
    }
}
