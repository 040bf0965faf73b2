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

import java.util.List;

/**
 * Domain entity whose state is derived solely from its events.
 *
 * <p>An aggregate is never stored. {@link AggregateHandler} creates a fresh instance for every command, feeds it the
 * whole history through {@link #apply(Event)} and then asks it to decide about the command. Therefore {@code apply}
 * must only change the aggregate's own state, depending on nothing but the events and their order, and
 * {@code handleCommand} must not change state at all: the events it returns are the only outcome.</p>
 *
 * @param <C> type of commands the aggregate handles
 */
public interface Aggregate<C extends Command> {
    /**
     * Update state with past event.
     * @param event the event, in order of sequence
     */
    void apply(Event event);

    /**
     * Validate command against current state and produce events describing its outcome.
     * @param command the command
     * @return new events, possibly empty
     * @throws Exception when the command is rejected
     */
    List<? extends Event> handleCommand(C command) throws Exception;
}
