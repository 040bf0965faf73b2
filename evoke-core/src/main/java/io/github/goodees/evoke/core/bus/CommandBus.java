package io.github.goodees.evoke.core.bus;

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

import io.github.goodees.evoke.core.Command;
import io.github.goodees.evoke.core.EventLogException;
import io.github.goodees.evoke.core.RecordedEvent;

import java.util.List;

/**
 * Routes commands to their single handler by command class.
 */
public interface CommandBus {
    /**
     * Bind handler to command class.
     * @param commandType exact class of commands
     * @param handler the handler
     * @param <C> type of command
     * @throws EventLogException DUPLICATE_HANDLER when the class already has a handler
     */
    <C extends Command> void register(Class<C> commandType, CommandHandler<? super C> handler)
            throws EventLogException;

    /**
     * Pass command to its handler.
     * @param command the command
     * @return events recorded by the handler
     * @throws EventLogException UNKNOWN_COMMAND when no handler is bound, or failure of the handler
     */
    List<RecordedEvent> send(Command command) throws EventLogException;
}
