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
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

public class SimpleCommandBus implements CommandBus {
    private final ConcurrentMap<Class<?>, Registration<?>> handlers = new ConcurrentHashMap<>();

    @Override
    public <C extends Command> void register(Class<C> commandType, CommandHandler<? super C> handler)
            throws EventLogException {
        Objects.requireNonNull(commandType, "Command type must be specified");
        Objects.requireNonNull(handler, "Command handler must be specified");
        if (handlers.putIfAbsent(commandType, new Registration<>(commandType, handler)) != null) {
            throw EventLogException.duplicateHandler("Command handler", commandType.getName());
        }
    }

    @Override
    public List<RecordedEvent> send(Command command) throws EventLogException {
        Objects.requireNonNull(command, "Command must be specified");
        Registration<?> registration = handlers.get(command.getClass());
        if (registration == null) {
            throw EventLogException.unknownCommand(command);
        }
        return registration.handle(command);
    }

    private static class Registration<C extends Command> {
        private final Class<C> commandType;
        private final CommandHandler<? super C> handler;

        Registration(Class<C> commandType, CommandHandler<? super C> handler) {
            this.commandType = commandType;
            this.handler = handler;
        }

        List<RecordedEvent> handle(Command command) throws EventLogException {
            return handler.handle(commandType.cast(command));
        }
    }
}
