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

@FunctionalInterface
public interface CommandHandler<C extends Command> {
    /**
     * Handle command.
     * @param command the command
     * @return events recorded as the outcome
     * @throws EventLogException when command fails
     */
    List<RecordedEvent> handle(C command) throws EventLogException;
}
