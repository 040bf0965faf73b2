package io.github.goodees.evoke.core.projection;

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

import io.github.goodees.evoke.core.RecordedEvent;

/**
 * Maintains derived state in step with the log.
 *
 * <p>The log rolls back only its own rows. When an append fails, handlers may already have been called for the
 * earlier events of the batch, and whatever they changed stays changed. Derived state that has to match the log
 * exactly is rebuilt with a replay after such failure.</p>
 */
@FunctionalInterface
public interface ProjectionHandler {
    /**
     * Apply an event to derived state. When called for a fresh append, it runs before the append commits, and any
     * exception rolls the append back.
     * @param event the event
     * @param replay true when rebuilding from history. Handlers should skip effects that must not repeat.
     * @throws Exception to reject the event
     */
    void handle(RecordedEvent event, boolean replay) throws Exception;
}
