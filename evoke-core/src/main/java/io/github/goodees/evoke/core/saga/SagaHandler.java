package io.github.goodees.evoke.core.saga;

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
 * Side effect reacting to a committed event.
 */
@FunctionalInterface
public interface SagaHandler {
    /**
     * React to an event. Any exception marks the saga instance as failed, it does not affect the event nor other sagas.
     * @param event committed event
     * @param replay true when event is replayed from history
     * @throws Exception when side effect fails
     */
    void handle(RecordedEvent event, boolean replay) throws Exception;
}
