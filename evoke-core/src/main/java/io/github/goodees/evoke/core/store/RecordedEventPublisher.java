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

/**
 * Receiver of recorded events, either live from an append or during replay.
 */
@FunctionalInterface
public interface RecordedEventPublisher {
    /**
     * Publish a recorded event.
     * @param event the event
     * @param replay true when the event is delivered again from history rather than freshly appended
     * @throws EventLogException when the receiver fails
     */
    void publish(RecordedEvent event, boolean replay) throws EventLogException;
}
