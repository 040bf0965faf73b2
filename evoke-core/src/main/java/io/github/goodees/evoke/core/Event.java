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

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Immutable fact about business domain relevant fact that became true.
 *
 * <p>An event carries no metadata of its own. The aggregate it belongs to, its position in the log and the time it was
 * recorded are assigned by the {@link io.github.goodees.evoke.core.store.EventLog} and travel alongside the payload in
 * a {@link RecordedEvent}.</p>
 *
 * <p>The payload is serialized by the {@link io.github.goodees.evoke.core.registry.TypeRegistry}, so events may carry
 * Jackson annotations to control their JSON shape. Every concrete event shape needs to be registered before it is
 * appended or read back.</p>
 */
public interface Event {
    /**
     * The type of event. It is the key under which the payload is stored and looked up in the registry, therefore
     * it must be unique among all registered event shapes.
     * @return textual description of the type of event, uses class name by default, stripped from suffix Event, or
     *         prefix Immutable
     */
    @JsonIgnore
    default String getType() {
        return EventType.defaultTypeName(getClass());
    }
}
