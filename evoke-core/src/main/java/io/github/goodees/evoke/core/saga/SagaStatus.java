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

import java.util.Locale;

/**
 * Lifecycle of a saga instance. An instance starts {@link #RUNNING} and moves exactly once to one of the terminal
 * states.
 */
public enum SagaStatus {
    RUNNING, COMPLETED, ERROR;

    public boolean isTerminal() {
        return this != RUNNING;
    }

    /**
     * Stored representation.
     * @return lower case name
     */
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static SagaStatus fromCode(String code) {
        return valueOf(code.toUpperCase(Locale.ROOT));
    }
}
