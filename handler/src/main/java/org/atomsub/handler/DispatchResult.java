/*
 * Copyright 2024 Johan Haleby
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *        http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.atomsub.handler;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * The outcome of dispatching an event to its handlers.
 *
 * @param handlerCount The number of handlers that were invoked
 * @param errors       The exception thrown by each failing handler, keyed by handler type, in invocation order
 */
public record DispatchResult(int handlerCount, Map<Class<?>, Throwable> errors) {

    public DispatchResult {
        Objects.requireNonNull(errors, "errors cannot be null");
        errors = Collections.unmodifiableMap(new LinkedHashMap<>(errors));
    }

    public boolean isSuccess() {
        return errors.isEmpty();
    }
}
