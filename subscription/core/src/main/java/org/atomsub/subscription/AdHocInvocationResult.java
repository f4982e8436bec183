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

package org.atomsub.subscription;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * The result of replaying a single event through the handlers, outside the regular polling.
 */
public final class AdHocInvocationResult {

    public enum ResultCode {
        SUCCESS,
        NO_HANDLERS_FOUND,
        COULD_NOT_FIND_EVENT,
        HANDLERS_FAILED
    }

    private final ResultCode resultCode;
    private final Map<Class<?>, Throwable> errors;

    private AdHocInvocationResult(ResultCode resultCode, Map<Class<?>, Throwable> errors) {
        this.resultCode = resultCode;
        this.errors = Collections.unmodifiableMap(new LinkedHashMap<>(errors));
    }

    public static AdHocInvocationResult of(ResultCode resultCode) {
        Objects.requireNonNull(resultCode, ResultCode.class.getSimpleName() + " cannot be null");
        if (resultCode == ResultCode.HANDLERS_FAILED) {
            throw new IllegalArgumentException("Use " + AdHocInvocationResult.class.getSimpleName() + ".failed(errors) when handlers failed");
        }
        return new AdHocInvocationResult(resultCode, Map.of());
    }

    public static AdHocInvocationResult failed(Map<Class<?>, Throwable> errors) {
        Objects.requireNonNull(errors, "errors cannot be null");
        if (errors.isEmpty()) {
            throw new IllegalArgumentException("errors cannot be empty");
        }
        return new AdHocInvocationResult(ResultCode.HANDLERS_FAILED, errors);
    }

    public ResultCode getResultCode() {
        return resultCode;
    }

    /**
     * @return The exception thrown by each failing handler, keyed by the type of the handler
     */
    public Map<Class<?>, Throwable> getErrors() {
        return errors;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AdHocInvocationResult that)) return false;
        return resultCode == that.resultCode && Objects.equals(errors, that.errors);
    }

    @Override
    public int hashCode() {
        return Objects.hash(resultCode, errors);
    }

    @Override
    public String toString() {
        return "AdHocInvocationResult{" +
                "resultCode=" + resultCode +
                ", errors=" + errors +
                '}';
    }
}
