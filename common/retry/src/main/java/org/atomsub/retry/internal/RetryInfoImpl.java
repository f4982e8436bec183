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
package org.atomsub.retry.internal;

import org.atomsub.retry.MaxAttempts;
import org.atomsub.retry.RetryInfo;

import java.time.Duration;

/**
 * @param attemptNumber The attempt number, starting at 1
 * @param maxAttempts   The configured maximum number of attempts
 * @param backoff       The backoff that was waited before this attempt
 */
record RetryInfoImpl(int attemptNumber, MaxAttempts maxAttempts, Duration backoff) implements RetryInfo {

    @Override
    public int getAttemptNumber() {
        return attemptNumber;
    }

    @Override
    public int getMaxAttempts() {
        return maxAttempts instanceof MaxAttempts.Limit limit ? limit.limit() : Integer.MAX_VALUE;
    }

    @Override
    public int getAttemptsLeft() {
        return isInfiniteRetriesLeft() ? Integer.MAX_VALUE : getMaxAttempts() - attemptNumber + 1;
    }

    @Override
    public boolean isInfiniteRetriesLeft() {
        return maxAttempts instanceof MaxAttempts.Infinite;
    }

    @Override
    public Duration getBackoff() {
        return backoff;
    }

    @Override
    public boolean isLastAttempt() {
        return !isInfiniteRetriesLeft() && attemptNumber == getMaxAttempts();
    }

    @Override
    public boolean isFirstAttempt() {
        return attemptNumber == 1;
    }
}
