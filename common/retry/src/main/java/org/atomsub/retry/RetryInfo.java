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

package org.atomsub.retry;

import org.jspecify.annotations.NullMarked;

import java.time.Duration;

/**
 * Contains useful information of the state of the retry
 */
@NullMarked
public interface RetryInfo {

    /**
     * @return The number of retries that has been made before <i>this</i> attempt, {@code 0} if first attempt.
     */
    default int getRetryCount() {
        return getAttemptNumber() - 1;
    }

    /**
     * @return The number of <i>this</i> attempt, {@code 1} if first attempt.
     */
    int getAttemptNumber();

    /**
     * @return The maximum number of attempts configured for the retry. Returns {@code Integer.MAX_VALUE} if infinite.
     */
    int getMaxAttempts();

    /**
     * @return The number of attempts left before giving up
     */
    int getAttemptsLeft();

    /**
     * @return {@code true} if there are infinite retry attempts left, {@code false} otherwise.
     */
    boolean isInfiniteRetriesLeft();

    /**
     * @return The backoff that was applied before <i>this</i> attempt.
     */
    Duration getBackoff();

    /**
     * @return {@code true} if this attempt is the last attempt, {@code false} otherwise.
     */
    boolean isLastAttempt();

    /**
     * @return {@code true} if this attempt is the first attempt, {@code false} otherwise.
     */
    boolean isFirstAttempt();
}
