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
import org.atomsub.retry.RetryStrategy;
import org.atomsub.retry.RetryStrategy.DontRetry;
import org.jspecify.annotations.NonNull;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * Internal class for executing functions with retry capability. Never use this class directly from your own code!
 */
public class RetryExecution {

    public static <T1> Function<RetryInfo, T1> executeWithRetry(@NonNull Function<RetryInfo, T1> function, @NonNull RetryStrategy retryStrategy) {
        if (retryStrategy instanceof DontRetry) {
            return function;
        }
        return executeWithRetry(function, (RetryImpl) retryStrategy);
    }

    private static <T1> Function<RetryInfo, T1> executeWithRetry(Function<RetryInfo, T1> fn, RetryImpl retry) {
        return (ignored) -> {
            int currentAttempt = 1;
            Duration prevBackoff = Duration.ZERO;
            Duration backoff = retry.backoff.delay();

            for (; ; ) {
                RetryInfoImpl retryInfo = new RetryInfoImpl(currentAttempt, retry.maxAttempts, prevBackoff);
                try {
                    return fn.apply(retryInfo);
                } catch (Throwable e) {
                    boolean shouldRetryAgain = !isExhausted(currentAttempt, retry.maxAttempts) && retry.retryPredicate.test(e);
                    retry.errorListener.accept(new ErrorInfoImpl(retryInfo, shouldRetryAgain ? backoff : null, shouldRetryAgain), e);

                    if (!shouldRetryAgain) {
                        return SafeExceptionRethrower.safeRethrow(e);
                    }

                    long backoffMillis = backoff.toMillis();
                    if (backoffMillis > 0) {
                        try {
                            TimeUnit.MILLISECONDS.sleep(backoffMillis);
                        } catch (InterruptedException ie) {
                            Thread.currentThread().interrupt();
                            throw new RuntimeException(e);
                        }
                    }

                    currentAttempt++;
                    prevBackoff = backoff;
                }
            }
        };
    }

    private static boolean isExhausted(int attempt, MaxAttempts maxAttempts) {
        if (maxAttempts instanceof MaxAttempts.Infinite) {
            return false;
        }
        return attempt >= ((MaxAttempts.Limit) maxAttempts).limit();
    }
}
