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

import org.atomsub.retry.internal.RetryImpl;

import java.time.Duration;
import java.util.Objects;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;

import static org.atomsub.retry.internal.RetryExecution.executeWithRetry;

/**
 * Retry strategy to use if an action throws an exception.
 * <p>
 * A {@code RetryStrategy} is thread-safe and immutable, so you can derive new strategies from an existing one without impacting the original instance:
 * <pre>
 * RetryStrategy retryStrategy = RetryStrategy.fixed(200).maxAttempts(5);
 * // 200 ms fixed delay
 * retryStrategy.execute(() -> Something.something());
 * // Only retry when the event is missing
 * retryStrategy.retryIf(EventNotFoundException.class::isInstance).execute(() -> SomethingElse.somethingElse());
 * </pre>
 * </p>
 */
public sealed interface RetryStrategy permits RetryStrategy.DontRetry, RetryStrategy.Retry {

    /**
     * Create a retry strategy that performs retries if exceptions are caught.
     */
    static Retry retry() {
        return new RetryImpl();
    }

    /**
     * Create a retry strategy that doesn't perform retries (i.e. retries are disabled).
     */
    static DontRetry none() {
        return DontRetry.INSTANCE;
    }

    /**
     * Shortcut for {@code RetryStrategy.retry().backoff(Backoff.fixed(duration))}.
     *
     * @param duration The duration to wait before retry
     * @return A retry strategy with fixed backoff
     */
    static Retry fixed(Duration duration) {
        return RetryStrategy.retry().backoff(Backoff.fixed(duration));
    }

    /**
     * Shortcut for {@code RetryStrategy.retry().backoff(Backoff.fixed(millis))}.
     *
     * @param millis The number of millis to wait before retry
     * @return A retry strategy with fixed backoff
     */
    static Retry fixed(long millis) {
        return RetryStrategy.retry().backoff(Backoff.fixed(millis));
    }

    /**
     * Execute a {@link Function} with the configured retry settings.
     * Rethrows the exception from the function if retry strategy is exhausted.
     *
     * @param function A function that takes {@link RetryInfo} and returns the result
     * @return The result of the function, if successful.
     */
    default <T> T execute(Function<RetryInfo, T> function) {
        Objects.requireNonNull(function, Function.class.getSimpleName() + " cannot be null");
        return executeWithRetry(function, this).apply(null);
    }

    /**
     * Execute a {@link Supplier} with the configured retry settings.
     * Rethrows the exception from the supplier if retry strategy is exhausted.
     *
     * @param supplier The supplier to execute
     * @return The result of the supplier, if successful.
     */
    default <T> T execute(Supplier<T> supplier) {
        Objects.requireNonNull(supplier, Supplier.class.getSimpleName() + " cannot be null");
        return executeWithRetry((Function<RetryInfo, T>) __ -> supplier.get(), this).apply(null);
    }

    /**
     * Execute a {@link Runnable} with the configured retry settings.
     * Rethrows the exception from the runnable if retry strategy is exhausted.
     *
     * @param runnable The runnable to execute
     */
    default void execute(Runnable runnable) {
        Objects.requireNonNull(runnable, Runnable.class.getSimpleName() + " cannot be null");
        executeWithRetry((Function<RetryInfo, Void>) __ -> {
            runnable.run();
            return null;
        }, this).apply(null);
    }

    /**
     * A retry strategy that doesn't retry at all. Just rethrows the exception.
     */
    final class DontRetry implements RetryStrategy {
        private static final DontRetry INSTANCE = new DontRetry();

        private DontRetry() {
        }

        @Override
        public String toString() {
            return DontRetry.class.getSimpleName();
        }
    }

    non-sealed interface Retry extends RetryStrategy {
        /**
         * Configure the backoff settings for the retry strategy.
         *
         * @param backoff The backoff to use.
         * @return A new instance of {@link Retry} with the backoff settings applied.
         */
        Retry backoff(Backoff backoff);

        /**
         * Retry an infinite number of times (this is default).
         *
         * @return A new instance of {@link Retry} with infinite number of retry attempts.
         */
        Retry infiniteAttempts();

        /**
         * Specify the max number of attempts the function should be invoked before failing.
         *
         * @return A new instance of {@link Retry} with the max number of attempts configured.
         */
        Retry maxAttempts(int maxAttempts);

        /**
         * Only retry if the specified predicate is {@code true}. Will override previous retry predicate.
         *
         * @return A new instance of {@link Retry} with the given retry predicate
         */
        Retry retryIf(Predicate<Throwable> retryPredicate);

        /**
         * Add an error listener that will be invoked for every error (throwable) that happens during the execution.
         * Use {@link ErrorInfo#isRetryable()} to find out whether the error will be retried or rethrown.
         *
         * @param errorListener The consumer to invoke
         * @return A new instance of {@link Retry} with the given error listener
         */
        Retry onError(BiConsumer<ErrorInfo, Throwable> errorListener);

        /**
         * @see #onError(BiConsumer)
         */
        Retry onError(Consumer<Throwable> errorListener);
    }
}
