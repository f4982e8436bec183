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

import org.atomsub.retry.Backoff;
import org.atomsub.retry.ErrorInfo;
import org.atomsub.retry.MaxAttempts;
import org.atomsub.retry.RetryStrategy;
import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;

import java.util.Objects;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import java.util.function.Predicate;

import static org.atomsub.retry.MaxAttempts.Infinite.infinite;

/**
 * A retry strategy that does retry. By default, the following settings are used:
 *
 * <ul>
 *     <li>No backoff</li>
 *     <li>Infinite number of retries</li>
 *     <li>Retries all exceptions</li>
 *     <li>No error listener (will retry silently)</li>
 * </ul>
 */
@NullMarked
public final class RetryImpl implements RetryStrategy.Retry {
    private static final BiConsumer<ErrorInfo, Throwable> NOOP_ERROR_LISTENER = (__, ___) -> {
    };

    final Backoff backoff;
    final MaxAttempts maxAttempts;
    final Predicate<Throwable> retryPredicate;
    final BiConsumer<ErrorInfo, Throwable> errorListener;

    private RetryImpl(Backoff backoff, MaxAttempts maxAttempts, Predicate<Throwable> retryPredicate, @Nullable BiConsumer<ErrorInfo, Throwable> errorListener) {
        Objects.requireNonNull(backoff, Backoff.class.getSimpleName() + " cannot be null");
        Objects.requireNonNull(maxAttempts, MaxAttempts.class.getSimpleName() + " cannot be null");
        Objects.requireNonNull(retryPredicate, "Retry predicate cannot be null");
        this.backoff = backoff;
        this.maxAttempts = maxAttempts;
        this.retryPredicate = retryPredicate;
        this.errorListener = errorListener == null ? NOOP_ERROR_LISTENER : errorListener;
    }

    public RetryImpl() {
        this(Backoff.none(), infinite(), __ -> true, NOOP_ERROR_LISTENER);
    }

    @Override
    public Retry backoff(Backoff backoff) {
        return new RetryImpl(backoff, maxAttempts, retryPredicate, errorListener);
    }

    @Override
    public Retry infiniteAttempts() {
        return new RetryImpl(backoff, infinite(), retryPredicate, errorListener);
    }

    @Override
    public Retry maxAttempts(int maxAttempts) {
        return new RetryImpl(backoff, new MaxAttempts.Limit(maxAttempts), retryPredicate, errorListener);
    }

    @Override
    public Retry retryIf(Predicate<Throwable> retryPredicate) {
        return new RetryImpl(backoff, maxAttempts, retryPredicate, errorListener);
    }

    @Override
    public Retry onError(BiConsumer<ErrorInfo, Throwable> errorListener) {
        Objects.requireNonNull(errorListener, "Error listener cannot be null");
        return new RetryImpl(backoff, maxAttempts, retryPredicate, errorListener);
    }

    @Override
    public Retry onError(Consumer<Throwable> errorListener) {
        Objects.requireNonNull(errorListener, "Error listener cannot be null");
        return onError((__, throwable) -> errorListener.accept(throwable));
    }

    @Override
    public String toString() {
        return "Retry{" +
                "backoff=" + backoff +
                ", maxAttempts=" + maxAttempts +
                '}';
    }
}
