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
import java.util.Objects;

/**
 * How long to wait between two attempts.
 */
@NullMarked
public sealed interface Backoff {

    static Backoff none() {
        return None.INSTANCE;
    }

    static Backoff fixed(long millis) {
        return new Fixed(millis);
    }

    static Backoff fixed(Duration duration) {
        Objects.requireNonNull(duration, Duration.class.getSimpleName() + " cannot be null");
        return new Fixed(duration.toMillis());
    }

    /**
     * @return The delay to apply before the next attempt
     */
    Duration delay();

    record None() implements Backoff {
        static final None INSTANCE = new None();

        @Override
        public Duration delay() {
            return Duration.ZERO;
        }
    }

    record Fixed(long millis) implements Backoff {
        public Fixed {
            if (millis < 0) {
                throw new IllegalArgumentException("millis cannot be negative");
            }
        }

        @Override
        public Duration delay() {
            return Duration.ofMillis(millis);
        }
    }
}
