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

import org.jspecify.annotations.Nullable;

import java.util.Objects;

/**
 * The result of reading a single event.
 *
 * @param status   The read status
 * @param envelope The event, only present when the status is {@link StreamReadStatus#SUCCESS}
 */
public record EventRead(StreamReadStatus status, @Nullable EventEnvelope envelope) {

    public EventRead {
        Objects.requireNonNull(status, StreamReadStatus.class.getSimpleName() + " cannot be null");
        if (status == StreamReadStatus.SUCCESS && envelope == null) {
            throw new IllegalArgumentException("envelope cannot be null when status is " + status);
        }
    }

    public static EventRead found(EventEnvelope envelope) {
        return new EventRead(StreamReadStatus.SUCCESS, envelope);
    }

    public static EventRead notFound() {
        return new EventRead(StreamReadStatus.NOT_FOUND, null);
    }

    public boolean isSuccess() {
        return status == StreamReadStatus.SUCCESS;
    }
}
