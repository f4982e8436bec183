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

import java.util.List;
import java.util.Objects;

/**
 * A forward slice of events read from a stream.
 *
 * @param status  The read status
 * @param entries The events in ascending sequence number order. Always empty unless the status is {@link StreamReadStatus#SUCCESS}.
 */
public record StreamSlice(StreamReadStatus status, List<EventEnvelope> entries) {

    public StreamSlice {
        Objects.requireNonNull(status, StreamReadStatus.class.getSimpleName() + " cannot be null");
        Objects.requireNonNull(entries, "entries cannot be null");
        entries = List.copyOf(entries);
    }

    public static StreamSlice success(List<EventEnvelope> entries) {
        return new StreamSlice(StreamReadStatus.SUCCESS, entries);
    }

    public static StreamSlice notFound() {
        return new StreamSlice(StreamReadStatus.NOT_FOUND, List.of());
    }

    public static StreamSlice endOfStream() {
        return new StreamSlice(StreamReadStatus.END_OF_STREAM, List.of());
    }

    public boolean isSuccess() {
        return status == StreamReadStatus.SUCCESS;
    }
}
