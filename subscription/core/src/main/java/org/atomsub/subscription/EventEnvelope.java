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

import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;

import java.net.URI;
import java.time.OffsetDateTime;
import java.util.Objects;

/**
 * An entry read from an event stream. It describes the event but doesn't necessarily carry its body,
 * use the {@link #canonicalLink()} to read it.
 *
 * @param id             The unique id of the event
 * @param eventType      The name of the event type
 * @param rawContent     The raw event body if it was embedded in the entry, {@code null} otherwise
 * @param sequenceNumber The position of the event in the stream, starting from {@code 0}
 * @param updated        When the event was last modified
 * @param canonicalLink  The link from which the event body can be read
 * @param title          The title of the entry
 */
@NullMarked
public record EventEnvelope(String id, String eventType, @Nullable String rawContent, long sequenceNumber,
                            OffsetDateTime updated, URI canonicalLink, String title) {

    public EventEnvelope {
        Objects.requireNonNull(id, "id cannot be null");
        Objects.requireNonNull(eventType, "eventType cannot be null");
        Objects.requireNonNull(updated, "updated cannot be null");
        Objects.requireNonNull(canonicalLink, "canonicalLink cannot be null");
        Objects.requireNonNull(title, "title cannot be null");
        if (sequenceNumber < 0) {
            throw new IllegalArgumentException("sequenceNumber cannot be negative");
        }
    }

    /**
     * @return A copy of this envelope without the embedded body
     */
    public EventEnvelope withoutContent() {
        return new EventEnvelope(id, eventType, null, sequenceNumber, updated, canonicalLink, title);
    }
}
