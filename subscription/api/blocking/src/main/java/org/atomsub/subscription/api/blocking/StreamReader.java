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

package org.atomsub.subscription.api.blocking;

import org.atomsub.subscription.EventEnvelope;
import org.atomsub.subscription.EventNotFoundException;
import org.atomsub.subscription.EventRead;
import org.atomsub.subscription.EventStoreReadException;
import org.atomsub.subscription.StreamSlice;
import org.jspecify.annotations.Nullable;

import java.net.URI;
import java.time.Duration;

/**
 * Pull-based read access to the event streams of an event store.
 */
public interface StreamReader {

    /**
     * Read a forward slice of events.
     *
     * @param stream          The stream to read
     * @param fromPosition    The sequence number of the first event to return
     * @param maxCount        The maximum number of events to return
     * @param longPollTimeout If not {@code null}, wait at most this long for new events to arrive when there are none at {@code fromPosition}
     * @return The slice, with entries in ascending sequence number order
     */
    StreamSlice readStreamEventsForward(String stream, long fromPosition, int maxCount, @Nullable Duration longPollTimeout);

    /**
     * Read a single event from a stream.
     *
     * @param stream      The stream to read
     * @param eventNumber The sequence number of the event
     */
    EventRead readEvent(String stream, long eventNumber);

    /**
     * Read the body of an event.
     *
     * @param eventType     The type to deserialize the body into
     * @param canonicalLink The {@link EventEnvelope#canonicalLink()} of the event
     * @return The deserialized event, or {@code null} if the store doesn't have it yet
     * @throws EventNotFoundException   If the event could not be found
     * @throws EventStoreReadException If the event could not be read for any other reason
     */
    <T> @Nullable T readEventBody(Class<T> eventType, URI canonicalLink);
}
