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

package org.atomsub.subscription.inmemory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.cloudevents.CloudEvent;
import io.cloudevents.CloudEventData;
import io.cloudevents.core.builder.CloudEventBuilder;
import org.atomsub.subscription.EventEnvelope;
import org.atomsub.subscription.EventNotFoundException;
import org.atomsub.subscription.EventRead;
import org.atomsub.subscription.EventStoreReadException;
import org.atomsub.subscription.StreamSlice;
import org.atomsub.subscription.api.blocking.StreamReader;
import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;

import java.io.IOException;
import java.net.URI;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * A {@link StreamReader} that stores events in memory as {@link CloudEvent}s. Bodies are stored as JSON and deserialized
 * with Jackson into the requested event type. This is mainly useful for testing and/or demo purposes.
 * <p>
 * Reading forward from a position after the last event of a stream returns an empty slice. If a long poll timeout is
 * given, the read waits at most that long for an event to be appended before it answers.
 */
@NullMarked
public class InMemoryEventStream implements StreamReader {
    private static final URI DEFAULT_BASE_URI = URI.create("http://localhost:2113/");
    private static final URI SOURCE = URI.create("urn:atomsub:inmemory");

    private final Object lock = new Object();
    private final Map<String, List<CloudEvent>> state = new HashMap<>();
    private final Map<URI, Integer> unavailableBodies = new HashMap<>();
    private final ObjectMapper objectMapper;
    private final URI baseUri;
    private final Clock clock;

    public InMemoryEventStream() {
        this(new ObjectMapper());
    }

    public InMemoryEventStream(ObjectMapper objectMapper) {
        this(objectMapper, DEFAULT_BASE_URI, Clock.systemUTC());
    }

    public InMemoryEventStream(ObjectMapper objectMapper, URI baseUri, Clock clock) {
        Objects.requireNonNull(objectMapper, ObjectMapper.class.getSimpleName() + " cannot be null");
        Objects.requireNonNull(baseUri, "baseUri cannot be null");
        Objects.requireNonNull(clock, Clock.class.getSimpleName() + " cannot be null");
        this.objectMapper = objectMapper;
        this.baseUri = baseUri;
        this.clock = clock;
    }

    /**
     * Append an event, using the fully qualified class name of the event as event type.
     *
     * @return The sequence number of the appended event
     */
    public long append(String stream, Object event) {
        Objects.requireNonNull(event, "event cannot be null");
        return append(stream, event.getClass().getName(), event);
    }

    /**
     * Append an event serialized to JSON.
     *
     * @return The sequence number of the appended event
     */
    public long append(String stream, String eventType, Object event) {
        final byte[] json;
        try {
            json = objectMapper.writeValueAsBytes(event);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize " + eventType, e);
        }
        return append(stream, CloudEventBuilder.v1()
                .withId(UUID.randomUUID().toString())
                .withSource(SOURCE)
                .withType(eventType)
                .withTime(OffsetDateTime.now(clock))
                .withDataContentType("application/json")
                .withData(json)
                .build());
    }

    /**
     * Append a cloud event as is.
     *
     * @return The sequence number of the appended event
     */
    public long append(String stream, CloudEvent cloudEvent) {
        requireValidStream(stream);
        Objects.requireNonNull(cloudEvent, CloudEvent.class.getSimpleName() + " cannot be null");
        synchronized (lock) {
            List<CloudEvent> events = state.computeIfAbsent(stream, __ -> new ArrayList<>());
            events.add(cloudEvent);
            lock.notifyAll();
            return events.size() - 1;
        }
    }

    /**
     * Create an empty stream. Reading a stream that doesn't exist returns {@link org.atomsub.subscription.StreamReadStatus#NOT_FOUND}.
     */
    public void createStream(String stream) {
        requireValidStream(stream);
        synchronized (lock) {
            state.computeIfAbsent(stream, __ -> new ArrayList<>());
        }
    }

    /**
     * Make the body of an event unavailable for the given number of reads, the way a lagging node of a cluster may list
     * an event before it can serve its body.
     *
     * @param times The number of reads that return no body, {@link Integer#MAX_VALUE} to never return it
     */
    public void makeBodyUnavailable(String stream, long sequenceNumber, int times) {
        if (times < 0) {
            throw new IllegalArgumentException("times cannot be negative");
        }
        synchronized (lock) {
            unavailableBodies.put(canonicalLinkOf(stream, sequenceNumber), times);
        }
    }

    @Override
    public StreamSlice readStreamEventsForward(String stream, long fromPosition, int maxCount, @Nullable Duration longPollTimeout) {
        if (maxCount < 1) {
            throw new IllegalArgumentException("maxCount must be greater than or equal to 1");
        }
        long from = Math.max(fromPosition, 0);
        synchronized (lock) {
            List<CloudEvent> events = state.get(stream);
            if (events == null) {
                return StreamSlice.notFound();
            }
            if (from >= events.size() && longPollTimeout != null && !longPollTimeout.isZero()) {
                awaitAppend(events, from, longPollTimeout);
            }
            List<EventEnvelope> entries = new ArrayList<>();
            for (long i = from; i < events.size() && entries.size() < maxCount; i++) {
                entries.add(toEnvelope(stream, i, events.get((int) i)));
            }
            return StreamSlice.success(entries);
        }
    }

    @Override
    public EventRead readEvent(String stream, long eventNumber) {
        synchronized (lock) {
            List<CloudEvent> events = state.get(stream);
            if (events == null || eventNumber < 0 || eventNumber >= events.size()) {
                return EventRead.notFound();
            }
            return EventRead.found(toEnvelope(stream, eventNumber, events.get((int) eventNumber)));
        }
    }

    @Override
    public <T> @Nullable T readEventBody(Class<T> eventType, URI canonicalLink) {
        final CloudEventData data;
        synchronized (lock) {
            Integer unavailable = unavailableBodies.get(canonicalLink);
            if (unavailable != null && unavailable > 0) {
                if (unavailable != Integer.MAX_VALUE) {
                    unavailableBodies.put(canonicalLink, unavailable - 1);
                }
                return null;
            }
            CloudEvent cloudEvent = findByCanonicalLink(canonicalLink);
            if (cloudEvent == null) {
                throw new EventNotFoundException(canonicalLink);
            }
            data = cloudEvent.getData();
        }

        if (data == null) {
            return null;
        }
        try {
            return objectMapper.readValue(data.toBytes(), eventType);
        } catch (IOException e) {
            throw new EventStoreReadException("Failed to deserialize " + canonicalLink + " into " + eventType.getName(), e);
        }
    }

    URI canonicalLinkOf(String stream, long sequenceNumber) {
        return baseUri.resolve("streams/" + encodePathSegment(stream) + "/" + sequenceNumber);
    }

    // The stream name is a single path segment, so '/' is encoded as well
    private static String encodePathSegment(String segment) {
        return URLEncoder.encode(segment, UTF_8).replace("+", "%20");
    }

    private @Nullable CloudEvent findByCanonicalLink(URI canonicalLink) {
        String path = canonicalLink.getRawPath();
        if (path == null) {
            return null;
        }
        int lastSlash = path.lastIndexOf('/');
        int streamStart = path.lastIndexOf("/streams/");
        if (lastSlash < 0 || streamStart < 0 || streamStart + "/streams/".length() > lastSlash) {
            return null;
        }
        String stream = URLDecoder.decode(path.substring(streamStart + "/streams/".length(), lastSlash), UTF_8);
        final long sequenceNumber;
        try {
            sequenceNumber = Long.parseLong(path.substring(lastSlash + 1));
        } catch (NumberFormatException e) {
            return null;
        }
        List<CloudEvent> events = state.get(stream);
        if (events == null || sequenceNumber < 0 || sequenceNumber >= events.size()) {
            return null;
        }
        return events.get((int) sequenceNumber);
    }

    private void awaitAppend(List<CloudEvent> events, long from, Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        try {
            while (from >= events.size()) {
                long remainingMillis = Duration.ofNanos(deadline - System.nanoTime()).toMillis();
                if (remainingMillis <= 0) {
                    return;
                }
                lock.wait(remainingMillis);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private EventEnvelope toEnvelope(String stream, long sequenceNumber, CloudEvent cloudEvent) {
        CloudEventData data = cloudEvent.getData();
        OffsetDateTime time = cloudEvent.getTime();
        return new EventEnvelope(cloudEvent.getId(), cloudEvent.getType(),
                data == null ? null : new String(data.toBytes(), UTF_8),
                sequenceNumber,
                time == null ? OffsetDateTime.now(clock) : time,
                canonicalLinkOf(stream, sequenceNumber),
                sequenceNumber + "@" + stream);
    }

    private static void requireValidStream(String stream) {
        if (stream == null || stream.isBlank()) {
            throw new IllegalArgumentException("stream cannot be null or blank");
        }
    }
}
