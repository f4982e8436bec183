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

import com.fasterxml.jackson.databind.ObjectMapper;
import org.atomsub.domain.OrderPlaced;
import org.atomsub.domain.OrderShipped;
import org.atomsub.subscription.EventEnvelope;
import org.atomsub.subscription.EventNotFoundException;
import org.atomsub.subscription.EventRead;
import org.atomsub.subscription.EventStoreReadException;
import org.atomsub.subscription.StreamReadStatus;
import org.atomsub.subscription.StreamSlice;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.concurrent.CompletableFuture;

import static java.util.concurrent.TimeUnit.SECONDS;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.awaitility.Awaitility.await;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertAll;

@DisplayNameGeneration(ReplaceUnderscores.class)
@Timeout(value = 10, unit = SECONDS)
class InMemoryEventStreamTest {

    private static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");

    private InMemoryEventStream eventStream;

    @BeforeEach
    void event_stream_is_created_before_each_test() {
        eventStream = new InMemoryEventStream(new ObjectMapper(), URI.create("http://localhost:2113/"), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Nested
    @DisplayName("readStreamEventsForward")
    class ReadStreamEventsForward {

        @Test
        void reading_a_stream_that_does_not_exist_returns_not_found() {
            // When
            StreamSlice slice = eventStream.readStreamEventsForward("orders", 0, 10, null);

            // Then
            assertAll(
                    () -> assertThat(slice.status()).isEqualTo(StreamReadStatus.NOT_FOUND),
                    () -> assertThat(slice.entries()).isEmpty()
            );
        }

        @Test
        void events_are_read_from_the_given_position_bounded_by_max_count() {
            // Given
            for (int i = 0; i < 5; i++) {
                eventStream.append("orders", new OrderPlaced(String.valueOf(i), i));
            }

            // When
            StreamSlice slice = eventStream.readStreamEventsForward("orders", 1, 3, null);

            // Then
            assertAll(
                    () -> assertThat(slice.isSuccess()).isTrue(),
                    () -> assertThat(slice.entries()).extracting(EventEnvelope::sequenceNumber).containsExactly(1L, 2L, 3L)
            );
        }

        @Test
        void envelopes_describe_the_stored_event() {
            // Given
            OrderPlaced orderPlaced = new OrderPlaced("1", 10);
            eventStream.append("orders", orderPlaced);

            // When
            EventEnvelope envelope = eventStream.readStreamEventsForward("orders", 0, 10, null).entries().get(0);

            // Then
            assertAll(
                    () -> assertThat(envelope.eventType()).isEqualTo(OrderPlaced.class.getName()),
                    () -> assertThat(envelope.sequenceNumber()).isZero(),
                    () -> assertThat(envelope.updated()).isEqualTo(OffsetDateTime.ofInstant(NOW, ZoneOffset.UTC)),
                    () -> assertThat(envelope.canonicalLink()).isEqualTo(URI.create("http://localhost:2113/streams/orders/0")),
                    () -> assertThat(envelope.title()).isEqualTo("0@orders"),
                    () -> assertThat(envelope.rawContent()).contains("\"orderId\":\"1\"")
            );
        }

        @Test
        void reading_past_the_end_of_an_existing_stream_returns_an_empty_slice() {
            // Given
            eventStream.createStream("orders");

            // When
            StreamSlice slice = eventStream.readStreamEventsForward("orders", 0, 10, null);

            // Then
            assertAll(
                    () -> assertThat(slice.isSuccess()).isTrue(),
                    () -> assertThat(slice.entries()).isEmpty()
            );
        }

        @Test
        void long_polling_read_returns_as_soon_as_an_event_is_appended() throws Exception {
            // Given
            eventStream.createStream("orders");
            CompletableFuture<StreamSlice> read = CompletableFuture.supplyAsync(() -> eventStream.readStreamEventsForward("orders", 0, 10, Duration.ofSeconds(5)));

            // When
            Thread.sleep(50);
            eventStream.append("orders", new OrderPlaced("1", 10));

            // Then
            await().atMost(2, SECONDS).until(read::isDone, is(true));
            assertThat(read.get().entries()).hasSize(1);
        }

        @Test
        void long_polling_read_returns_an_empty_slice_when_the_timeout_elapses() {
            // Given
            eventStream.createStream("orders");

            // When
            StreamSlice slice = eventStream.readStreamEventsForward("orders", 0, 10, Duration.ofMillis(50));

            // Then
            assertAll(
                    () -> assertThat(slice.isSuccess()).isTrue(),
                    () -> assertThat(slice.entries()).isEmpty()
            );
        }
    }

    @Nested
    @DisplayName("readEvent")
    class ReadEvent {

        @Test
        void reading_an_existing_event_returns_its_envelope() {
            // Given
            eventStream.append("orders", new OrderPlaced("1", 10));
            eventStream.append("orders", new OrderShipped("1", "DHL"));

            // When
            EventRead eventRead = eventStream.readEvent("orders", 1);

            // Then
            assertAll(
                    () -> assertThat(eventRead.isSuccess()).isTrue(),
                    () -> assertThat(eventRead.envelope()).isNotNull(),
                    () -> assertThat(eventRead.envelope().eventType()).isEqualTo(OrderShipped.class.getName())
            );
        }

        @Test
        void reading_an_event_that_does_not_exist_returns_not_found() {
            // Given
            eventStream.append("orders", new OrderPlaced("1", 10));

            // Then
            assertAll(
                    () -> assertThat(eventStream.readEvent("orders", 1).isSuccess()).isFalse(),
                    () -> assertThat(eventStream.readEvent("payments", 0).isSuccess()).isFalse(),
                    () -> assertThat(eventStream.readEvent("orders", -1).envelope()).isNull()
            );
        }
    }

    @Nested
    @DisplayName("readEventBody")
    class ReadEventBody {

        @Test
        void body_is_deserialized_into_the_requested_type() {
            // Given
            OrderShipped orderShipped = new OrderShipped("1", "DHL");
            eventStream.append("orders", orderShipped);

            // When
            OrderShipped body = eventStream.readEventBody(OrderShipped.class, URI.create("http://localhost:2113/streams/orders/0"));

            // Then
            assertThat(body).isEqualTo(orderShipped);
        }

        @Test
        void bodies_of_streams_whose_names_contain_reserved_characters_can_be_read() {
            // Given
            String stream = "order events/eu?#";
            OrderPlaced orderPlaced = new OrderPlaced("1", 10);
            eventStream.append(stream, orderPlaced);
            EventEnvelope envelope = eventStream.readStreamEventsForward(stream, 0, 1, null).entries().get(0);

            // When
            OrderPlaced body = eventStream.readEventBody(OrderPlaced.class, envelope.canonicalLink());

            // Then
            assertAll(
                    () -> assertThat(envelope.canonicalLink()).hasToString("http://localhost:2113/streams/order%20events%2Feu%3F%23/0"),
                    () -> assertThat(envelope.title()).isEqualTo("0@" + stream),
                    () -> assertThat(body).isEqualTo(orderPlaced)
            );
        }

        @Test
        void reading_the_body_of_an_unknown_event_throws_event_not_found_exception() {
            // Given
            URI link = URI.create("http://localhost:2113/streams/orders/7");

            // When
            Throwable throwable = catchThrowable(() -> eventStream.readEventBody(OrderPlaced.class, link));

            // Then
            assertThat(throwable).isExactlyInstanceOf(EventNotFoundException.class)
                    .extracting(t -> ((EventNotFoundException) t).getLink()).isEqualTo(link);
        }

        @Test
        void unavailable_bodies_are_returned_once_the_configured_number_of_reads_has_passed() {
            // Given
            OrderPlaced orderPlaced = new OrderPlaced("1", 10);
            eventStream.append("orders", orderPlaced);
            eventStream.makeBodyUnavailable("orders", 0, 2);
            URI link = URI.create("http://localhost:2113/streams/orders/0");

            // Then
            assertAll(
                    () -> assertThat(eventStream.readEventBody(OrderPlaced.class, link)).isNull(),
                    () -> assertThat(eventStream.readEventBody(OrderPlaced.class, link)).isNull(),
                    () -> assertThat(eventStream.readEventBody(OrderPlaced.class, link)).isEqualTo(orderPlaced)
            );
        }

        @Test
        void bodies_that_cannot_be_deserialized_throw_event_store_read_exception() {
            // Given
            eventStream.append("orders", "OrderPlaced", "not an order");

            // When
            Throwable throwable = catchThrowable(() -> eventStream.readEventBody(OrderPlaced.class, URI.create("http://localhost:2113/streams/orders/0")));

            // Then
            assertThat(throwable).isExactlyInstanceOf(EventStoreReadException.class);
        }
    }
}
