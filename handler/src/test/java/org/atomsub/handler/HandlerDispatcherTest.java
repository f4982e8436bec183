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

package org.atomsub.handler;

import org.atomsub.domain.OrderCancelled;
import org.atomsub.domain.OrderPlaced;
import org.atomsub.monitoring.PerformanceMonitor;
import org.atomsub.subscription.EventEnvelope;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.junit.jupiter.api.Assertions.assertAll;

@DisplayNameGeneration(ReplaceUnderscores.class)
class HandlerDispatcherTest {

    private static final OffsetDateTime UPDATED = OffsetDateTime.parse("2024-03-01T10:15:30+01:00");

    private EventHandlers eventHandlers;
    private CopyOnWriteArrayList<Integer> monitoredHandlerCounts;
    private CopyOnWriteArrayList<Map<Class<?>, Throwable>> monitoredErrors;
    private HandlerDispatcher dispatcher;

    @BeforeEach
    void dispatcher_is_created_before_each_test() {
        eventHandlers = new EventHandlers(new MappedEventTypeResolver().register(OrderPlaced.class), new InMemoryEventHandlerResolver());
        monitoredHandlerCounts = new CopyOnWriteArrayList<>();
        monitoredErrors = new CopyOnWriteArrayList<>();
        PerformanceMonitor recordingMonitor = (stream, eventTypeName, updated, handlerCount, errors) -> {
            monitoredHandlerCounts.add(handlerCount);
            monitoredErrors.add(errors);
        };
        dispatcher = new HandlerDispatcher(eventHandlers, List.of(recordingMonitor));
    }

    @Test
    void all_handlers_are_invoked_in_order() {
        // Given
        CopyOnWriteArrayList<String> invocations = new CopyOnWriteArrayList<>();
        HandlerRegistration first = HandlerRegistration.of(OrderPlaced.class, e -> invocations.add("first")).withId("first");
        HandlerRegistration second = HandlerRegistration.ofWithMetadata(OrderPlaced.class, (e, envelope) -> invocations.add("second:" + envelope.sequenceNumber())).withId("second");

        // When
        DispatchResult result = dispatcher.dispatch("orders", OrderPlaced.class, List.of(first, second), new OrderPlaced("1", 10), envelope());

        // Then
        assertAll(
                () -> assertThat(invocations).containsExactly("first", "second:3"),
                () -> assertThat(result.handlerCount()).isEqualTo(2),
                () -> assertThat(result.isSuccess()).isTrue(),
                () -> assertThat(monitoredHandlerCounts).containsExactly(2)
        );
    }

    @Test
    void failures_are_recorded_against_the_handler_type_and_passed_to_its_error_callback() {
        // Given
        ExplodingHandler exploding = new ExplodingHandler();
        CopyOnWriteArrayList<OrderPlaced> received = new CopyOnWriteArrayList<>();
        HandlerRegistration failing = HandlerRegistration.of(OrderPlaced.class, exploding);
        HandlerRegistration succeeding = HandlerRegistration.of(OrderPlaced.class, received::add);
        OrderPlaced event = new OrderPlaced("1", 10);

        // When
        DispatchResult result = dispatcher.dispatch("orders", OrderPlaced.class, List.of(failing, succeeding), event, envelope());

        // Then
        assertAll(
                () -> assertThat(received).containsExactly(event),
                () -> assertThat(result.handlerCount()).isEqualTo(2),
                () -> assertThat(result.errors()).containsOnlyKeys(ExplodingHandler.class),
                () -> assertThat(exploding.errors).singleElement().isInstanceOf(IllegalStateException.class),
                () -> assertThat(monitoredErrors).singleElement().satisfies(errors -> assertThat(errors).containsOnlyKeys(ExplodingHandler.class))
        );
    }

    @Test
    void errors_thrown_by_a_handler_are_recorded_and_do_not_prevent_the_next_handlers_from_being_invoked() {
        // Given
        CopyOnWriteArrayList<Throwable> reportedErrors = new CopyOnWriteArrayList<>();
        HandlerRegistration asserting = HandlerRegistration.of(OrderPlaced.class, new EventHandler<OrderPlaced>() {
            @Override
            public void handle(OrderPlaced event) {
                throw new AssertionError("boom");
            }

            @Override
            public void onError(Throwable error, OrderPlaced event) {
                reportedErrors.add(error);
            }
        }).withId("asserting");
        CopyOnWriteArrayList<OrderPlaced> received = new CopyOnWriteArrayList<>();
        HandlerRegistration sibling = HandlerRegistration.of(OrderPlaced.class, received::add).withId("sibling");
        OrderPlaced event = new OrderPlaced("1", 10);

        // When
        DispatchResult result = dispatcher.dispatch("orders", OrderPlaced.class, List.of(asserting, sibling), event, envelope());

        // Then
        assertAll(
                () -> assertThat(received).containsExactly(event),
                () -> assertThat(result.handlerCount()).isEqualTo(2),
                () -> assertThat(result.errors().values()).singleElement().isInstanceOf(AssertionError.class),
                () -> assertThat(reportedErrors).singleElement().isInstanceOf(AssertionError.class),
                () -> assertThat(monitoredHandlerCounts).containsExactly(2)
        );
    }

    @Test
    void virtual_machine_errors_are_not_caught() {
        // Given
        HandlerRegistration outOfMemory = HandlerRegistration.of(OrderPlaced.class, e -> {
            throw new OutOfMemoryError("expected");
        });

        // When
        Throwable throwable = catchThrowable(() -> dispatcher.dispatch("orders", OrderPlaced.class, List.of(outOfMemory), new OrderPlaced("1", 10), envelope()));

        // Then
        assertThat(throwable).isExactlyInstanceOf(OutOfMemoryError.class);
    }

    @Test
    void a_failing_error_callback_is_only_logged() {
        // Given
        HandlerRegistration registration = HandlerRegistration.of(OrderPlaced.class, new EventHandler<OrderPlaced>() {
            @Override
            public void handle(OrderPlaced event) {
                throw new IllegalStateException("expected");
            }

            @Override
            public void onError(Throwable error, OrderPlaced event) {
                throw new IllegalArgumentException("also expected");
            }
        });

        // When
        DispatchResult result = dispatcher.dispatch("orders", OrderPlaced.class, List.of(registration), new OrderPlaced("1", 10), envelope());

        // Then
        assertThat(result.errors().values()).singleElement().isInstanceOf(IllegalStateException.class);
    }

    @Test
    void handlers_without_a_matching_capability_are_skipped() {
        // Given
        HandlerRegistration cancellations = HandlerRegistration.of(OrderCancelled.class, e -> {
        });

        // When
        DispatchResult result = dispatcher.dispatch("orders", OrderPlaced.class, List.of(cancellations), new OrderPlaced("1", 10), envelope());

        // Then
        assertAll(
                () -> assertThat(result.handlerCount()).isZero(),
                () -> assertThat(result.isSuccess()).isTrue(),
                () -> assertThat(monitoredHandlerCounts).containsExactly(0)
        );
    }

    @Test
    void every_performance_monitor_is_notified_even_when_one_of_them_fails() {
        // Given
        CopyOnWriteArrayList<String> notified = new CopyOnWriteArrayList<>();
        PerformanceMonitor failing = (stream, eventTypeName, updated, handlerCount, errors) -> {
            throw new IllegalStateException("expected");
        };
        PerformanceMonitor recording = (stream, eventTypeName, updated, handlerCount, errors) -> notified.add(stream + ":" + eventTypeName + ":" + handlerCount);
        HandlerDispatcher dispatcher = new HandlerDispatcher(eventHandlers, List.of(failing, recording));

        // When
        dispatcher.notifyPerformanceMonitors("orders", "OrderCancelled", UPDATED, 0, Map.of());

        // Then
        assertThat(notified).containsExactly("orders:OrderCancelled:0");
    }

    private static EventEnvelope envelope() {
        return new EventEnvelope("id", OrderPlaced.class.getName(), null, 3, UPDATED, URI.create("http://localhost:2113/streams/orders/3"), "3@orders");
    }

    private static class ExplodingHandler implements EventHandler<OrderPlaced> {
        private final List<Throwable> errors = new CopyOnWriteArrayList<>();

        @Override
        public void handle(OrderPlaced event) {
            throw new IllegalStateException("expected");
        }

        @Override
        public void onError(Throwable error, OrderPlaced event) {
            errors.add(error);
        }
    }
}
