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

import org.atomsub.monitoring.PerformanceMonitor;
import org.atomsub.subscription.EventEnvelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.OffsetDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Invokes the handlers of an event one after the other. A failing handler never prevents the remaining handlers from
 * being invoked, its exception is recorded in the {@link DispatchResult} and passed to the error callback of the handler.
 * All {@link PerformanceMonitor}s are notified once all handlers have been invoked.
 */
public class HandlerDispatcher {
    private static final Logger log = LoggerFactory.getLogger(HandlerDispatcher.class);

    private final EventHandlers eventHandlers;
    private final List<PerformanceMonitor> performanceMonitors;

    public HandlerDispatcher(EventHandlers eventHandlers, List<PerformanceMonitor> performanceMonitors) {
        Objects.requireNonNull(eventHandlers, EventHandlers.class.getSimpleName() + " cannot be null");
        Objects.requireNonNull(performanceMonitors, "performanceMonitors cannot be null");
        this.eventHandlers = eventHandlers;
        this.performanceMonitors = List.copyOf(performanceMonitors);
    }

    /**
     * Invoke {@code handlers} with {@code event}.
     *
     * @param stream    The stream the event was read from
     * @param eventType The resolved type of the event
     * @param handlers  The handlers to invoke
     * @param event     The deserialized event
     * @param envelope  The envelope the event was read from
     * @return The number of invoked handlers and the errors of those that failed
     */
    public DispatchResult dispatch(String stream, Class<?> eventType, List<HandlerRegistration> handlers, Object event, EventEnvelope envelope) {
        int handlerCount = 0;
        Map<Class<?>, Throwable> errors = new LinkedHashMap<>();
        for (HandlerRegistration handler : handlers) {
            Optional<Capability<?>> capability = eventHandlers.findCapability(handler, eventType);
            if (capability.isEmpty()) {
                log.warn("Could not find the handle method for: {}", handler.handlerId());
                continue;
            }

            handlerCount++;
            try {
                capability.get().handle(event, envelope);
            } catch (VirtualMachineError e) {
                throw e;
            } catch (Throwable e) {
                errors.put(handler.handlerType(), e);
                log.error("{} thrown processing event {}", e.getClass().getName(), envelope.title(), e);
                invokeErrorCallback(capability.get(), e, event, envelope);
            }
        }

        notifyPerformanceMonitors(stream, envelope.eventType(), envelope.updated(), handlerCount, errors);
        return new DispatchResult(handlerCount, errors);
    }

    /**
     * Notify all monitors. A failing monitor is logged and doesn't prevent the other monitors from being notified.
     */
    public void notifyPerformanceMonitors(String stream, String eventTypeName, OffsetDateTime updated, int handlerCount, Map<Class<?>, Throwable> errors) {
        Map<Class<?>, Throwable> readOnlyErrors = Collections.unmodifiableMap(new LinkedHashMap<>(errors));
        for (PerformanceMonitor performanceMonitor : performanceMonitors) {
            try {
                performanceMonitor.accept(stream, eventTypeName, updated, handlerCount, readOnlyErrors);
            } catch (VirtualMachineError e) {
                throw e;
            } catch (Throwable e) {
                log.error("Performance monitor {} failed for event type {} on stream {}", performanceMonitor.getClass().getName(), eventTypeName, stream, e);
            }
        }
    }

    private static void invokeErrorCallback(Capability<?> capability, Throwable error, Object event, EventEnvelope envelope) {
        try {
            capability.onError(error, event);
        } catch (VirtualMachineError errorHandlingException) {
            throw errorHandlingException;
        } catch (Throwable errorHandlingException) {
            log.error("{} thrown whilst handling error from event {}", errorHandlingException.getClass().getName(), envelope.title(), errorHandlingException);
        }
    }
}
