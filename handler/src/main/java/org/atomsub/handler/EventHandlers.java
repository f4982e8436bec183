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

import org.atomsub.handler.internal.TypeHierarchy;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.stream.IntStream;

import static java.util.Comparator.comparingInt;

/**
 * Finds the handlers that apply to an event and the capability of each handler to invoke.
 * <p>
 * Handlers are looked up from the {@link EventHandlerResolver} on every call, but which of its declared capabilities a
 * handler uses for an event type is cached for the lifetime of this instance. Only the position of the chosen capability is
 * cached, the capability itself is always taken from the registration being dispatched to.
 */
public class EventHandlers {
    private static final Logger log = LoggerFactory.getLogger(EventHandlers.class);
    static final String HANDLE_METHOD = "handle";

    private final EventTypeResolver eventTypeResolver;
    private final EventHandlerResolver eventHandlerResolver;
    private final ConcurrentMap<CapabilityCacheKey, OptionalInt> capabilityCache = new ConcurrentHashMap<>();

    public EventHandlers(EventTypeResolver eventTypeResolver, EventHandlerResolver eventHandlerResolver) {
        Objects.requireNonNull(eventTypeResolver, EventTypeResolver.class.getSimpleName() + " cannot be null");
        Objects.requireNonNull(eventHandlerResolver, EventHandlerResolver.class.getSimpleName() + " cannot be null");
        this.eventTypeResolver = eventTypeResolver;
        this.eventHandlerResolver = eventHandlerResolver;
    }

    /**
     * Find the handlers for {@code eventTypeName} that apply to {@code subscriberId}.
     *
     * @param eventTypeName The event type name as found in the stream
     * @param subscriberId  The subscriber, or {@code null} for the default subscriber
     */
    public ResolvedHandlers getEventHandlersFor(String eventTypeName, @Nullable String subscriberId) {
        Class<?> eventType = eventTypeResolver.resolve(eventTypeName);
        if (eventType == null) {
            log.info("An unsupported event type was passed in. No event type found for {}", eventTypeName);
            return ResolvedHandlers.unknownEventType();
        }

        List<HandlerRegistration> handlers = new ArrayList<>(eventHandlerResolver.getHandlersOf(CapabilityDescriptor.contentOnly(eventType)));
        handlers.addAll(eventHandlerResolver.getHandlersOf(CapabilityDescriptor.contentAndMetadata(eventType)));

        List<HandlerRegistration> handlersForSubscriberId = applicableTo(distinct(handlers), subscriberId);
        if (handlersForSubscriberId.isEmpty()) {
            log.debug("No handlers found for {}", eventType.getName());
        } else {
            log.debug("{} handlers found for {}", handlersForSubscriberId.size(), eventType.getName());
        }
        return new ResolvedHandlers(eventType, handlersForSubscriberId);
    }

    /**
     * Find the capability of {@code registration} to invoke for events of type {@code eventType}, which is the capability
     * declared for the most specific super type (or the type itself) of {@code eventType}.
     *
     * @return The capability or an empty {@code Optional} if the handler has no capability for the event type
     */
    public Optional<Capability<?>> findCapability(HandlerRegistration registration, Class<?> eventType) {
        Objects.requireNonNull(registration, HandlerRegistration.class.getSimpleName() + " cannot be null");
        Objects.requireNonNull(eventType, "eventType cannot be null");
        CapabilityCacheKey cacheKey = new CapabilityCacheKey(registration.handlerId(), eventType, HANDLE_METHOD);
        OptionalInt index = capabilityCache.computeIfAbsent(cacheKey, __ -> {
            OptionalInt capabilityIndex = mostSpecificCapabilityIndex(registration, eventType);
            if (capabilityIndex.isEmpty()) {
                log.warn("{}, which handles {} did not contain a suitable method named {}", registration.handlerId(), eventType.getName(), HANDLE_METHOD);
            }
            return capabilityIndex;
        });
        if (index.isEmpty()) {
            return Optional.empty();
        }

        List<Capability<?>> capabilities = registration.capabilities();
        int i = index.getAsInt();
        if (i < capabilities.size() && capabilities.get(i).accepts(eventType)) {
            return Optional.of(capabilities.get(i));
        }
        // Registration shares its id with another one but declares different capabilities
        OptionalInt own = mostSpecificCapabilityIndex(registration, eventType);
        return own.isPresent() ? Optional.of(capabilities.get(own.getAsInt())) : Optional.empty();
    }

    static List<HandlerRegistration> applicableTo(List<HandlerRegistration> handlers, @Nullable String subscriberId) {
        return handlers.stream().filter(handler -> handler.appliesTo(subscriberId)).toList();
    }

    // A handler may be returned for both arities, it should still only be invoked once
    private static List<HandlerRegistration> distinct(List<HandlerRegistration> handlers) {
        Set<HandlerRegistration> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        return handlers.stream().filter(seen::add).toList();
    }

    private static OptionalInt mostSpecificCapabilityIndex(HandlerRegistration registration, Class<?> eventType) {
        List<Capability<?>> capabilities = registration.capabilities();
        // Stream.min returns the first of equally specific capabilities, i.e. declaration order breaks ties
        return IntStream.range(0, capabilities.size())
                .filter(i -> capabilities.get(i).accepts(eventType))
                .boxed()
                .min(comparingInt(i -> TypeHierarchy.distance(eventType, capabilities.get(i).eventType())))
                .map(OptionalInt::of)
                .orElseGet(OptionalInt::empty);
    }

    private record CapabilityCacheKey(String handlerId, Class<?> eventType, String methodName) {
    }
}
