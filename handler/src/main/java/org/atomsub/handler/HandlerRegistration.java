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

import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Declares which events a handler handles and which subscribers it applies to. A registration is immutable, every
 * method returns a new instance:
 * <pre>
 * HandlerRegistration registration = HandlerRegistration.of(orderProjection)
 *         .handles(OrderPlaced.class, orderProjection::orderPlaced)
 *         .handlesWithMetadata(OrderEvent.class, orderProjection::anyOrderEvent)
 *         .scopedTo(SubscriberScope.named("projections"));
 * </pre>
 * When an event matches several capabilities, the one declared for the most specific type is used.
 * <p>
 * The {@link #handlerId()} identifies the capability set of a handler, registrations with equal ids must declare the same
 * capabilities. It defaults to the class name of the handler.
 */
public final class HandlerRegistration {

    private final String handlerId;
    private final Object handler;
    private final List<Capability<?>> capabilities;
    private final SubscriberScope scope;

    private HandlerRegistration(String handlerId, Object handler, List<Capability<?>> capabilities, SubscriberScope scope) {
        this.handlerId = handlerId;
        this.handler = handler;
        this.capabilities = List.copyOf(capabilities);
        this.scope = scope;
    }

    /**
     * Start a registration for {@code handler}. The handler instance is what's reported as failing when one of its capabilities throws.
     */
    public static HandlerRegistration of(Object handler) {
        Objects.requireNonNull(handler, "handler cannot be null");
        return new HandlerRegistration(handler.getClass().getName(), handler, List.of(), SubscriberScope.defaultSubscriber());
    }

    /**
     * Shortcut for registering a handler that only handles one type of event.
     */
    public static <T> HandlerRegistration of(Class<T> eventType, EventHandler<? super T> handler) {
        return of(handler).handles(eventType, handler);
    }

    /**
     * Shortcut for registering a handler that only handles one type of event and wants the metadata.
     */
    public static <T> HandlerRegistration ofWithMetadata(Class<T> eventType, EventAndMetadataHandler<? super T> handler) {
        return of(handler).handlesWithMetadata(eventType, handler);
    }

    public <T> HandlerRegistration handles(Class<T> eventType, EventHandler<? super T> eventHandler) {
        return withCapability(Capability.contentOnly(eventType, eventHandler));
    }

    public <T> HandlerRegistration handlesWithMetadata(Class<T> eventType, EventAndMetadataHandler<? super T> eventHandler) {
        return withCapability(Capability.contentAndMetadata(eventType, eventHandler));
    }

    public HandlerRegistration scopedTo(SubscriberScope scope) {
        Objects.requireNonNull(scope, SubscriberScope.class.getSimpleName() + " cannot be null");
        return new HandlerRegistration(handlerId, handler, capabilities, scope);
    }

    public HandlerRegistration withId(String handlerId) {
        Objects.requireNonNull(handlerId, "handlerId cannot be null");
        return new HandlerRegistration(handlerId, handler, capabilities, scope);
    }

    private HandlerRegistration withCapability(Capability<?> capability) {
        List<Capability<?>> newCapabilities = new ArrayList<>(capabilities);
        newCapabilities.add(capability);
        return new HandlerRegistration(handlerId, handler, newCapabilities, scope);
    }

    public String handlerId() {
        return handlerId;
    }

    public Object handler() {
        return handler;
    }

    public Class<?> handlerType() {
        return handler.getClass();
    }

    public List<Capability<?>> capabilities() {
        return capabilities;
    }

    public SubscriberScope scope() {
        return scope;
    }

    /**
     * @return {@code true} if this handler declares a capability matching the descriptor, i.e. of the same arity and for the
     * event type or one of its super types.
     */
    public boolean canHandle(CapabilityDescriptor descriptor) {
        Objects.requireNonNull(descriptor, CapabilityDescriptor.class.getSimpleName() + " cannot be null");
        return capabilities.stream().anyMatch(c -> c.arity() == descriptor.arity() && c.accepts(descriptor.eventType()));
    }

    public boolean appliesTo(@Nullable String subscriberId) {
        return scope.appliesTo(subscriberId);
    }

    @Override
    public String toString() {
        return "HandlerRegistration{" +
                "handlerId='" + handlerId + '\'' +
                ", capabilities=" + capabilities +
                ", scope=" + scope +
                '}';
    }
}
