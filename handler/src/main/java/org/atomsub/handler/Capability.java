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

import org.atomsub.subscription.EventEnvelope;

import java.util.Objects;

/**
 * A declaration that a handler handles events of type {@code T} (or any subtype of it).
 *
 * @param <T> The declared event type
 */
public final class Capability<T> {
    private final Class<T> eventType;
    private final Arity arity;
    private final EventAndMetadataHandler<? super T> handler;

    private Capability(Class<T> eventType, Arity arity, EventAndMetadataHandler<? super T> handler) {
        this.eventType = eventType;
        this.arity = arity;
        this.handler = handler;
    }

    static <T> Capability<T> contentOnly(Class<T> eventType, EventHandler<? super T> handler) {
        Objects.requireNonNull(eventType, "eventType cannot be null");
        Objects.requireNonNull(handler, EventHandler.class.getSimpleName() + " cannot be null");
        return new Capability<>(eventType, Arity.CONTENT_ONLY, new EventAndMetadataHandler<T>() {
            @Override
            public void handle(T event, EventEnvelope envelope) throws Exception {
                handler.handle(event);
            }

            @Override
            public void onError(Throwable error, T event) {
                handler.onError(error, event);
            }
        });
    }

    static <T> Capability<T> contentAndMetadata(Class<T> eventType, EventAndMetadataHandler<? super T> handler) {
        Objects.requireNonNull(eventType, "eventType cannot be null");
        Objects.requireNonNull(handler, EventAndMetadataHandler.class.getSimpleName() + " cannot be null");
        return new Capability<>(eventType, Arity.CONTENT_AND_METADATA, handler);
    }

    public Class<T> eventType() {
        return eventType;
    }

    public Arity arity() {
        return arity;
    }

    /**
     * @return {@code true} if events of type {@code actualEventType} can be passed to this capability
     */
    public boolean accepts(Class<?> actualEventType) {
        return eventType.isAssignableFrom(actualEventType);
    }

    public void handle(Object event, EventEnvelope envelope) throws Exception {
        handler.handle(eventType.cast(event), envelope);
    }

    public void onError(Throwable error, Object event) {
        handler.onError(error, eventType.cast(event));
    }

    @Override
    public String toString() {
        return "Capability{" +
                "eventType=" + eventType.getName() +
                ", arity=" + arity +
                '}';
    }
}
