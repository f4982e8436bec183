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

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

import static java.util.stream.Collectors.toUnmodifiableList;

/**
 * An {@link EventHandlerResolver} that keeps the registrations in memory.
 */
public class InMemoryEventHandlerResolver implements EventHandlerResolver {

    private final CopyOnWriteArrayList<HandlerRegistration> registrations = new CopyOnWriteArrayList<>();

    public InMemoryEventHandlerResolver register(HandlerRegistration registration) {
        Objects.requireNonNull(registration, HandlerRegistration.class.getSimpleName() + " cannot be null");
        if (registration.capabilities().isEmpty()) {
            throw new IllegalArgumentException("Handler " + registration.handlerId() + " doesn't declare any capabilities");
        }
        registrations.add(registration);
        return this;
    }

    public boolean unregister(HandlerRegistration registration) {
        return registrations.remove(registration);
    }

    @Override
    public List<HandlerRegistration> getHandlersOf(CapabilityDescriptor descriptor) {
        Objects.requireNonNull(descriptor, CapabilityDescriptor.class.getSimpleName() + " cannot be null");
        return registrations.stream().filter(registration -> registration.canHandle(descriptor)).collect(toUnmodifiableList());
    }
}
