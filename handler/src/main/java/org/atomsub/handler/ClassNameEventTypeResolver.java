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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * An {@link EventTypeResolver} that treats the event type name as a class name. Either the fully qualified name is
 * used ({@link #qualified()}), or the simple name which is then looked up in a given package ({@link #simple(String)}).
 */
public class ClassNameEventTypeResolver implements EventTypeResolver {
    private static final Logger log = LoggerFactory.getLogger(ClassNameEventTypeResolver.class);

    private final String packagePrefix;
    private final ClassLoader classLoader;
    private final ConcurrentMap<String, Optional<Class<?>>> cache = new ConcurrentHashMap<>();

    private ClassNameEventTypeResolver(String packagePrefix, ClassLoader classLoader) {
        this.packagePrefix = packagePrefix;
        this.classLoader = classLoader;
    }

    /**
     * Use the (fully) qualified name of a class as event type name.
     */
    public static ClassNameEventTypeResolver qualified() {
        return new ClassNameEventTypeResolver("", defaultClassLoader());
    }

    /**
     * Use the simple name of a class as event type name and prepend {@code packageName} when resolving it.
     * This assumes that <i>all</i> events have the same package name.
     */
    public static ClassNameEventTypeResolver simple(String packageName) {
        Objects.requireNonNull(packageName, "packageName cannot be null");
        String trimmed = packageName.trim();
        return new ClassNameEventTypeResolver(trimmed.isEmpty() || trimmed.endsWith(".") ? trimmed : trimmed + ".", defaultClassLoader());
    }

    /**
     * @see #simple(String)
     */
    public static ClassNameEventTypeResolver simple(Package domainEventPackage) {
        Objects.requireNonNull(domainEventPackage, "domainEventPackage cannot be null");
        return simple(domainEventPackage.getName());
    }

    public ClassNameEventTypeResolver classLoader(ClassLoader classLoader) {
        Objects.requireNonNull(classLoader, ClassLoader.class.getSimpleName() + " cannot be null");
        return new ClassNameEventTypeResolver(packagePrefix, classLoader);
    }

    @Override
    public @Nullable Class<?> resolve(String eventTypeName) {
        if (eventTypeName == null || eventTypeName.isBlank()) {
            return null;
        }
        return cache.computeIfAbsent(eventTypeName, this::load).orElse(null);
    }

    private Optional<Class<?>> load(String eventTypeName) {
        String className = packagePrefix + eventTypeName;
        try {
            return Optional.of(Class.forName(className, false, classLoader));
        } catch (ClassNotFoundException | LinkageError e) {
            log.debug("Could not load class {} for event type {}", className, eventTypeName);
            return Optional.empty();
        }
    }

    private static ClassLoader defaultClassLoader() {
        ClassLoader contextClassLoader = Thread.currentThread().getContextClassLoader();
        return contextClassLoader == null ? ClassNameEventTypeResolver.class.getClassLoader() : contextClassLoader;
    }
}
