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

package org.atomsub.handler.internal;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Internal class for measuring how specific a type is with regard to another type. Never use this class directly from your own code!
 */
public class TypeHierarchy {

    public static final int NOT_RELATED = Integer.MAX_VALUE;

    private TypeHierarchy() {
    }

    /**
     * @return The number of steps (through super classes and implemented interfaces, breadth first) from {@code type} up to
     * {@code superType}. {@code 0} if they're the same type, {@link #NOT_RELATED} if {@code superType} is not a super type of {@code type}.
     */
    public static int distance(Class<?> type, Class<?> superType) {
        if (type.equals(superType)) {
            return 0;
        } else if (!superType.isAssignableFrom(type)) {
            return NOT_RELATED;
        }

        Deque<Class<?>> currentLevel = new ArrayDeque<>();
        currentLevel.add(type);
        Set<Class<?>> visited = new HashSet<>();
        int distance = 0;
        while (!currentLevel.isEmpty()) {
            distance++;
            Deque<Class<?>> nextLevel = new ArrayDeque<>();
            for (Class<?> current : currentLevel) {
                for (Class<?> parent : parentsOf(current)) {
                    if (parent.equals(superType)) {
                        return distance;
                    } else if (visited.add(parent)) {
                        nextLevel.add(parent);
                    }
                }
            }
            currentLevel = nextLevel;
        }
        // Interfaces are assignable to Object without declaring it as a parent
        return superType.equals(Object.class) ? distance : NOT_RELATED;
    }

    private static Set<Class<?>> parentsOf(Class<?> type) {
        Set<Class<?>> parents = new LinkedHashSet<>();
        Class<?> superclass = type.getSuperclass();
        if (superclass != null) {
            parents.add(superclass);
        }
        parents.addAll(List.of(type.getInterfaces()));
        return parents;
    }
}
