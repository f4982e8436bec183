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

import org.atomsub.domain.Auditable;
import org.atomsub.domain.DomainEvent;
import org.atomsub.domain.OrderEvent;
import org.atomsub.domain.OrderPlaced;
import org.atomsub.domain.OrderShipped;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Test;

import java.io.Serializable;

import static org.assertj.core.api.Assertions.assertThat;
import static org.atomsub.handler.internal.TypeHierarchy.NOT_RELATED;
import static org.junit.jupiter.api.Assertions.assertAll;

@DisplayNameGeneration(ReplaceUnderscores.class)
class TypeHierarchyTest {

    @Test
    void distance_follows_super_classes_and_interfaces_breadth_first() {
        assertAll(
                () -> assertThat(TypeHierarchy.distance(OrderShipped.class, OrderShipped.class)).isZero(),
                () -> assertThat(TypeHierarchy.distance(OrderShipped.class, OrderEvent.class)).isEqualTo(1),
                () -> assertThat(TypeHierarchy.distance(OrderShipped.class, Auditable.class)).isEqualTo(1),
                () -> assertThat(TypeHierarchy.distance(OrderShipped.class, DomainEvent.class)).isEqualTo(2),
                () -> assertThat(TypeHierarchy.distance(OrderShipped.class, Object.class)).isEqualTo(2)
        );
    }

    @Test
    void unrelated_types_are_not_related() {
        assertAll(
                () -> assertThat(TypeHierarchy.distance(OrderPlaced.class, Auditable.class)).isEqualTo(NOT_RELATED),
                () -> assertThat(TypeHierarchy.distance(OrderEvent.class, OrderPlaced.class)).isEqualTo(NOT_RELATED),
                () -> assertThat(TypeHierarchy.distance(OrderPlaced.class, Serializable.class)).isEqualTo(NOT_RELATED)
        );
    }

    @Test
    void interfaces_are_one_step_from_object() {
        assertThat(TypeHierarchy.distance(Auditable.class, Object.class)).isEqualTo(1);
    }
}
