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

import org.atomsub.domain.OrderPlaced;
import org.atomsub.domain.OrderShipped;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.junit.jupiter.api.Assertions.assertAll;

@DisplayNameGeneration(ReplaceUnderscores.class)
class EventTypeResolverTest {

    @Nested
    @DisplayName("MappedEventTypeResolver")
    class Mapped {

        @Test
        void resolves_registered_names_only() {
            // Given
            MappedEventTypeResolver resolver = new MappedEventTypeResolver()
                    .register(OrderPlaced.class)
                    .register("order-shipped", OrderShipped.class);

            // Then
            assertAll(
                    () -> assertThat(resolver.resolve(OrderPlaced.class.getName())).isEqualTo(OrderPlaced.class),
                    () -> assertThat(resolver.resolve("order-shipped")).isEqualTo(OrderShipped.class),
                    () -> assertThat(resolver.resolve("OrderShipped")).isNull()
            );
        }

        @Test
        void mapping_a_name_to_another_type_throws_iae() {
            // Given
            MappedEventTypeResolver resolver = new MappedEventTypeResolver().register("order", OrderPlaced.class);

            // When
            Throwable throwable = catchThrowable(() -> resolver.register("order", OrderShipped.class));

            // Then
            assertThat(throwable).isExactlyInstanceOf(IllegalArgumentException.class)
                    .hasMessage("Event type order is already mapped to " + OrderPlaced.class.getName());
        }
    }

    @Nested
    @DisplayName("ClassNameEventTypeResolver")
    class ClassName {

        @Test
        void qualified_resolves_fully_qualified_class_names() {
            // Given
            ClassNameEventTypeResolver resolver = ClassNameEventTypeResolver.qualified();

            // Then
            assertAll(
                    () -> assertThat(resolver.resolve(OrderPlaced.class.getName())).isEqualTo(OrderPlaced.class),
                    () -> assertThat(resolver.resolve("OrderPlaced")).isNull(),
                    () -> assertThat(resolver.resolve("")).isNull()
            );
        }

        @Test
        void simple_resolves_simple_names_in_the_given_package() {
            // Given
            ClassNameEventTypeResolver resolver = ClassNameEventTypeResolver.simple(OrderPlaced.class.getPackage());

            // Then
            assertAll(
                    () -> assertThat(resolver.resolve("OrderPlaced")).isEqualTo(OrderPlaced.class),
                    () -> assertThat(resolver.resolve("OrderShipped")).isEqualTo(OrderShipped.class),
                    () -> assertThat(resolver.resolve("OrderWasTeleported")).isNull()
            );
        }
    }
}
