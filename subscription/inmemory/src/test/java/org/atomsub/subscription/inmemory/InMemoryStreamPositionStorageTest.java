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

package org.atomsub.subscription.inmemory;

import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertAll;

@DisplayNameGeneration(ReplaceUnderscores.class)
class InMemoryStreamPositionStorageTest {

    @Test
    void positions_are_stored_per_stream_and_subscriber() {
        // Given
        InMemoryStreamPositionStorage storage = new InMemoryStreamPositionStorage();

        // When
        storage.setPositionFor("orders", null, 3);
        storage.setPositionFor("orders", "billing", 7);
        storage.setPositionFor("orders", null, 4);

        // Then
        assertAll(
                () -> assertThat(storage.getPositionFor("orders", null)).isEqualTo(4L),
                () -> assertThat(storage.getPositionFor("orders", "billing")).isEqualTo(7L),
                () -> assertThat(storage.getPositionFor("payments", null)).isNull()
        );
    }
}
