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

package org.atomsub.subscription;

import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.junit.jupiter.api.Assertions.assertAll;

@DisplayNameGeneration(ReplaceUnderscores.class)
class SubscriptionKeyTest {

    @Test
    void a_missing_subscriber_id_denotes_the_default_subscriber() {
        // When
        SubscriptionKey key = SubscriptionKey.of("orders", null);

        // Then
        assertAll(
                () -> assertThat(key).isEqualTo(SubscriptionKey.defaultSubscriberOf("orders")),
                () -> assertThat(key.isDefaultSubscriber()).isTrue(),
                () -> assertThat(key.subscriberIdOrDefault()).isEqualTo(SubscriptionKey.DEFAULT_SUBSCRIBER),
                () -> assertThat(key).hasToString("orders|default")
        );
    }

    @Test
    void keys_of_the_same_stream_but_different_subscribers_differ() {
        assertAll(
                () -> assertThat(SubscriptionKey.of("orders", "billing")).isNotEqualTo(SubscriptionKey.of("orders", null)),
                () -> assertThat(SubscriptionKey.of("orders", "billing")).isNotEqualTo(SubscriptionKey.of("orders", "shipping")),
                () -> assertThat(SubscriptionKey.of("orders", "billing")).hasToString("orders|billing")
        );
    }

    @Test
    void blank_streams_are_rejected() {
        // When
        Throwable throwable = catchThrowable(() -> SubscriptionKey.of(" ", "billing"));

        // Then
        assertThat(throwable).isExactlyInstanceOf(IllegalArgumentException.class).hasMessage("stream cannot be blank");
    }
}
