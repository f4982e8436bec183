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

import org.atomsub.subscription.SubscriptionKey;
import org.atomsub.subscription.api.blocking.StreamPositionStorage;
import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * A {@link StreamPositionStorage} that keeps the positions in memory. Positions are lost when the JVM exits so this is
 * mainly useful for tests.
 */
@NullMarked
public class InMemoryStreamPositionStorage implements StreamPositionStorage {
    private final Map<SubscriptionKey, Long> positions = new ConcurrentHashMap<>();

    @Override
    public @Nullable Long getPositionFor(String stream, @Nullable String subscriberId) {
        return positions.get(SubscriptionKey.of(stream, subscriberId));
    }

    @Override
    public void setPositionFor(String stream, @Nullable String subscriberId, long position) {
        positions.put(SubscriptionKey.of(stream, subscriberId), position);
    }

    public void clear() {
        positions.clear();
    }
}
