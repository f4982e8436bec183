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

package org.atomsub.monitoring;

import org.atomsub.subscription.SubscriptionKey;
import org.jspecify.annotations.Nullable;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.stream.Collectors;

/**
 * A {@link SubscriberIntervalMonitor} that keeps the last tick of every subscription in memory.
 * <p>
 * A subscription is considered overdue when it hasn't ticked for longer than its interval times the tolerance factor.
 * Since a subscription doesn't tick while it's polling, an overdue subscription is typically stuck in a slow handler or
 * is working through a large backlog.
 */
public class InMemorySubscriberIntervalMonitor implements SubscriberIntervalMonitor {

    private final ConcurrentMap<SubscriptionKey, Tick> ticks = new ConcurrentHashMap<>();
    private final Clock clock;
    private final int toleranceFactor;

    public InMemorySubscriberIntervalMonitor() {
        this(Clock.systemUTC(), 3);
    }

    public InMemorySubscriberIntervalMonitor(Clock clock, int toleranceFactor) {
        Objects.requireNonNull(clock, Clock.class.getSimpleName() + " cannot be null");
        if (toleranceFactor < 1) {
            throw new IllegalArgumentException("toleranceFactor must be greater than or equal to 1");
        }
        this.clock = clock;
        this.toleranceFactor = toleranceFactor;
    }

    @Override
    public void updateInterval(String stream, Duration interval, @Nullable String subscriberId) {
        Objects.requireNonNull(interval, "interval cannot be null");
        ticks.put(SubscriptionKey.of(stream, subscriberId), new Tick(interval, clock.instant()));
    }

    @Override
    public void removeMonitor(String stream, @Nullable String subscriberId) {
        ticks.remove(SubscriptionKey.of(stream, subscriberId));
    }

    public Optional<Tick> getLastTick(String stream, @Nullable String subscriberId) {
        return Optional.ofNullable(ticks.get(SubscriptionKey.of(stream, subscriberId)));
    }

    public Map<SubscriptionKey, Tick> getTicks() {
        return Map.copyOf(ticks);
    }

    /**
     * @return The subscriptions that haven't ticked within their interval times the tolerance factor
     */
    public List<SubscriptionKey> getOverdueSubscriptions() {
        Instant now = clock.instant();
        return ticks.entrySet().stream()
                .filter(e -> e.getValue().isOverdue(now, toleranceFactor))
                .map(Map.Entry::getKey)
                .collect(Collectors.toUnmodifiableList());
    }

    /**
     * @param interval The interval of the subscription
     * @param lastTick When the subscription last ticked
     */
    public record Tick(Duration interval, Instant lastTick) {
        boolean isOverdue(Instant now, int toleranceFactor) {
            return lastTick.plus(interval.multipliedBy(toleranceFactor)).isBefore(now);
        }
    }
}
