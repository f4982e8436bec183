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

package org.atomsub.subscription.timer;

import org.atomsub.subscription.StreamSubscription;
import org.atomsub.subscription.SubscriptionKey;
import org.atomsub.subscription.api.blocking.SubscriptionTimerManager;
import org.atomsub.subscription.internal.ExecutorShutdown;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import static java.util.concurrent.TimeUnit.SECONDS;

/**
 * A {@link SubscriptionTimerManager} that schedules every subscription as an independent task on a
 * {@link ScheduledExecutorService}. The scheduler only triggers ticks, the tick callbacks run on a separate
 * {@link ExecutorService} so that a slow subscription never delays the ticks of the others.
 * <p>
 * Pausing a subscription cancels its scheduled task, resuming it schedules a new one starting one interval later.
 * All registry operations are guarded by a single lock that is never held while a tick callback runs.
 */
public class ScheduledSubscriptionTimerManager implements SubscriptionTimerManager {
    private static final Logger log = LoggerFactory.getLogger(ScheduledSubscriptionTimerManager.class);

    private final Object lock = new Object();
    private final Map<SubscriptionKey, SubscriptionTimer> timers = new LinkedHashMap<>();
    private final ScheduledExecutorService scheduler;
    private final ExecutorService tickExecutor;

    private volatile boolean shutdown = false;

    /**
     * Create a new {@link ScheduledSubscriptionTimerManager} with a single scheduler thread and an unbounded cached thread pool for ticks.
     */
    public ScheduledSubscriptionTimerManager() {
        this(Executors.newSingleThreadScheduledExecutor(), Executors.newCachedThreadPool());
    }

    /**
     * @param scheduler    The executor that triggers the ticks
     * @param tickExecutor The executor that runs the tick callbacks
     */
    public ScheduledSubscriptionTimerManager(ScheduledExecutorService scheduler, ExecutorService tickExecutor) {
        Objects.requireNonNull(scheduler, "scheduler cannot be null");
        Objects.requireNonNull(tickExecutor, "tickExecutor cannot be null");
        this.scheduler = scheduler;
        this.tickExecutor = tickExecutor;
    }

    @Override
    public void add(SubscriptionKey key, Duration interval, Runnable onTick, Runnable onTimerElapsed) {
        Objects.requireNonNull(key, SubscriptionKey.class.getSimpleName() + " cannot be null");
        Objects.requireNonNull(interval, "interval cannot be null");
        Objects.requireNonNull(onTick, "onTick cannot be null");
        Objects.requireNonNull(onTimerElapsed, "onTimerElapsed cannot be null");
        if (interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("interval must be > 0 but got " + interval);
        }

        synchronized (lock) {
            if (shutdown) {
                throw new IllegalStateException("Cannot add a subscription when shutdown");
            } else if (timers.containsKey(key)) {
                throw new IllegalArgumentException("Subscription " + key + " is already defined.");
            }
            SubscriptionTimer timer = new SubscriptionTimer(key, interval, onTick, onTimerElapsed);
            timers.put(key, timer);
            timer.schedule();
        }
    }

    @Override
    public void remove(SubscriptionKey key) {
        synchronized (lock) {
            SubscriptionTimer timer = timers.remove(key);
            if (timer != null) {
                timer.cancel();
            }
        }
    }

    @Override
    public void pause(SubscriptionKey key) {
        synchronized (lock) {
            SubscriptionTimer timer = timers.get(key);
            if (timer != null && !timer.paused) {
                timer.paused = true;
                timer.cancel();
            }
        }
    }

    @Override
    public void resume(SubscriptionKey key) {
        synchronized (lock) {
            SubscriptionTimer timer = timers.get(key);
            if (timer != null && timer.paused && !shutdown) {
                timer.paused = false;
                timer.schedule();
            }
        }
    }

    @Override
    public boolean contains(SubscriptionKey key) {
        synchronized (lock) {
            return timers.containsKey(key);
        }
    }

    @Override
    public List<StreamSubscription> getSubscriptions() {
        synchronized (lock) {
            List<StreamSubscription> subscriptions = new ArrayList<>(timers.size());
            timers.values().forEach(timer -> subscriptions.add(new StreamSubscription(timer.key, timer.interval, timer.paused)));
            return List.copyOf(subscriptions);
        }
    }

    @Override
    public void shutdown() {
        synchronized (lock) {
            shutdown = true;
            timers.values().forEach(SubscriptionTimer::cancel);
            timers.clear();
        }
        ExecutorShutdown.shutdownSafely(scheduler, 5, SECONDS);
        ExecutorShutdown.shutdownSafely(tickExecutor, 5, SECONDS);
    }

    private void tick(SubscriptionTimer timer) {
        // The task may have been cancelled after it was triggered
        if (!isLive(timer)) {
            return;
        }

        try {
            tickExecutor.execute(() -> {
                // The subscription may have been removed or paused while the callbacks were queued
                if (!isLive(timer)) {
                    log.debug("{}: Subscription was removed or paused before the tick ran, skipping it", timer.key);
                    return;
                }
                try {
                    timer.onTimerElapsed.run();
                } catch (Exception e) {
                    log.error("{}: Timer elapsed callback failed", timer.key, e);
                }
                if (isLive(timer)) {
                    timer.onTick.run();
                }
            });
        } catch (RejectedExecutionException e) {
            log.warn("{}: Tick was rejected, the timer manager is probably shutting down", timer.key);
        }
    }

    private boolean isLive(SubscriptionTimer timer) {
        synchronized (lock) {
            return !timer.paused && timers.get(timer.key) == timer;
        }
    }

    private final class SubscriptionTimer {
        private final SubscriptionKey key;
        private final Duration interval;
        private final Runnable onTick;
        private final Runnable onTimerElapsed;
        private boolean paused;
        private @Nullable ScheduledFuture<?> future;

        private SubscriptionTimer(SubscriptionKey key, Duration interval, Runnable onTick, Runnable onTimerElapsed) {
            this.key = key;
            this.interval = interval;
            this.onTick = onTick;
            this.onTimerElapsed = onTimerElapsed;
        }

        private void schedule() {
            long millis = Math.max(1, interval.toMillis());
            future = scheduler.scheduleWithFixedDelay(() -> tick(this), millis, millis, TimeUnit.MILLISECONDS);
        }

        private void cancel() {
            if (future != null) {
                future.cancel(false);
                future = null;
            }
        }
    }
}
