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

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Counts processed messages per stream in a rolling set of fixed size time windows. Only the latest
 * {@code windowCount} windows of length {@code windowPeriod} are kept.
 */
public class PerformanceStats {

    private final Duration windowPeriod;
    private final int windowCount;
    private final Clock clock;
    private final Deque<Window> windows = new ArrayDeque<>();

    public PerformanceStats(Duration windowPeriod, int windowCount) {
        this(windowPeriod, windowCount, Clock.systemUTC());
    }

    public PerformanceStats(Duration windowPeriod, int windowCount, Clock clock) {
        Objects.requireNonNull(windowPeriod, "windowPeriod cannot be null");
        Objects.requireNonNull(clock, Clock.class.getSimpleName() + " cannot be null");
        if (windowPeriod.isNegative() || windowPeriod.isZero()) {
            throw new IllegalArgumentException("windowPeriod must be > 0 but got " + windowPeriod);
        } else if (windowCount < 1) {
            throw new IllegalArgumentException("windowCount must be greater than or equal to 1");
        }
        this.windowPeriod = windowPeriod;
        this.windowCount = windowCount;
        this.clock = clock;
    }

    /**
     * Record that a message from {@code stream} has been processed.
     */
    public synchronized void messageProcessed(String stream) {
        Objects.requireNonNull(stream, "stream cannot be null");
        currentWindow().increment(stream);
    }

    /**
     * @return A snapshot of the retained windows, oldest first
     */
    public synchronized List<WindowStats> getWindows() {
        evictExpiredWindows(clock.instant());
        return windows.stream().map(Window::snapshot).collect(Collectors.toUnmodifiableList());
    }

    /**
     * @return The number of messages processed for {@code stream} in the retained windows
     */
    public synchronized long getCount(String stream) {
        evictExpiredWindows(clock.instant());
        return windows.stream().mapToLong(window -> window.counts.getOrDefault(stream, 0L)).sum();
    }

    /**
     * @return The number of messages processed for all streams in the retained windows
     */
    public synchronized long getTotalCount() {
        evictExpiredWindows(clock.instant());
        return windows.stream().flatMap(window -> window.counts.values().stream()).mapToLong(Long::longValue).sum();
    }

    public Duration getWindowPeriod() {
        return windowPeriod;
    }

    public int getWindowCount() {
        return windowCount;
    }

    private Window currentWindow() {
        Instant now = clock.instant();
        evictExpiredWindows(now);
        Window last = windows.peekLast();
        if (last == null || !now.isBefore(last.start.plus(windowPeriod))) {
            Instant start = last == null ? now : alignedStart(last.start, now);
            last = new Window(start);
            windows.addLast(last);
            while (windows.size() > windowCount) {
                windows.removeFirst();
            }
        }
        return last;
    }

    private Instant alignedStart(Instant previousStart, Instant now) {
        long periodsElapsed = Duration.between(previousStart, now).toMillis() / windowPeriod.toMillis();
        return previousStart.plus(windowPeriod.multipliedBy(periodsElapsed));
    }

    private void evictExpiredWindows(Instant now) {
        Instant oldestAllowed = now.minus(windowPeriod.multipliedBy(windowCount));
        while (!windows.isEmpty() && !windows.peekFirst().start.plus(windowPeriod).isAfter(oldestAllowed)) {
            windows.removeFirst();
        }
    }

    /**
     * The number of messages processed per stream during one window.
     */
    public record WindowStats(Instant start, Duration period, Map<String, Long> counts) {
        public long total() {
            return counts.values().stream().mapToLong(Long::longValue).sum();
        }
    }

    private final class Window {
        private final Instant start;
        private final Map<String, Long> counts = new LinkedHashMap<>();

        private Window(Instant start) {
            this.start = start;
        }

        private void increment(String stream) {
            counts.merge(stream, 1L, Long::sum);
        }

        private WindowStats snapshot() {
            return new WindowStats(start, windowPeriod, Map.copyOf(counts));
        }
    }
}
