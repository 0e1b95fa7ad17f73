package org.gsicoach.metrics;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.OptionalDouble;
import java.util.OptionalInt;

/**
 * Fixed-capacity (clock, value) series with oldest-first eviction and a running sum.
 * Not thread-safe; the owning sampler guards it.
 */
final class BoundedSeries {

    record Sample(int gameClock, int value) {}

    private final int capacity;
    private final Deque<Sample> samples = new ArrayDeque<>();
    private long sum;

    BoundedSeries(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
    }

    void add(int gameClock, int value) {
        samples.addLast(new Sample(gameClock, value));
        sum += value;
        while (samples.size() > capacity) {
            sum -= samples.removeFirst().value();
        }
    }

    int size() {
        return samples.size();
    }

    OptionalInt latest() {
        Sample last = samples.peekLast();
        return last == null ? OptionalInt.empty() : OptionalInt.of(last.value());
    }

    OptionalDouble mean() {
        if (samples.isEmpty()) return OptionalDouble.empty();
        return OptionalDouble.of((double) sum / samples.size());
    }

    List<Sample> samples() {
        return List.copyOf(samples);
    }

    void clear() {
        samples.clear();
        sum = 0;
    }
}
