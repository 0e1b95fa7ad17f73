package org.gsicoach.metrics;

import domain.model.PlayerState;
import domain.model.Snapshot;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Samples the local player's GPM, XPM and last hits into bounded series and
 * reports trends against their rolling means, last-hit pacing against
 * phase benchmarks, and death pacing.
 */
public final class MetricSampler {

    public static final int MAX_SAMPLES = 20;

    /** Last-hit benchmarks switch from the early to the later table at this minute. */
    static final int EARLY_PHASE_MINUTES = 10;
    static final double DEATHS_PER_MINUTE_WARNING = 0.2;
    static final int SURVIVAL_STREAK_SECONDS = 300;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<MetricKind, BoundedSeries> series = new EnumMap<>(MetricKind.class);
    private int lastClock = Integer.MIN_VALUE;
    private Integer deathCount;          // null until the client reports one
    private Integer lastDeathClock;      // null until a death was observed

    public MetricSampler() {
        for (MetricKind kind : MetricKind.values()) {
            series.put(kind, new BoundedSeries(MAX_SAMPLES));
        }
    }

    /**
     * Appends the snapshot's counters; stale or duplicate clocks are ignored.
     *
     * @return true if the snapshot was sampled
     */
    public boolean update(Snapshot current) {
        int clock = current.getGameClock();
        Optional<PlayerState> player = current.getPlayer();

        lock.writeLock().lock();
        try {
            if (clock <= lastClock) {
                return false;
            }
            lastClock = clock;
            if (player.isEmpty()) {
                return true;
            }
            PlayerState p = player.get();
            p.getGpm().ifPresent(v -> series.get(MetricKind.GPM).add(clock, v));
            p.getXpm().ifPresent(v -> series.get(MetricKind.XPM).add(clock, v));
            p.getLastHits().ifPresent(v -> series.get(MetricKind.LAST_HITS).add(clock, v));
            p.getDeaths().ifPresent(d -> {
                if (deathCount == null) {
                    // joined mid-match with deaths already on the board: count from the horn
                    if (d > 0) lastDeathClock = 0;
                } else if (d > deathCount) {
                    lastDeathClock = clock;
                }
                deathCount = d;
            });
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Performance lines for the given clock.
     *
     * @param now current game clock
     */
    public List<String> report(int now) {
        Map<MetricKind, Stats> stats = new EnumMap<>(MetricKind.class);
        Integer deaths;
        Integer lastDeath;
        lock.readLock().lock();
        try {
            for (Map.Entry<MetricKind, BoundedSeries> e : series.entrySet()) {
                BoundedSeries s = e.getValue();
                if (s.size() >= 2) {
                    stats.put(e.getKey(), new Stats(s.latest().getAsInt(), s.mean().getAsDouble()));
                }
            }
            deaths = deathCount;
            lastDeath = lastDeathClock;
        } finally {
            lock.readLock().unlock();
        }

        List<String> lines = new ArrayList<>();
        for (Map.Entry<MetricKind, Stats> e : stats.entrySet()) {
            MetricKind kind = e.getKey();
            Stats s = e.getValue();
            lines.add(kind.label() + ": " + s.latest + " (Avg: " + Math.round(s.mean) + ")");
            lines.add("  " + kind.label() + " " + Trend.classify(s.latest, s.mean).phrase());
            if (kind == MetricKind.LAST_HITS) {
                lastHitPacing(s.latest, now, lines);
            }
        }
        deathPacing(deaths, lastDeath, now, lines);
        return lines;
    }

    /** Trend of one series, empty with fewer than two samples. */
    public Optional<Trend> trendOf(MetricKind kind) {
        lock.readLock().lock();
        try {
            BoundedSeries s = series.get(kind);
            if (s.size() < 2) return Optional.empty();
            return Optional.of(Trend.classify(s.latest().getAsInt(), s.mean().getAsDouble()));
        } finally {
            lock.readLock().unlock();
        }
    }

    public int seriesLength(MetricKind kind) {
        lock.readLock().lock();
        try {
            return series.get(kind).size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public OptionalInt latest(MetricKind kind) {
        lock.readLock().lock();
        try {
            return series.get(kind).latest();
        } finally {
            lock.readLock().unlock();
        }
    }

    public OptionalDouble mean(MetricKind kind) {
        lock.readLock().lock();
        try {
            return series.get(kind).mean();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Last hits per minute, empty before the first full minute.
     *
     * @param lastHits current last-hit count
     * @param now      current game clock
     */
    public static OptionalDouble lastHitsPerMinute(int lastHits, int now) {
        int minutes = now / 60;
        if (minutes <= 0) return OptionalDouble.empty();
        return OptionalDouble.of((double) lastHits / minutes);
    }

    public void reset() {
        lock.writeLock().lock();
        try {
            series.values().forEach(BoundedSeries::clear);
            lastClock = Integer.MIN_VALUE;
            deathCount = null;
            lastDeathClock = null;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /* ----------------------------- internals ----------------------------- */

    private static void lastHitPacing(int lastHits, int now, List<String> lines) {
        OptionalDouble rate = lastHitsPerMinute(lastHits, now);
        if (rate.isEmpty()) return;
        double csPerMin = rate.getAsDouble();
        lines.add(String.format(Locale.ROOT, "  CS/min: %.1f", csPerMin));

        if (now / 60 < EARLY_PHASE_MINUTES) {
            if (csPerMin >= 7.0) {
                lines.add("    Excellent early game CS");
            } else if (csPerMin >= 5.0) {
                lines.add("    Good early game CS");
            } else if (csPerMin < 3.0) {
                lines.add("    Early game CS needs improvement");
            }
        } else {
            if (csPerMin >= 8.0) {
                lines.add("    Excellent CS");
            } else if (csPerMin >= 6.0) {
                lines.add("    Good CS");
            } else if (csPerMin < 4.0) {
                lines.add("    CS needs improvement");
            }
        }
    }

    private static void deathPacing(Integer deaths, Integer lastDeath, int now, List<String> lines) {
        if (deaths == null) return;
        if (deaths == 0) {
            lines.add("Deaths: 0 - Excellent survival!");
            return;
        }
        lines.add("Deaths: " + deaths);
        int minutes = now / 60;
        if (minutes > 0 && (double) deaths / minutes > DEATHS_PER_MINUTE_WARNING) {
            lines.add("  High death rate, play more cautiously");
        }
        if (lastDeath != null && now - lastDeath > SURVIVAL_STREAK_SECONDS) {
            lines.add("  Good survival streak: " + (now - lastDeath) / 60 + " minutes without dying");
        }
    }

    private record Stats(int latest, double mean) {}
}
