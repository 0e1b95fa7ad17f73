package org.gsicoach.insight;

import java.util.List;
import java.util.Optional;

/** Net worth expected of a core hero at fixed minutes. */
final class ItemTimingBenchmarks {

    record Benchmark(int minute, int netWorth, String items) {}

    static final int ON_TRACK_BAND = 1000;

    static final List<Benchmark> CORE = List.of(
            new Benchmark(10, 4000, "Power Treads + Wraith Bands"),
            new Benchmark(15, 7000, "Core farming item (Battlefury/Maelstrom)"),
            new Benchmark(20, 11000, "Second major item (BKB/Desolator)"),
            new Benchmark(30, 18000, "Third major item (Satanic/Butterfly)"));

    private ItemTimingBenchmarks() {}

    /** Latest benchmark already due at {@code minutes}. */
    static Optional<Benchmark> current(int minutes) {
        Benchmark found = null;
        for (Benchmark b : CORE) {
            if (b.minute() <= minutes) found = b;
        }
        return Optional.ofNullable(found);
    }

    /** First benchmark still ahead of {@code minutes}. */
    static Optional<Benchmark> next(int minutes) {
        return CORE.stream().filter(b -> b.minute() > minutes).findFirst();
    }

    static void analyze(int minutes, int netWorth, List<String> out) {
        Optional<Benchmark> current = current(minutes);
        if (current.isEmpty()) {
            out.add("  No item benchmarks available for current game time");
            return;
        }
        Benchmark b = current.get();
        int diff = netWorth - b.netWorth();
        if (diff >= ON_TRACK_BAND) {
            out.add("  You're ahead of item timings! +" + diff + " gold");
        } else if (diff >= -ON_TRACK_BAND) {
            out.add("  You're on track with item timings");
        } else {
            out.add("  You're behind on item timings: " + diff + " gold");
        }
        out.add("  Current benchmark (" + b.minute() + " min): " + b.items());

        next(minutes).ifPresent(n -> {
            int left = n.minute() - minutes;
            int needed = n.netWorth() - netWorth;
            out.add("  Next goal (" + n.minute() + " min): " + n.items());
            // left is always positive here; next() only returns future benchmarks
            out.add("  Need " + needed + " gold in " + left + " minutes (" + needed / left + " GPM)");
        });
    }
}
