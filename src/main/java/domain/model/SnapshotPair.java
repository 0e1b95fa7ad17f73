package domain.model;

import java.util.Optional;

/**
 * The two most recent snapshots, produced together by a single ingestion step.
 * {@code current} is null only before the first ingestion.
 */
public record SnapshotPair(Snapshot current, Snapshot previous) {

    public static final SnapshotPair EMPTY = new SnapshotPair(null, null);

    public Optional<Snapshot> currentSnapshot() { return Optional.ofNullable(current); }
    public Optional<Snapshot> previousSnapshot() { return Optional.ofNullable(previous); }
}
