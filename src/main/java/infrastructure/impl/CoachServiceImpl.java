package infrastructure.impl;

import domain.interfaces.ICoachService;
import domain.model.Snapshot;
import domain.model.SnapshotPair;
import infrastructure.interfaces.ISnapshotStore;
import org.gsicoach.engagement.EngagementDetector;
import org.gsicoach.engagement.EngagementStatus;
import org.gsicoach.insight.InsightCompositor;
import org.gsicoach.insight.InsightInputs;
import org.gsicoach.insight.InsightReport;
import org.gsicoach.metrics.MetricSampler;
import org.gsicoach.tracking.EnemyPositionTracker;
import org.gsicoach.tracking.MovementDescription;
import org.gsicoach.tracking.Prediction;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;

public class CoachServiceImpl implements ICoachService {

    private final ISnapshotStore store;
    private final EnemyPositionTracker tracker;
    private final EngagementDetector detector;
    private final MetricSampler sampler;

    // one ingestion step at a time; readers never see a half-applied step
    private final ReentrantReadWriteLock gate = new ReentrantReadWriteLock(true);

    private final AtomicLong ingested = new AtomicLong();
    private final AtomicLong dropped = new AtomicLong();

    public CoachServiceImpl() {
        this(new RotatingSnapshotStore(), new EnemyPositionTracker(), new EngagementDetector(), new MetricSampler());
    }

    public CoachServiceImpl(ISnapshotStore store,
                            EnemyPositionTracker tracker,
                            EngagementDetector detector,
                            MetricSampler sampler) {
        this.store = Objects.requireNonNull(store);
        this.tracker = Objects.requireNonNull(tracker);
        this.detector = Objects.requireNonNull(detector);
        this.sampler = Objects.requireNonNull(sampler);
    }

    @Override
    public boolean ingest(Snapshot snapshot) {
        if (snapshot == null) return false;

        gate.writeLock().lock();
        try {
            Snapshot current = store.pair().current();
            if (current != null && isNewMatch(current, snapshot)) {
                System.out.println("[Coach] match changed " + current.getMatchId().orElse("?")
                        + " -> " + snapshot.getMatchId().orElse("?") + ", resetting");
                resetAll();
                current = null;
            }
            // a repeated clock is dropped too; the next newer snapshot carries its counters
            if (current != null && snapshot.getGameClock() <= current.getGameClock()) {
                dropped.incrementAndGet();
                System.out.println("[Ingest] stale snapshot dropped: clock=" + snapshot.getGameClock()
                        + " <= current=" + current.getGameClock());
                return false;
            }

            SnapshotPair pair = store.ingest(snapshot);
            Snapshot now = pair.current();
            Snapshot before = pair.previous();

            // each component stays usable even if another one trips over odd data
            try {
                tracker.update(now);
            } catch (RuntimeException e) {
                System.err.println("[Coach] tracker update failed: " + e.getMessage());
            }
            try {
                detector.update(now, before);
            } catch (RuntimeException e) {
                System.err.println("[Coach] engagement update failed: " + e.getMessage());
            }
            try {
                sampler.update(now);
            } catch (RuntimeException e) {
                System.err.println("[Coach] metric update failed: " + e.getMessage());
            }
            ingested.incrementAndGet();
            return true;
        } finally {
            gate.writeLock().unlock();
        }
    }

    @Override
    public Optional<Snapshot> latest() {
        return store.pair().currentSnapshot();
    }

    @Override
    public List<MovementDescription> describeRecent() {
        return latest().map(s -> tracker.describeRecent(s.getGameClock())).orElse(List.of());
    }

    @Override
    public List<Prediction> predict() {
        return latest().map(s -> tracker.predict(s.getGameClock())).orElse(List.of());
    }

    @Override
    public EngagementStatus engagement() {
        return latest().map(s -> detector.statusAt(s.getGameClock())).orElse(EngagementStatus.quiet(0));
    }

    @Override
    public List<String> metrics() {
        return latest().map(s -> sampler.report(s.getGameClock())).orElse(List.of());
    }

    @Override
    public List<String> insights() {
        return report().map(InsightReport::lines).orElse(List.of());
    }

    @Override
    public Optional<InsightReport> report() {
        InsightInputs inputs;
        gate.readLock().lock();
        try {
            Snapshot snapshot = store.pair().current();
            if (snapshot == null) return Optional.empty();
            int clock = snapshot.getGameClock();
            inputs = new InsightInputs(snapshot,
                    detector.statusAt(clock),
                    tracker.describeRecent(clock),
                    tracker.predict(clock),
                    sampler.report(clock));
        } finally {
            gate.readLock().unlock();
        }
        return Optional.of(new InsightReport(inputs.snapshot().getGameClock(),
                inputs.engagement(), InsightCompositor.compose(inputs)));
    }

    @Override
    public long ingestedCount() {
        return ingested.get();
    }

    public long droppedCount() {
        return dropped.get();
    }

    public EnemyPositionTracker tracker() { return tracker; }
    public EngagementDetector detector() { return detector; }
    public MetricSampler sampler() { return sampler; }

    private static boolean isNewMatch(Snapshot current, Snapshot incoming) {
        Optional<String> was = current.getMatchId();
        Optional<String> now = incoming.getMatchId();
        return was.isPresent() && now.isPresent() && !was.get().equals(now.get());
    }

    /** Caller holds the write lock. */
    private void resetAll() {
        store.clear();
        tracker.reset();
        detector.reset();
        sampler.reset();
    }
}
