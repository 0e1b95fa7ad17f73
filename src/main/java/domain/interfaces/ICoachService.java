package domain.interfaces;

import domain.model.Snapshot;
import org.gsicoach.engagement.EngagementStatus;
import org.gsicoach.insight.InsightReport;
import org.gsicoach.tracking.MovementDescription;
import org.gsicoach.tracking.Prediction;

import java.util.List;
import java.util.Optional;

public interface ICoachService {
    boolean ingest(Snapshot snapshot);          // false when dropped as stale
    Optional<Snapshot> latest();                // empty until the first snapshot arrives

    // queries are evaluated at the latest snapshot's game clock
    List<MovementDescription> describeRecent();
    List<Prediction> predict();
    EngagementStatus engagement();
    List<String> metrics();
    List<String> insights();

    // clock, engagement and lines from one consistent read; empty until the first snapshot
    Optional<InsightReport> report();

    long ingestedCount();
}
