package org.gsicoach.insight;

import domain.model.Snapshot;
import org.gsicoach.engagement.EngagementStatus;
import org.gsicoach.tracking.MovementDescription;
import org.gsicoach.tracking.Prediction;

import java.util.List;
import java.util.Objects;

/**
 * Everything the compositor reads, captured by value at one query.
 *
 * @param snapshot    current snapshot
 * @param engagement  engagement status at the snapshot's clock
 * @param recent      recently seen enemies, most recent first
 * @param predictions extrapolated enemy positions
 * @param metrics     performance lines from the metric sampler
 */
public record InsightInputs(Snapshot snapshot,
                            EngagementStatus engagement,
                            List<MovementDescription> recent,
                            List<Prediction> predictions,
                            List<String> metrics) {

    public InsightInputs {
        Objects.requireNonNull(snapshot, "snapshot");
        Objects.requireNonNull(engagement, "engagement");
        recent = List.copyOf(recent);
        predictions = List.copyOf(predictions);
        metrics = List.copyOf(metrics);
    }
}
