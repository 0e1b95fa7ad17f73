package org.gsicoach.insight;

import org.gsicoach.engagement.EngagementStatus;

import java.util.List;

/**
 * Advisory lines together with the clock and engagement status they were composed from,
 * all taken from the same snapshot.
 */
public record InsightReport(int gameClock, EngagementStatus engagement, List<String> lines) {

    public InsightReport {
        lines = List.copyOf(lines);
    }
}
