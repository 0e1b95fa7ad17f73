package org.gsicoach.insight;

import domain.model.HeroState;
import domain.model.PlayerState;
import domain.model.Position;
import domain.model.Snapshot;
import org.gsicoach.tracking.MovementDescription;
import org.gsicoach.tracking.Prediction;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Turns derived state into an ordered list of advisory strings: engagement,
 * enemy tracking and predictions, performance metrics, then a phase block.
 * Stateless; safe to call from any thread.
 */
public final class InsightCompositor {

    /** Predicted or recent enemies closer than this to the local hero trigger a warning. */
    public static final double PROXIMITY_WARNING = 2000.0;
    static final int RECENT_ENEMY_SECONDS = 30;

    private InsightCompositor() {}

    public static List<String> compose(InsightInputs in) {
        List<String> out = new ArrayList<>();
        Snapshot snapshot = in.snapshot();
        Optional<Position> me = snapshot.heroPosition();

        in.engagement().advisory().ifPresent(out::add);

        if (!in.recent().isEmpty()) {
            out.add("Enemy Movement Patterns:");
            for (MovementDescription d : in.recent()) {
                out.add("  " + d.describe());
                d.movementLine().ifPresent(line -> out.add("    " + line));
                me.ifPresent(p -> out.add("    " + distanceBand(p.distanceTo(d.lastPosition()))));
                out.add("    Times spotted: " + d.timesSpotted());
            }
        }
        if (!in.predictions().isEmpty()) {
            out.add("Enemy Movement Predictions:");
            for (Prediction p : in.predictions()) {
                out.add("  " + p.describe());
                if (me.isPresent() && me.get().distanceTo(p.position()) < PROXIMITY_WARNING) {
                    out.add("    WARNING: This enemy may be very close to you!");
                }
            }
        }

        if (!in.metrics().isEmpty()) {
            out.add("Hero Performance Metrics:");
            for (String line : in.metrics()) {
                out.add("  " + line);
            }
        }

        phaseBlock(in, out);
        return out;
    }

    static String distanceBand(double distance) {
        long units = Math.round(distance);
        if (distance < 1000.0) return "Distance from you: VERY CLOSE! (" + units + " units)";
        if (distance < 2000.0) return "Distance from you: Nearby (" + units + " units)";
        if (distance < 4000.0) return "Distance from you: Medium distance (" + units + " units)";
        return "Distance from you: Far away (" + units + " units)";
    }

    /* ---------------------------- phase rules ---------------------------- */

    private static void phaseBlock(InsightInputs in, List<String> out) {
        Snapshot snapshot = in.snapshot();
        int clock = snapshot.getGameClock();
        GamePhase phase = GamePhase.at(clock);
        out.add(phase.heading());
        switch (phase) {
            case EARLY:
                early(snapshot, out);
                break;
            case MID:
                mid(in, out);
                break;
            default:
                late(snapshot, out);
                break;
        }
        MapControl.analyze(snapshot, out);
        BuildingStatus.analyze(snapshot, out);
    }

    private static void early(Snapshot snapshot, List<String> out) {
        int clock = snapshot.getGameClock();
        int minutes = clock / 60;
        int seconds = clock % 60;

        snapshot.getPlayer().flatMap(PlayerState::getLastHits).ifPresent(lastHits -> {
            int expected = minutes * 10;
            if (lastHits < expected / 2) {
                out.add("  Your last hits are low (" + lastHits + "). Focus more on last hitting.");
            } else if (lastHits >= expected) {
                out.add("  Good job on last hitting! You have " + lastHits + " CS.");
            }
        });

        if (seconds >= 45 && seconds <= 48) {
            out.add("  Stack camps now! Pull at X:53.");
        }
        if (minutes > 0 && minutes % 2 == 0 && seconds >= 55) {
            out.add("  Water runes spawning in a few seconds!");
        }
    }

    private static void mid(InsightInputs in, List<String> out) {
        Snapshot snapshot = in.snapshot();
        Optional<PlayerState> player = snapshot.getPlayer();

        player.flatMap(PlayerState::getGold).ifPresent(gold -> suggestItems(gold, out));

        snapshot.heroPosition().ifPresent(me -> {
            for (MovementDescription d : in.recent()) {
                if (d.secondsAgo() < RECENT_ENEMY_SECONDS
                        && me.distanceTo(d.lastPosition()) < PROXIMITY_WARNING) {
                    out.add("  " + d.name() + " was recently spotted nearby - be careful!");
                }
            }
        });

        out.add("  Roshan is available. Consider checking/taking with team coordination.");

        player.flatMap(PlayerState::getNetWorth).ifPresent(netWorth ->
                ItemTimingBenchmarks.analyze(snapshot.getGameClock() / 60, netWorth, out));
    }

    private static void late(Snapshot snapshot, List<String> out) {
        Optional<Integer> gold = snapshot.getPlayer().flatMap(PlayerState::getGold);
        Optional<Integer> buyback = snapshot.getHero().flatMap(HeroState::getBuybackCost);
        if (gold.isPresent() && buyback.isPresent()) {
            if (gold.get() < buyback.get()) {
                out.add("  You don't have buyback gold! Need " + (buyback.get() - gold.get()) + " more gold.");
            } else {
                out.add("  You have buyback available (" + buyback.get() + " gold).");
            }
        }

        int score = ReadinessAssessor.score(snapshot);
        out.add("  Team fight readiness: " + ReadinessTier.of(score).advice() + " (score " + score + ")");

        snapshot.getPlayer().flatMap(PlayerState::getNetWorth).ifPresent(netWorth ->
                ItemTimingBenchmarks.analyze(snapshot.getGameClock() / 60, netWorth, out));
    }

    static void suggestItems(int gold, List<String> out) {
        if (gold >= 4000) {
            out.add("  You have sufficient gold for major items (BKB, Blink, etc.)");
        } else if (gold >= 2000) {
            out.add("  You have gold for mid-tier items (Force Staff, Eul's, etc.)");
        } else if (gold >= 1000) {
            out.add("  Consider purchasing support/utility items");
        }
    }
}
