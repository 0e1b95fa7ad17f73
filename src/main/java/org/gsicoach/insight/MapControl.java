package org.gsicoach.insight;

import domain.model.BuildingState;
import domain.model.Snapshot;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/** Tower-count comparison between the two teams. */
final class MapControl {

    private MapControl() {}

    static int towers(Snapshot snapshot, String team) {
        Map<String, BuildingState> buildings = snapshot.getBuildings().get(team);
        if (buildings == null) return 0;
        return (int) buildings.keySet().stream().filter(n -> n.contains("tower")).count();
    }

    static void analyze(Snapshot snapshot, List<String> out) {
        if (snapshot.getBuildings().isEmpty()) return;

        String team = snapshot.getPlayer()
                .flatMap(p -> p.getTeamName())
                .map(t -> t.toLowerCase(Locale.ROOT))
                .orElse("unknown");
        boolean radiant = "radiant".equals(team);
        int ours = towers(snapshot, radiant ? "radiant" : "dire");
        int theirs = towers(snapshot, radiant ? "dire" : "radiant");
        int diff = ours - theirs;

        out.add("  Your team has " + ours + " towers, enemy has " + theirs + " towers");
        if (diff >= 3) {
            out.add("  Strong map control advantage. Consider aggressive warding.");
        } else if (diff >= 1) {
            out.add("  Slight map control advantage. Maintain pressure.");
        } else if (diff == 0) {
            out.add("  Even map control. Focus on objectives.");
        } else if (diff >= -2) {
            out.add("  Losing map control. Defend remaining towers.");
        } else {
            out.add("  Significant map control disadvantage. Play defensively.");
        }
    }
}
