package org.gsicoach.insight;

import domain.model.BuildingState;
import domain.model.PlayerState;
import domain.model.Snapshot;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/** Per-building health for both teams, own team first, buildings by name. */
final class BuildingStatus {

    private BuildingStatus() {}

    static void analyze(Snapshot snapshot, List<String> out) {
        Map<String, Map<String, BuildingState>> buildings = snapshot.getBuildings();
        if (buildings.isEmpty()) return;

        boolean radiant = snapshot.getPlayer()
                .flatMap(PlayerState::getTeamName)
                .map(t -> "radiant".equals(t.toLowerCase(Locale.ROOT)))
                .orElse(false);
        String ours = radiant ? "radiant" : "dire";
        String theirs = radiant ? "dire" : "radiant";

        out.add("Building Status:");
        team("Your team", ours, buildings.get(ours), out);
        team("Enemy team", theirs, buildings.get(theirs), out);
    }

    /** {@code dota_goodguys_tower1_top} becomes {@code tower1 top}. */
    static String displayName(String building) {
        return building.replace("dota_goodguys_", "")
                .replace("dota_badguys_", "")
                .replace('_', ' ');
    }

    private static void team(String label, String team, Map<String, BuildingState> byName, List<String> out) {
        out.add("  " + label + " (" + team.toUpperCase(Locale.ROOT) + "):");
        if (byName == null || byName.isEmpty()) {
            out.add("    No building data available");
            return;
        }
        for (Map.Entry<String, BuildingState> e : new TreeMap<>(byName).entrySet()) {
            out.add("    " + displayName(e.getKey()) + ": " + e.getValue().healthPercent() + "%");
        }
    }
}
