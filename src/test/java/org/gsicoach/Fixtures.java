package org.gsicoach;

import domain.model.HeroState;
import domain.model.MarkerKind;
import domain.model.PlayerState;
import domain.model.Position;
import domain.model.Snapshot;
import domain.model.VisibleEntity;

import java.util.Map;

/** Snapshot builders shared by the tests. */
final class Fixtures {
    private Fixtures() {}

    static final int RADIANT = 2;
    static final int DIRE = 3;

    static VisibleEntity enemyHero(String unit, int x, int y) {
        return new VisibleEntity(unit, DIRE, new Position(x, y), MarkerKind.ENEMY_HERO_ICON);
    }

    /** Radiant player at the given clock with one dire hero on the minimap. */
    static Snapshot sighting(int clock, String unit, int x, int y) {
        return Snapshot.builder()
                .gameClock(clock)
                .player(PlayerState.builder().teamName("radiant").build())
                .marker("o1", enemyHero(unit, x, y))
                .build();
    }

    static Snapshot withPlayer(int clock, PlayerState player) {
        return Snapshot.builder().gameClock(clock).player(player).build();
    }

    static Snapshot alive(int clock, boolean alive) {
        return Snapshot.builder()
                .gameClock(clock)
                .hero(HeroState.builder().name("npc_dota_hero_axe").alive(alive).build())
                .build();
    }

    static Snapshot kills(int clock, Map<String, Integer> killList) {
        return Snapshot.builder()
                .gameClock(clock)
                .player(PlayerState.builder().teamName("radiant").killList(killList).build())
                .hero(HeroState.builder().name("npc_dota_hero_axe").alive(true).build())
                .build();
    }

    static Snapshot metrics(int clock, int gpm, int xpm, int lastHits) {
        return withPlayer(clock, PlayerState.builder().gpm(gpm).xpm(xpm).lastHits(lastHits).build());
    }
}
