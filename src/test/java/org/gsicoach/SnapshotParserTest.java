package org.gsicoach;

import domain.model.MarkerKind;
import domain.model.Position;
import domain.model.Snapshot;
import domain.model.VisibleEntity;
import infrastructure.gsi.SnapshotParser;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SnapshotParserTest {

    private final SnapshotParser parser = new SnapshotParser();

    private static final String FULL = "{"
            + "\"provider\":{\"name\":\"Dota 2\",\"appid\":570},"
            + "\"map\":{\"matchid\":\"7001\",\"game_time\":754,\"clock_time\":694,\"game_state\":\"DOTA_GAMERULES_STATE_GAME_IN_PROGRESS\"},"
            + "\"player\":{\"team_name\":\"radiant\",\"gold\":1234,\"gpm\":456,\"xpm\":512,\"last_hits\":80,"
            + "\"deaths\":2,\"net_worth\":9000,\"kill_list\":{\"victimid_5\":2}},"
            + "\"hero\":{\"name\":\"npc_dota_hero_axe\",\"level\":12,\"alive\":true,\"health_percent\":77,"
            + "\"mana_percent\":40,\"buyback_cost\":900,\"xpos\":-1200,\"ypos\":300},"
            + "\"abilities\":{\"ability3\":{\"name\":\"axe_culling_blade\",\"level\":2,\"can_cast\":true,\"passive\":false,\"ultimate\":true}},"
            + "\"minimap\":{"
            + "  \"o1\":{\"image\":\"minimap_enemyicon\",\"name\":\"npc_dota_hero_lina\",\"team\":3,\"xpos\":100,\"ypos\":-50},"
            + "  \"o2\":{\"image\":\"minimap_creep\",\"unitname\":\"npc_dota_creep_badguys_melee\",\"team\":3,\"xpos\":1,\"ypos\":2},"
            + "  \"o3\":{\"image\":\"minimap_enemyicon\",\"name\":\"npc_dota_hero_zeus\",\"team\":3}"
            + "},"
            + "\"buildings\":{\"radiant\":{\"dota_goodguys_tower1_top\":{\"health\":900,\"max_health\":1800}}}"
            + "}";

    @Test
    void parsesKnownBlocks() {
        Snapshot s = parser.parse(FULL);

        assertEquals(754, s.getGameClock());
        assertEquals("7001", s.getMatchId().orElseThrow());
        assertEquals(456, s.getPlayer().orElseThrow().getGpm().orElseThrow());
        assertEquals(2, s.getPlayer().orElseThrow().getKillList().orElseThrow().get("victimid_5"));
        assertEquals(new Position(-1200, 300), s.heroPosition().orElseThrow());
        assertEquals(77, s.getHero().orElseThrow().getHealthPercent().orElseThrow());
        assertTrue(s.getAbilities().get("ability3").isUltimate());
        assertEquals(50, s.getBuildings().get("radiant").get("dota_goodguys_tower1_top").healthPercent());
        assertEquals(3, s.enemyTeamId());
    }

    @Test
    void minimapMarkers() {
        Snapshot s = parser.parse(FULL);

        // o3 has no coordinates
        assertEquals(2, s.getMinimap().size());
        VisibleEntity lina = s.getMinimap().get("o1");
        assertEquals(MarkerKind.ENEMY_HERO_ICON, lina.getKind());
        assertTrue(lina.isHostileHeroOf(3));
        VisibleEntity creep = s.getMinimap().get("o2");
        assertEquals(MarkerKind.OTHER, creep.getKind());
        assertEquals("npc_dota_creep_badguys_melee", creep.getName().orElseThrow());
    }

    @Test
    void missingFieldsStayAbsent() {
        Snapshot s = parser.parse("{\"player\":{\"gold\":10}}");
        assertEquals(0, s.getGameClock());
        assertTrue(s.getMatchId().isEmpty());
        assertTrue(s.getHero().isEmpty());
        assertTrue(s.getPlayer().orElseThrow().getGpm().isEmpty());
        assertTrue(s.getPlayer().orElseThrow().getKillList().isEmpty());
        assertTrue(s.getMinimap().isEmpty());
    }

    @Test
    void malformedBodiesRejected() {
        assertThrows(IllegalArgumentException.class, () -> parser.parse(""));
        assertThrows(IllegalArgumentException.class, () -> parser.parse("   "));
        assertThrows(IllegalArgumentException.class, () -> parser.parse("{\"map\":"));
        assertThrows(IllegalArgumentException.class, () -> parser.parse("[1,2,3]"));
        assertThrows(IllegalArgumentException.class, () -> parser.parse("{\"map\":{\"game_time\":\"soon\"}}"));
    }
}
