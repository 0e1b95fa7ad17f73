package org.gsicoach;

import org.gsicoach.util.GameTime;
import org.gsicoach.util.HeroNames;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class GameTimeAndNamesTest {

    @Test
    void formatsMinutesAndSeconds() {
        assertEquals("0:00", GameTime.format(0));
        assertEquals("1:05", GameTime.format(65));
        assertEquals("25:00", GameTime.format(1500));
        assertEquals("-1:30", GameTime.format(-90));
        assertEquals("Unknown", GameTime.format(Optional.empty()));
        assertEquals(0, GameTime.minutes(-90));
        assertEquals(10, GameTime.minutes(659));
    }

    @Test
    void heroDisplayNames() {
        assertEquals("Axe", HeroNames.display("npc_dota_hero_axe"));
        assertEquals("Bounty Hunter", HeroNames.display("npc_dota_hero_bounty_hunter"));
        assertEquals("Enemy3", HeroNames.victim("victimid_3"));
    }
}
