package infrastructure.gsi;

import java.util.Map;

/**
 * Wire shape of a Game State Integration POST body, bound by Gson with
 * lower_case_with_underscores field naming. Only the blocks the coach reads are
 * declared; Gson skips everything else.
 */
final class GsiPayload {
    MapBlock map;
    PlayerBlock player;
    HeroBlock hero;
    Map<String, AbilityBlock> abilities;
    Map<String, MinimapBlock> minimap;
    Map<String, Map<String, BuildingBlock>> buildings;

    static final class MapBlock {
        String matchid;
        Integer gameTime;
    }

    static final class PlayerBlock {
        String teamName;
        Integer gold;
        Integer gpm;
        Integer xpm;
        Integer lastHits;
        Integer deaths;
        Integer netWorth;
        Map<String, Integer> killList;
    }

    static final class HeroBlock {
        String name;
        Boolean alive;
        Integer healthPercent;
        Integer manaPercent;
        Integer buybackCost;
        Integer xpos;
        Integer ypos;
    }

    static final class AbilityBlock {
        String name;
        Integer level;
        Boolean canCast;
        Boolean passive;
        Boolean ultimate;
    }

    static final class MinimapBlock {
        String image;
        String name;
        String unitname;
        Integer team;
        Integer xpos;
        Integer ypos;
    }

    static final class BuildingBlock {
        Integer health;
        Integer maxHealth;
    }
}
