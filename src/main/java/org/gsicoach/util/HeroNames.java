package org.gsicoach.util;

import java.util.Locale;

/** Converts client unit names into display names. */
public final class HeroNames {

    private static final String HERO_PREFIX = "npc_dota_hero_";
    private static final String VICTIM_PREFIX = "victimid_";

    private HeroNames() {}

    /** {@code npc_dota_hero_bounty_hunter} becomes {@code Bounty Hunter}. */
    public static String display(String unitName) {
        String bare = unitName.replace(HERO_PREFIX, "");
        StringBuilder out = new StringBuilder(bare.length());
        for (String word : bare.split("_")) {
            if (word.isEmpty()) continue;
            if (out.length() > 0) out.append(' ');
            out.append(word.substring(0, 1).toUpperCase(Locale.ROOT)).append(word.substring(1));
        }
        return out.toString();
    }

    /**
     * Name for an elimination-counter key. The client only gives a slot id
     * ({@code victimid_3}), so the result is {@code Enemy3}.
     */
    public static String victim(String victimKey) {
        return "Enemy" + victimKey.replace(VICTIM_PREFIX, "");
    }
}
