package infrastructure.gsi;

import com.google.gson.FieldNamingPolicy;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import domain.model.AbilityState;
import domain.model.BuildingState;
import domain.model.HeroState;
import domain.model.MarkerKind;
import domain.model.PlayerState;
import domain.model.Position;
import domain.model.Snapshot;
import domain.model.VisibleEntity;

import java.util.Map;

/**
 * Turns a raw GSI JSON body into a {@link Snapshot}.
 * <p>
 * Malformed bodies are rejected with {@link IllegalArgumentException}; absent
 * blocks and fields are carried over as absent, never defaulted, except the game
 * clock which falls back to 0. Minimap markers without coordinates are skipped.
 */
public final class SnapshotParser {

    private static final Gson gson = new GsonBuilder()
            .setFieldNamingPolicy(FieldNamingPolicy.LOWER_CASE_WITH_UNDERSCORES)
            .create();

    public Snapshot parse(String json) {
        if (json == null || json.isBlank()) {
            throw new IllegalArgumentException("empty payload");
        }
        JsonElement root;
        try {
            root = JsonParser.parseString(json);
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("invalid json: " + e.getMessage(), e);
        }
        if (!root.isJsonObject()) {
            throw new IllegalArgumentException("not a JSON object");
        }

        GsiPayload payload;
        try {
            payload = gson.fromJson(root, GsiPayload.class);
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("unexpected field type: " + e.getMessage(), e);
        }
        return toSnapshot(payload);
    }

    static Snapshot toSnapshot(GsiPayload p) {
        Snapshot.Builder b = Snapshot.builder();

        if (p.map != null) {
            b.gameClock(p.map.gameTime == null ? 0 : p.map.gameTime)
                    .matchId(p.map.matchid);
        }
        if (p.player != null) {
            b.player(PlayerState.builder()
                    .teamName(p.player.teamName)
                    .gold(p.player.gold)
                    .gpm(p.player.gpm)
                    .xpm(p.player.xpm)
                    .lastHits(p.player.lastHits)
                    .deaths(p.player.deaths)
                    .netWorth(p.player.netWorth)
                    .killList(p.player.killList)
                    .build());
        }
        if (p.hero != null) {
            b.hero(HeroState.builder()
                    .name(p.hero.name)
                    .alive(p.hero.alive)
                    .healthPercent(p.hero.healthPercent)
                    .manaPercent(p.hero.manaPercent)
                    .buybackCost(p.hero.buybackCost)
                    .position(p.hero.xpos, p.hero.ypos)
                    .build());
        }
        if (p.abilities != null) {
            for (Map.Entry<String, GsiPayload.AbilityBlock> e : p.abilities.entrySet()) {
                GsiPayload.AbilityBlock a = e.getValue();
                if (a == null) continue;
                b.ability(e.getKey(), new AbilityState(a.name, a.level == null ? 0 : a.level,
                        a.canCast, a.passive, a.ultimate));
            }
        }
        if (p.minimap != null) {
            for (Map.Entry<String, GsiPayload.MinimapBlock> e : p.minimap.entrySet()) {
                GsiPayload.MinimapBlock m = e.getValue();
                if (m == null || m.xpos == null || m.ypos == null) continue;
                String name = m.name != null ? m.name : m.unitname;
                b.marker(e.getKey(), new VisibleEntity(name,
                        m.team == null ? 0 : m.team,
                        new Position(m.xpos, m.ypos),
                        MarkerKind.fromImageTag(m.image)));
            }
        }
        if (p.buildings != null) {
            p.buildings.forEach((team, byName) -> {
                if (byName == null) return;
                byName.forEach((name, bld) -> {
                    if (bld == null || bld.health == null || bld.maxHealth == null) return;
                    b.building(team, name, new BuildingState(bld.health, bld.maxHealth));
                });
            });
        }
        return b.build();
    }
}
