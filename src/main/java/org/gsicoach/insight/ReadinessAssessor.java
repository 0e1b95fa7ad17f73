package org.gsicoach.insight;

import domain.model.AbilityState;
import domain.model.HeroState;
import domain.model.Snapshot;

import java.util.Collection;
import java.util.Optional;

/**
 * Integer readiness score from the local hero's health, mana and ability state.
 * Unknown health or mana contributes nothing.
 */
public final class ReadinessAssessor {

    private ReadinessAssessor() {}

    public static int score(Snapshot snapshot) {
        int score = 0;
        Optional<HeroState> hero = snapshot.getHero();
        if (hero.isPresent()) {
            Optional<Integer> health = hero.get().getHealthPercent();
            if (health.isPresent()) {
                score += health.get() > 80 ? 2 : health.get() > 50 ? 1 : -1;
            }
            Optional<Integer> mana = hero.get().getManaPercent();
            if (mana.isPresent()) {
                score += mana.get() > 70 ? 2 : mana.get() > 40 ? 1 : -1;
            }
        }

        Collection<AbilityState> abilities = snapshot.getAbilities().values();
        if (!abilities.isEmpty()) {
            boolean ultimateReady = abilities.stream()
                    .anyMatch(a -> a.isUltimate() && a.canCast());
            if (ultimateReady) {
                score += 2;
            }
            boolean activesReady = abilities.stream()
                    .filter(a -> !a.isPassive())
                    .allMatch(AbilityState::canCast);
            if (activesReady) {
                score += 1;
            }
        }
        return score;
    }

    public static ReadinessTier assess(Snapshot snapshot) {
        return ReadinessTier.of(score(snapshot));
    }
}
