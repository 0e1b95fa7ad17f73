package org.gsicoach.engagement;

import domain.model.HeroState;
import domain.model.KillEvent;
import domain.model.PlayerState;
import domain.model.Snapshot;
import org.gsicoach.util.FixedRecencyWindow;
import org.gsicoach.util.HeroNames;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Derives death and elimination events by diffing consecutive snapshots and
 * classifies bursts of them into team fights.
 * <p>
 * State machine (initially {@link EngagementState#CALM}):
 * <ul>
 *   <li>CALM to ENGAGED: last event less than 15s ago and at least 3 events in the trailing 30s.</li>
 *   <li>ENGAGED to CALM: 15s or more since the last event.</li>
 * </ul>
 * An elimination counter that grows by N between two snapshots yields N events
 * stamped with the same clock.
 */
public final class EngagementDetector {

    public static final int ENGAGE_THRESHOLD = 3;
    public static final int SKIRMISH_THRESHOLD = 2;

    private static final String UNKNOWN_HERO = "You";

    private final FixedRecencyWindow quietGap = FixedRecencyWindow.ofSeconds(15);
    private final FixedRecencyWindow fightWindow = FixedRecencyWindow.ofSeconds(30);
    private final FixedRecencyWindow skirmishWindow = FixedRecencyWindow.ofSeconds(60);

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final List<KillEvent> deaths = new ArrayList<>();
    private final Map<String, List<KillEvent>> eliminations = new LinkedHashMap<>();
    private Integer lastEventClock;   // null until the first event
    private EngagementState state = EngagementState.CALM;
    private int engagedSince;

    /**
     * Diffs {@code current} against {@code previous} and advances the state machine
     * to the current snapshot's clock.
     *
     * @param current  newest snapshot
     * @param previous snapshot before it; null on the first ingestion
     * @return the events emitted by this step, in detection order
     */
    public List<KillEvent> update(Snapshot current, Snapshot previous) {
        int clock = current.getGameClock();
        List<KillEvent> emitted = new ArrayList<>();
        if (previous != null) {
            detectDeath(current, previous, clock, emitted);
            detectEliminations(current, previous, clock, emitted);
        }

        lock.writeLock().lock();
        try {
            for (KillEvent e : emitted) {
                if (e.kind() == KillEvent.Kind.DEATH) {
                    deaths.add(e);
                } else {
                    eliminations.computeIfAbsent(e.victim(), k -> new ArrayList<>()).add(e);
                }
                lastEventClock = e.gameClock();
            }
            advance(clock);
            return emitted;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Engagement advisory for the given clock.
     *
     * @param now current game clock
     */
    public EngagementStatus statusAt(int now) {
        lock.readLock().lock();
        try {
            if (state == EngagementState.ENGAGED) {
                return new EngagementStatus(EngagementStatus.Level.ENGAGED,
                        Math.max(0, now - engagedSince), countInWindow(fightWindow, now));
            }
            int recent = countInWindow(skirmishWindow, now);
            if (recent >= SKIRMISH_THRESHOLD) {
                return new EngagementStatus(EngagementStatus.Level.SKIRMISH, 0, recent);
            }
            return EngagementStatus.quiet(recent);
        } finally {
            lock.readLock().unlock();
        }
    }

    public EngagementState state() {
        lock.readLock().lock();
        try {
            return state;
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Clock at which the current engagement started, empty while calm. */
    public Optional<Integer> engagedSince() {
        lock.readLock().lock();
        try {
            return state == EngagementState.ENGAGED ? Optional.of(engagedSince) : Optional.empty();
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<KillEvent> deaths() {
        lock.readLock().lock();
        try {
            return List.copyOf(deaths);
        } finally {
            lock.readLock().unlock();
        }
    }

    /** All elimination events, grouped by victim in first-seen order. */
    public List<KillEvent> eliminations() {
        lock.readLock().lock();
        try {
            List<KillEvent> out = new ArrayList<>();
            eliminations.values().forEach(out::addAll);
            return out;
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<KillEvent> eliminationsOf(String victim) {
        lock.readLock().lock();
        try {
            return List.copyOf(eliminations.getOrDefault(victim, Collections.emptyList()));
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Total events emitted so far (deaths plus eliminations). */
    public int eventCount() {
        lock.readLock().lock();
        try {
            int n = deaths.size();
            for (List<KillEvent> list : eliminations.values()) n += list.size();
            return n;
        } finally {
            lock.readLock().unlock();
        }
    }

    public void reset() {
        lock.writeLock().lock();
        try {
            deaths.clear();
            eliminations.clear();
            lastEventClock = null;
            state = EngagementState.CALM;
            engagedSince = 0;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /* ----------------------------- internals ----------------------------- */

    private static void detectDeath(Snapshot current, Snapshot previous, int clock, List<KillEvent> out) {
        Optional<HeroState> now = current.getHero();
        Optional<HeroState> before = previous.getHero();
        if (now.isEmpty() || before.isEmpty()) return;

        // missing flag counts as alive
        boolean wasAlive = before.get().getAlive().orElse(true);
        boolean isAlive = now.get().getAlive().orElse(true);
        if (wasAlive && !isAlive) {
            String hero = heroName(current);
            out.add(new KillEvent(clock, KillEvent.Kind.DEATH, hero, hero));
        }
    }

    private static void detectEliminations(Snapshot current, Snapshot previous, int clock, List<KillEvent> out) {
        Optional<Map<String, Integer>> now = current.getPlayer().flatMap(PlayerState::getKillList);
        Optional<Map<String, Integer>> before = previous.getPlayer().flatMap(PlayerState::getKillList);
        if (now.isEmpty() || before.isEmpty()) return;

        String subject = heroName(current);
        for (Map.Entry<String, Integer> e : now.get().entrySet()) {
            if (e.getKey() == null || e.getValue() == null) continue;
            Integer last = before.get().get(e.getKey());
            int delta = e.getValue() - (last == null ? 0 : last);
            String victim = HeroNames.victim(e.getKey());
            for (int i = 0; i < delta; i++) {
                out.add(new KillEvent(clock, KillEvent.Kind.ELIMINATION, subject, victim));
            }
        }
    }

    private static String heroName(Snapshot snapshot) {
        return snapshot.getHero()
                .flatMap(HeroState::getName)
                .map(HeroNames::display)
                .orElse(UNKNOWN_HERO);
    }

    /** Caller holds the write lock. */
    private void advance(int now) {
        if (state == EngagementState.CALM) {
            if (lastEventClock != null
                    && !quietGap.hasElapsed(lastEventClock, now)
                    && countInWindow(fightWindow, now) >= ENGAGE_THRESHOLD) {
                state = EngagementState.ENGAGED;
                engagedSince = now;
            }
        } else if (lastEventClock == null || quietGap.hasElapsed(lastEventClock, now)) {
            state = EngagementState.CALM;
        }
    }

    /** Caller holds a lock. */
    private int countInWindow(FixedRecencyWindow window, int now) {
        int start = window.startAt(now);
        int n = 0;
        for (KillEvent e : deaths) {
            if (e.gameClock() >= start) n++;
        }
        for (List<KillEvent> list : eliminations.values()) {
            for (KillEvent e : list) {
                if (e.gameClock() >= start) n++;
            }
        }
        return n;
    }
}
