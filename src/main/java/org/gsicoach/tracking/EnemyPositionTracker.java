package org.gsicoach.tracking;

import domain.model.Position;
import domain.model.Snapshot;
import domain.model.VisibleEntity;
import org.gsicoach.interfaces.RecencyWindow;
import org.gsicoach.util.FixedRecencyWindow;
import org.gsicoach.util.HeroNames;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Keeps a bounded position history for every opposing hero seen on the minimap
 * and answers "where was it" and "where is it probably now" queries.
 * <p>
 * <b>Notes:</b>
 * <ul>
 *   <li>Histories are capped at {@link #MAX_HISTORY} samples, oldest evicted first.</li>
 *   <li>A snapshot whose clock is not newer than the last processed one is ignored,
 *       so duplicated or replayed deliveries never change the histories.</li>
 *   <li>Writes take the write lock; queries copy the latest two samples under the
 *       read lock and do the arithmetic outside it.</li>
 * </ul>
 */
public final class EnemyPositionTracker {

    public static final int MAX_HISTORY = 100;

    private final RecencyWindow describeWindow;
    private final RecencyWindow predictWindow;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, Deque<PositionSample>> histories = new HashMap<>();
    private final Map<String, Integer> timesSpotted = new HashMap<>();
    private int lastClock = Integer.MIN_VALUE; // nothing processed yet

    public EnemyPositionTracker() {
        this(FixedRecencyWindow.ofSeconds(60), FixedRecencyWindow.ofSeconds(30));
    }

    public EnemyPositionTracker(RecencyWindow describeWindow, RecencyWindow predictWindow) {
        this.describeWindow = describeWindow;
        this.predictWindow = predictWindow;
    }

    /**
     * Records the positions of visible enemy heroes.
     *
     * @param snapshot latest snapshot
     * @return true if the snapshot was applied, false if it was stale or a duplicate
     */
    public boolean update(Snapshot snapshot) {
        int clock = snapshot.getGameClock();
        int enemyTeam = snapshot.enemyTeamId();

        // one sample per hero per snapshot even if the client repeats a marker
        Map<String, Position> seen = new LinkedHashMap<>();
        for (VisibleEntity marker : snapshot.getMinimap().values()) {
            if (!marker.isHostileHeroOf(enemyTeam)) continue;
            marker.getName().ifPresent(unit ->
                    seen.putIfAbsent(HeroNames.display(unit), marker.getPosition()));
        }

        lock.writeLock().lock();
        try {
            if (clock <= lastClock) {
                return false;
            }
            for (Map.Entry<String, Position> e : seen.entrySet()) {
                Deque<PositionSample> history =
                        histories.computeIfAbsent(e.getKey(), k -> new ArrayDeque<>());
                history.addLast(new PositionSample(clock, e.getValue()));
                while (history.size() > MAX_HISTORY) {
                    history.removeFirst();
                }
                timesSpotted.merge(e.getKey(), 1, Integer::sum);
            }
            lastClock = clock;
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Describes every hero seen within the last 60 game seconds, most recent first.
     *
     * @param now current game clock
     */
    public List<MovementDescription> describeRecent(int now) {
        List<MovementDescription> out = new ArrayList<>();
        for (Tail tail : tails()) {
            if (!describeWindow.contains(tail.latest.gameClock(), now)) continue;

            Direction heading = null;
            boolean moved = tail.previous != null;
            if (moved) {
                heading = Direction.of(
                        tail.latest.position().x() - tail.previous.position().x(),
                        tail.latest.position().y() - tail.previous.position().y());
            }
            out.add(new MovementDescription(tail.name,
                    now - tail.latest.gameClock(),
                    tail.latest.position(),
                    tail.latest.gameClock(),
                    tail.spotted,
                    heading,
                    moved));
        }
        out.sort(Comparator.comparingInt(MovementDescription::lastSeenAt).reversed()
                .thenComparing(MovementDescription::name));
        return out;
    }

    /**
     * Linear extrapolation from the two most recent samples of every hero seen
     * within the last 30 game seconds. Heroes whose two latest samples share a
     * clock are skipped.
     *
     * @param now current game clock
     */
    public List<Prediction> predict(int now) {
        List<Prediction> out = new ArrayList<>();
        for (Tail tail : tails()) {
            if (tail.previous == null) continue;
            PositionSample latest = tail.latest;
            PositionSample before = tail.previous;
            if (!predictWindow.contains(latest.gameClock(), now)) continue;

            int dt = latest.gameClock() - before.gameClock();
            if (dt <= 0) continue;

            double factor = (double) (now - latest.gameClock()) / dt;
            int dx = latest.position().x() - before.position().x();
            int dy = latest.position().y() - before.position().y();
            Position predicted = new Position(
                    latest.position().x() + (int) (dx * factor),
                    latest.position().y() + (int) (dy * factor));
            out.add(new Prediction(tail.name, predicted));
        }
        out.sort(Comparator.comparing(Prediction::name));
        return out;
    }

    /** Copy of the recorded history of one hero, oldest first; empty if never seen. */
    public List<PositionSample> historyOf(String name) {
        lock.readLock().lock();
        try {
            Deque<PositionSample> history = histories.get(name);
            return history == null ? List.of() : List.copyOf(history);
        } finally {
            lock.readLock().unlock();
        }
    }

    public Set<String> trackedNames() {
        lock.readLock().lock();
        try {
            return new TreeSet<>(histories.keySet());
        } finally {
            lock.readLock().unlock();
        }
    }

    public int lastProcessedClock() {
        lock.readLock().lock();
        try {
            return lastClock;
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Forgets every hero, e.g. when a new match starts. */
    public void reset() {
        lock.writeLock().lock();
        try {
            histories.clear();
            timesSpotted.clear();
            lastClock = Integer.MIN_VALUE;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /** Latest two samples of every hero, copied under the read lock. */
    private List<Tail> tails() {
        lock.readLock().lock();
        try {
            List<Tail> out = new ArrayList<>(histories.size());
            for (Map.Entry<String, Deque<PositionSample>> e : histories.entrySet()) {
                Deque<PositionSample> history = e.getValue();
                if (history.isEmpty()) continue;
                PositionSample previous = null;
                if (history.size() >= 2) {
                    var it = history.descendingIterator();
                    it.next();
                    previous = it.next();
                }
                out.add(new Tail(e.getKey(), history.peekLast(), previous,
                        timesSpotted.getOrDefault(e.getKey(), 0)));
            }
            return out;
        } finally {
            lock.readLock().unlock();
        }
    }

    private record Tail(String name, PositionSample latest, PositionSample previous, int spotted) {}
}
