package infrastructure.impl;

import domain.model.Snapshot;
import domain.model.SnapshotPair;
import infrastructure.interfaces.ISnapshotStore;

import java.util.Objects;
import java.util.concurrent.locks.ReentrantReadWriteLock;

public class RotatingSnapshotStore implements ISnapshotStore {

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private SnapshotPair pair = SnapshotPair.EMPTY;

    @Override
    public SnapshotPair ingest(Snapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot");
        lock.writeLock().lock();
        try {
            pair = new SnapshotPair(snapshot, pair.current());
            return pair;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public SnapshotPair pair() {
        lock.readLock().lock();
        try {
            return pair;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void clear() {
        lock.writeLock().lock();
        try {
            pair = SnapshotPair.EMPTY;
        } finally {
            lock.writeLock().unlock();
        }
        System.out.println("[Store] cleared");
    }
}
