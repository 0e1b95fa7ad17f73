package infrastructure.interfaces;

import domain.model.Snapshot;
import domain.model.SnapshotPair;

public interface ISnapshotStore {
    SnapshotPair ingest(Snapshot snapshot);   // rotates current into previous, never fails
    SnapshotPair pair();                      // consistent (current, previous) from one ingest
    void clear();
}
