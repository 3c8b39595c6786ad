package app.lessico.transfer.reconcile;

import app.lessico.transfer.store.RecordCollection;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;

/**
 * Original id to imported id, per collection, for one tenant.
 */
public class RemapTable {

    private final Map<RecordCollection, Map<String, String>> remaps = new EnumMap<>(RecordCollection.class);

    public String lookup(RecordCollection collection, String originalId) {
        if (originalId == null) {
            return null;
        }
        return remaps.getOrDefault(collection, Map.of()).get(originalId);
    }

    public void register(RecordCollection collection, String originalId, String targetId) {
        remaps.computeIfAbsent(collection, ignored -> new HashMap<>()).put(originalId, targetId);
    }

    public int size() {
        return remaps.values().stream().mapToInt(Map::size).sum();
    }
}
