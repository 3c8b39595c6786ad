package app.lessico.transfer.reconcile;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Keys already seen in the running batch. One instance per batch.
 */
public class Deduplicator {

    private final Set<String> seen = new HashSet<>();

    public boolean shouldProcess(String key) {
        if (key == null) {
            return true;
        }
        return seen.add(key);
    }

    /**
     * A record with several identities is processed only if none of them was seen before;
     * all of them are claimed either way.
     */
    public boolean shouldProcess(List<String> keys) {
        boolean fresh = true;
        for (String key : keys) {
            if (key != null && seen.contains(key)) {
                fresh = false;
            }
        }
        keys.stream().filter(Objects::nonNull).forEach(seen::add);
        return fresh;
    }

    public int size() {
        return seen.size();
    }
}
