package app.lessico.transfer.reconcile;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Natural key to document id for one tenant's collection, as of build time plus whatever the
 * running batch has registered since.
 */
public class NaturalKeyIndex {

    private final Map<String, String> idsByKey = new HashMap<>();
    private final Set<String> ids = new HashSet<>();

    public String lookup(String naturalKey) {
        String key = NaturalKeys.normalize(naturalKey);
        return key == null ? null : idsByKey.get(key);
    }

    public void register(String naturalKey, String id) {
        String key = NaturalKeys.normalize(naturalKey);
        if (id == null) {
            return;
        }
        ids.add(id);
        if (key != null) {
            idsByKey.put(key, id);
        }
    }

    public boolean containsId(String id) {
        return id != null && ids.contains(id);
    }

    public int size() {
        return idsByKey.size();
    }
}
