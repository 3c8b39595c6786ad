package app.lessico.transfer.reconcile;

import java.util.HashSet;
import java.util.Set;

/**
 * Everything reference repair can consult during one batch. Discarded with the batch.
 */
public class ReferenceIndex {

    private final NaturalKeyIndex words;
    private final Set<String> sessionIds;
    private final RemapTable remaps;

    public ReferenceIndex(NaturalKeyIndex words, Set<String> sessionIds, RemapTable remaps) {
        this.words = words;
        this.sessionIds = new HashSet<>(sessionIds);
        this.remaps = remaps;
    }

    public static ReferenceIndex empty() {
        return new ReferenceIndex(new NaturalKeyIndex(), Set.of(), new RemapTable());
    }

    public NaturalKeyIndex words() {
        return words;
    }

    public boolean ownsSession(String sessionId) {
        return sessionId != null && sessionIds.contains(sessionId);
    }

    public void registerSession(String sessionId) {
        sessionIds.add(sessionId);
    }

    public RemapTable remaps() {
        return remaps;
    }
}
