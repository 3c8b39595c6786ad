package app.lessico.transfer.reconcile;

/**
 * Where an incoming record will be written.
 *
 * @param originalId id declared by the bundle, may differ from {@code targetId}
 * @param remapped   the declared id belonged to someone else, so references must be repaired
 */
public record ResolvedTarget(
        String originalId,
        String targetId,
        boolean remapped
) {

    public static ResolvedTarget inPlace(String id) {
        return new ResolvedTarget(id, id, false);
    }

    public static ResolvedTarget remapped(String originalId, String targetId) {
        return new ResolvedTarget(originalId, targetId, true);
    }
}
