package app.lessico.transfer.store;

/**
 * Owner-scoped filter for {@link DocumentStore#query}.
 */
public record DocumentQuery(
        String ownerId,
        boolean includeDeleted
) {

    public static DocumentQuery ownedBy(String ownerId) {
        return new DocumentQuery(ownerId, true);
    }

    public static DocumentQuery activeOwnedBy(String ownerId) {
        return new DocumentQuery(ownerId, false);
    }
}
