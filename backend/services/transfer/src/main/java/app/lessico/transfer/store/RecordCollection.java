package app.lessico.transfer.store;

import com.fasterxml.jackson.core.JsonPointer;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Document-store collections touched by the transfer engine, with the location of the owner
 * id and of the soft-delete flag inside a stored body.
 */
public enum RecordCollection {
    words("words", "/firestoreMetadata/userId", null),
    performance("performance", "/firestoreMetadata/userId", "/firestoreMetadata/deleted"),
    test_sessions("detailedTestSessions", "/userId", "/deleted"),
    statistics("statistics", "/firestoreMetadata/userId", null),
    id_remaps("idRemaps", "/userId", null);

    private final String storeName;
    private final JsonPointer ownerPointer;
    private final JsonPointer deletedPointer;

    RecordCollection(String storeName, String ownerPointer, String deletedPointer) {
        this.storeName = storeName;
        this.ownerPointer = JsonPointer.compile(ownerPointer);
        this.deletedPointer = deletedPointer == null ? null : JsonPointer.compile(deletedPointer);
    }

    public String storeName() {
        return storeName;
    }

    public String ownerOf(JsonNode body) {
        if (body == null) {
            return null;
        }
        JsonNode owner = body.at(ownerPointer);
        if (owner.isMissingNode() || owner.isNull()) {
            // legacy documents sometimes only carry the top-level copy
            owner = body.path("userId");
        }
        return owner.isTextual() && !owner.asText().isBlank() ? owner.asText() : null;
    }

    public boolean isDeleted(JsonNode body) {
        if (deletedPointer == null || body == null) {
            return false;
        }
        return body.at(deletedPointer).asBoolean(false);
    }

    public static RecordCollection fromStoreName(String storeName) {
        for (RecordCollection collection : values()) {
            if (collection.storeName.equals(storeName)) {
                return collection;
            }
        }
        throw new IllegalArgumentException("Unknown collection: " + storeName);
    }
}
