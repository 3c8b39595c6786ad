package app.lessico.transfer.model;

import app.lessico.transfer.reconcile.NaturalKeys;
import app.lessico.transfer.store.RecordCollection;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.nio.charset.StandardCharsets;
import java.util.UUID;

/**
 * Stable ids for records that arrive without one. The same record always gets the same id, so
 * importing an id-less bundle twice lands on the same documents.
 */
public final class DerivedIds {

    private DerivedIds() {
    }

    public static String forWord(String english) {
        String key = NaturalKeys.normalize(english);
        return key == null ? null : nameBased(RecordCollection.words, key);
    }

    /**
     * Derived from the body with its owner fields removed, so the same record exported by
     * different tenants maps to the same id.
     */
    public static String forBody(RecordCollection collection, ObjectNode body) {
        ObjectNode canonical = body.deepCopy();
        canonical.remove("id");
        OwnerFields.strip(canonical);
        return nameBased(collection, canonical.toString());
    }

    private static String nameBased(RecordCollection collection, String name) {
        byte[] bytes = (collection.storeName() + ":" + name).getBytes(StandardCharsets.UTF_8);
        return UUID.nameUUIDFromBytes(bytes).toString().replace("-", "");
    }
}
