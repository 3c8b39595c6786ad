package app.lessico.transfer.reconcile;

import app.lessico.transfer.model.VocabularyRecord;
import app.lessico.transfer.store.DocumentQuery;
import app.lessico.transfer.store.DocumentStore;
import app.lessico.transfer.store.RecordCollection;
import app.lessico.transfer.store.StoredDocument;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;

/**
 * Persists every id remap as a document of its own, so a later batch (statistics imported after
 * test history, or the same bundle imported again) reuses the id chosen the first time.
 */
@Component
public class RemapLedger {

    static final String COLLECTION_FIELD = "collection";
    static final String ORIGINAL_ID_FIELD = "originalId";
    static final String TARGET_ID_FIELD = "targetId";

    private final DocumentStore store;
    private final ObjectMapper objectMapper;

    public RemapLedger(DocumentStore store, ObjectMapper objectMapper) {
        this.store = store;
        this.objectMapper = objectMapper;
    }

    public RemapTable load(String tenantId) {
        RemapTable table = new RemapTable();
        for (StoredDocument entry : store.query(RecordCollection.id_remaps, DocumentQuery.ownedBy(tenantId))) {
            String collection = VocabularyRecord.text(entry.body(), COLLECTION_FIELD);
            String originalId = VocabularyRecord.text(entry.body(), ORIGINAL_ID_FIELD);
            String targetId = VocabularyRecord.text(entry.body(), TARGET_ID_FIELD);
            if (collection == null || originalId == null || targetId == null) {
                continue;
            }
            table.register(RecordCollection.fromStoreName(collection), originalId, targetId);
        }
        return table;
    }

    public void record(String tenantId, RecordCollection collection, String originalId, String targetId) {
        ObjectNode entry = objectMapper.createObjectNode();
        entry.put(VocabularyRecord.OWNER_FIELD, tenantId);
        entry.put(COLLECTION_FIELD, collection.storeName());
        entry.put(ORIGINAL_ID_FIELD, originalId);
        entry.put(TARGET_ID_FIELD, targetId);
        store.put(RecordCollection.id_remaps, entryId(tenantId, collection, originalId), entry);
    }

    static String entryId(String tenantId, RecordCollection collection, String originalId) {
        return tenantId + ":" + collection.storeName() + ":" + originalId;
    }
}
