package app.lessico.transfer.model;

import app.lessico.transfer.domain.TransferScope;
import app.lessico.transfer.store.RecordCollection;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Collections;
import java.util.List;

/**
 * A single importable document. The body is kept as a JSON tree so fields the engine does not
 * know about survive import and export untouched; each variant adds typed access to the
 * fields reconciliation depends on.
 */
public sealed interface VocabularyRecord
        permits WordRecord, PerformanceRecord, TestSessionRecord, StatisticsRecord {

    String OWNER_FIELD = "userId";
    String METADATA_FIELD = "firestoreMetadata";

    ObjectNode body();

    RecordCollection collection();

    /**
     * Copy of this record over a different body, same variant.
     */
    VocabularyRecord withBody(ObjectNode body);

    <R> R accept(RecordVisitor<R> visitor);

    default String id() {
        return text(body(), "id");
    }

    /**
     * Identities used to detect repeats inside one batch.
     */
    default List<String> dedupKeys() {
        return Collections.singletonList(id());
    }

    static VocabularyRecord of(TransferScope scope, ObjectNode body) {
        return switch (scope) {
            case words -> new WordRecord(body);
            case performance -> new PerformanceRecord(body);
            case history -> new TestSessionRecord(body);
            case statistics -> new StatisticsRecord(body);
        };
    }

    static String text(JsonNode node, String field) {
        if (node == null) {
            return null;
        }
        JsonNode value = node.get(field);
        if (value == null || !value.isValueNode() || value.isNull()) {
            return null;
        }
        String text = value.asText();
        return text.isEmpty() ? null : text;
    }
}
