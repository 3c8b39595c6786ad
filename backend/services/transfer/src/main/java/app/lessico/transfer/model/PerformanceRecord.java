package app.lessico.transfer.model;

import app.lessico.transfer.reconcile.NaturalKeys;
import app.lessico.transfer.store.RecordCollection;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Performance of one word. Its identity is the word it measures, so the declared id is ignored
 * on import and batches are deduplicated by word text.
 */
public final class PerformanceRecord implements VocabularyRecord {

    private final ObjectNode body;

    public PerformanceRecord(ObjectNode body) {
        this.body = Objects.requireNonNull(body, "body");
    }

    @Override
    public ObjectNode body() {
        return body;
    }

    @Override
    public RecordCollection collection() {
        return RecordCollection.performance;
    }

    @Override
    public PerformanceRecord withBody(ObjectNode body) {
        return new PerformanceRecord(body);
    }

    @Override
    public <R> R accept(RecordVisitor<R> visitor) {
        return visitor.visitPerformance(this);
    }

    @Override
    public List<String> dedupKeys() {
        return Collections.singletonList(NaturalKeys.normalize(english()));
    }

    public String english() {
        return VocabularyRecord.text(body, "english");
    }

    public String wordId() {
        return VocabularyRecord.text(body, "wordId");
    }
}
