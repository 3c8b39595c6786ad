package app.lessico.transfer.model;

import app.lessico.transfer.reconcile.NaturalKeys;
import app.lessico.transfer.store.RecordCollection;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

public final class WordRecord implements VocabularyRecord {

    private final ObjectNode body;

    public WordRecord(ObjectNode body) {
        this.body = Objects.requireNonNull(body, "body");
    }

    @Override
    public ObjectNode body() {
        return body;
    }

    @Override
    public RecordCollection collection() {
        return RecordCollection.words;
    }

    @Override
    public WordRecord withBody(ObjectNode body) {
        return new WordRecord(body);
    }

    @Override
    public <R> R accept(RecordVisitor<R> visitor) {
        return visitor.visitWord(this);
    }

    @Override
    public List<String> dedupKeys() {
        String key = NaturalKeys.normalize(english());
        return Arrays.asList(id(), key == null ? null : "english:" + key);
    }

    public String english() {
        return VocabularyRecord.text(body, "english");
    }

    /**
     * Older bundles carry the translation under {@code italian}.
     */
    public String translation() {
        String translation = VocabularyRecord.text(body, "translation");
        return translation != null ? translation : VocabularyRecord.text(body, "italian");
    }
}
