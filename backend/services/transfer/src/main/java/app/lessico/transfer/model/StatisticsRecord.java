package app.lessico.transfer.model;

import app.lessico.transfer.store.RecordCollection;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Objects;

public final class StatisticsRecord implements VocabularyRecord {

    private final ObjectNode body;

    public StatisticsRecord(ObjectNode body) {
        this.body = Objects.requireNonNull(body, "body");
    }

    @Override
    public ObjectNode body() {
        return body;
    }

    @Override
    public RecordCollection collection() {
        return RecordCollection.statistics;
    }

    @Override
    public StatisticsRecord withBody(ObjectNode body) {
        return new StatisticsRecord(body);
    }

    @Override
    public <R> R accept(RecordVisitor<R> visitor) {
        return visitor.visitStatistics(this);
    }
}
