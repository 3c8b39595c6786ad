package app.lessico.transfer.model;

import app.lessico.transfer.store.RecordCollection;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Objects;

public final class TestSessionRecord implements VocabularyRecord {

    public static final String SESSION_ID_FIELD = "sessionId";

    private final ObjectNode body;

    public TestSessionRecord(ObjectNode body) {
        this.body = Objects.requireNonNull(body, "body");
    }

    @Override
    public ObjectNode body() {
        return body;
    }

    @Override
    public RecordCollection collection() {
        return RecordCollection.test_sessions;
    }

    @Override
    public TestSessionRecord withBody(ObjectNode body) {
        return new TestSessionRecord(body);
    }

    @Override
    public <R> R accept(RecordVisitor<R> visitor) {
        return visitor.visitTestSession(this);
    }

    @Override
    public String id() {
        String id = VocabularyRecord.text(body, "id");
        return id != null ? id : VocabularyRecord.text(body, SESSION_ID_FIELD);
    }
}
