package app.lessico.transfer.reconcile;

import app.lessico.transfer.model.OwnerFields;
import app.lessico.transfer.model.PerformanceRecord;
import app.lessico.transfer.model.RecordVisitor;
import app.lessico.transfer.model.StatisticsRecord;
import app.lessico.transfer.model.TestSessionRecord;
import app.lessico.transfer.model.VocabularyRecord;
import app.lessico.transfer.model.WordRecord;
import app.lessico.transfer.store.RecordCollection;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import org.springframework.stereotype.Component;

/**
 * Produces the document that will actually be written for a resolved record: a deep copy with
 * its identity fields pointed at the target id, every owner field set to the importing tenant
 * and, when the record moved to a new id, its word and session references repaired.
 */
@Component
public class ReferenceRewriter {

    public RewriteOutcome rewrite(VocabularyRecord record,
                                  String tenantId,
                                  ResolvedTarget target,
                                  ReferenceIndex index) {
        VocabularyRecord working = record.withBody(record.body().deepCopy());

        working.accept(new IdentityStamp(target.targetId()));
        working.accept(new OwnershipCleanse(tenantId));

        ReferenceRepair repair = new ReferenceRepair(index);
        if (target.remapped()) {
            working.accept(repair);
        }
        return new RewriteOutcome(working, repair.repaired, repair.unresolved);
    }

    private static final class IdentityStamp implements RecordVisitor<Void> {

        private final String targetId;

        private IdentityStamp(String targetId) {
            this.targetId = targetId;
        }

        @Override
        public Void visitWord(WordRecord word) {
            word.body().put("id", targetId);
            return null;
        }

        @Override
        public Void visitPerformance(PerformanceRecord performance) {
            performance.body().put("id", targetId);
            performance.body().put("wordId", targetId);
            return null;
        }

        @Override
        public Void visitTestSession(TestSessionRecord session) {
            ObjectNode body = session.body();
            body.put("id", targetId);
            body.put(TestSessionRecord.SESSION_ID_FIELD, targetId);
            if (!body.path("deleted").isBoolean()) {
                body.put("deleted", false);
            }
            return null;
        }

        @Override
        public Void visitStatistics(StatisticsRecord statistics) {
            statistics.body().put("id", targetId);
            return null;
        }
    }

    private static final class OwnershipCleanse implements RecordVisitor<Void> {

        private final String tenantId;

        private OwnershipCleanse(String tenantId) {
            this.tenantId = tenantId;
        }

        @Override
        public Void visitWord(WordRecord word) {
            return withMetadataOwner(word.body());
        }

        @Override
        public Void visitPerformance(PerformanceRecord performance) {
            return withMetadataOwner(performance.body());
        }

        @Override
        public Void visitTestSession(TestSessionRecord session) {
            session.body().put(VocabularyRecord.OWNER_FIELD, tenantId);
            OwnerFields.overwrite(session.body(), tenantId);
            return null;
        }

        @Override
        public Void visitStatistics(StatisticsRecord statistics) {
            return withMetadataOwner(statistics.body());
        }

        private Void withMetadataOwner(ObjectNode body) {
            body.put(VocabularyRecord.OWNER_FIELD, tenantId);
            JsonNode metadata = body.get(VocabularyRecord.METADATA_FIELD);
            ObjectNode metadataObject = metadata instanceof ObjectNode objectNode
                    ? objectNode
                    : body.putObject(VocabularyRecord.METADATA_FIELD);
            metadataObject.put(VocabularyRecord.OWNER_FIELD, tenantId);
            OwnerFields.overwrite(body, tenantId);
            return null;
        }
    }

    private static final class ReferenceRepair implements RecordVisitor<Void> {

        private final ReferenceIndex index;
        private int repaired;
        private int unresolved;

        private ReferenceRepair(ReferenceIndex index) {
            this.index = index;
        }

        @Override
        public Void visitWord(WordRecord word) {
            return null;
        }

        @Override
        public Void visitPerformance(PerformanceRecord performance) {
            // identity already follows the matched word
            return null;
        }

        @Override
        public Void visitTestSession(TestSessionRecord session) {
            JsonNode exportData = session.body().path("exportData");
            for (JsonNode answer : exportData.path("detailedAnswers")) {
                if (answer.get("word") instanceof ObjectNode word) {
                    repairWordReference(word, "id");
                }
            }
            for (JsonNode wrong : exportData.path("wrongWords")) {
                if (wrong instanceof ObjectNode word) {
                    repairWordReference(word, "id");
                }
            }
            for (JsonNode insight : session.body().path("analytics").path("insights")) {
                if (insight.get("data") instanceof ObjectNode data && data.hasNonNull("wordId")) {
                    repairWordReference(data, "wordId");
                }
            }
            return null;
        }

        @Override
        public Void visitStatistics(StatisticsRecord statistics) {
            ObjectNode body = statistics.body();
            for (JsonNode chapter : body.path("chapterStats")) {
                for (JsonNode entry : chapter.path("words")) {
                    if (entry instanceof ObjectNode word) {
                        repairWordReference(word, "id");
                    }
                }
            }
            for (JsonNode entry : body.path("performanceData").path("wordPerformances")) {
                if (entry instanceof ObjectNode performance) {
                    repairWordReference(performance, "wordId", "id");
                }
            }
            if (body.get("recentSessions") instanceof ArrayNode sessions) {
                repairSessionReferences(sessions);
            }
            if (body.get("wordIds") instanceof ArrayNode wordIds) {
                repairWordIds(wordIds);
            }
            return null;
        }

        private void repairWordReference(ObjectNode reference, String... idFields) {
            String currentId = VocabularyRecord.text(reference, idFields[0]);
            String english = VocabularyRecord.text(reference, "english");
            if (english == null) {
                if (currentId != null) {
                    unresolved++;
                }
                return;
            }
            String resolved = index.words().lookup(english);
            if (resolved == null) {
                unresolved++;
                return;
            }
            if (!resolved.equals(currentId)) {
                for (String field : idFields) {
                    reference.put(field, resolved);
                }
                repaired++;
            }
        }

        private void repairSessionReferences(ArrayNode sessions) {
            for (int i = 0; i < sessions.size(); i++) {
                JsonNode entry = sessions.get(i);
                if (entry.isTextual()) {
                    String mapped = resolveSession(entry.asText());
                    if (mapped != null) {
                        sessions.set(i, TextNode.valueOf(mapped));
                    }
                } else if (entry instanceof ObjectNode reference) {
                    String idField = reference.hasNonNull("id") ? "id" : TestSessionRecord.SESSION_ID_FIELD;
                    String current = VocabularyRecord.text(reference, idField);
                    if (current == null) {
                        continue;
                    }
                    String mapped = resolveSession(current);
                    if (mapped != null) {
                        reference.put(idField, mapped);
                        if (reference.has(TestSessionRecord.SESSION_ID_FIELD)) {
                            reference.put(TestSessionRecord.SESSION_ID_FIELD, mapped);
                        }
                    }
                }
            }
        }

        private String resolveSession(String sessionId) {
            String mapped = index.remaps().lookup(RecordCollection.test_sessions, sessionId);
            if (mapped != null && !mapped.equals(sessionId)) {
                repaired++;
                return mapped;
            }
            if (mapped == null && !index.ownsSession(sessionId)) {
                unresolved++;
            }
            return null;
        }

        private void repairWordIds(ArrayNode wordIds) {
            for (int i = 0; i < wordIds.size(); i++) {
                JsonNode entry = wordIds.get(i);
                if (!entry.isTextual()) {
                    continue;
                }
                String wordId = entry.asText();
                String mapped = index.remaps().lookup(RecordCollection.words, wordId);
                if (mapped != null && !mapped.equals(wordId)) {
                    wordIds.set(i, TextNode.valueOf(mapped));
                    repaired++;
                } else if (mapped == null && !index.words().containsId(wordId)) {
                    unresolved++;
                }
            }
        }
    }
}
