package app.lessico.transfer.reconcile;

import app.lessico.transfer.domain.TransferScope;
import app.lessico.transfer.model.VocabularyRecord;
import app.lessico.transfer.store.DocumentQuery;
import app.lessico.transfer.store.DocumentStore;
import app.lessico.transfer.store.RecordCollection;
import app.lessico.transfer.store.StoredDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.Set;

/**
 * Builds the per-batch lookups with one owner-scoped query per collection the scope needs.
 */
@Component
public class ReferenceIndexBuilder {

    private static final Logger log = LoggerFactory.getLogger(ReferenceIndexBuilder.class);

    private final DocumentStore store;
    private final RemapLedger remapLedger;

    public ReferenceIndexBuilder(DocumentStore store, RemapLedger remapLedger) {
        this.store = store;
        this.remapLedger = remapLedger;
    }

    public ReferenceIndex build(TransferScope scope, String tenantId) {
        NaturalKeyIndex words = buildWordIndex(tenantId);
        Set<String> sessionIds = scope == TransferScope.statistics ? sessionIds(tenantId) : Set.of();
        RemapTable remaps = remapLedger.load(tenantId);
        log.info("Reference index built: scope={}, tenantId={}, words={}, sessions={}, remaps={}",
                scope, tenantId, words.size(), sessionIds.size(), remaps.size());
        return new ReferenceIndex(words, sessionIds, remaps);
    }

    public NaturalKeyIndex buildWordIndex(String tenantId) {
        NaturalKeyIndex index = new NaturalKeyIndex();
        for (StoredDocument word : store.query(RecordCollection.words, DocumentQuery.ownedBy(tenantId))) {
            index.register(VocabularyRecord.text(word.body(), "english"), word.id());
        }
        return index;
    }

    private Set<String> sessionIds(String tenantId) {
        Set<String> ids = new HashSet<>();
        for (StoredDocument session : store.query(RecordCollection.test_sessions, DocumentQuery.ownedBy(tenantId))) {
            ids.add(session.id());
        }
        return ids;
    }
}
