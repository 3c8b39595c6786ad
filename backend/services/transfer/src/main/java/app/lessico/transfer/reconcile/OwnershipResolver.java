package app.lessico.transfer.reconcile;

import app.lessico.transfer.model.DerivedIds;
import app.lessico.transfer.model.PerformanceRecord;
import app.lessico.transfer.model.RecordVisitor;
import app.lessico.transfer.model.StatisticsRecord;
import app.lessico.transfer.model.TestSessionRecord;
import app.lessico.transfer.model.VocabularyRecord;
import app.lessico.transfer.model.WordRecord;
import app.lessico.transfer.store.DocumentStore;
import app.lessico.transfer.store.RecordCollection;
import app.lessico.transfer.store.StoredDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Objects;
import java.util.Optional;

/**
 * Decides, per incoming record, whether it overwrites the document at its declared id or has to
 * move to a fresh id because that id belongs to another tenant. Never writes over a foreign
 * tenant's document.
 */
@Component
public class OwnershipResolver {

    private static final Logger log = LoggerFactory.getLogger(OwnershipResolver.class);

    private final DocumentStore store;

    public OwnershipResolver(DocumentStore store) {
        this.store = store;
    }

    /**
     * @return empty when the record has nothing to attach to (performance for a word the tenant
     * does not have)
     */
    public Optional<ResolvedTarget> resolve(VocabularyRecord record, String tenantId, ReferenceIndex index) {
        return record.accept(new RecordVisitor<>() {
            @Override
            public Optional<ResolvedTarget> visitWord(WordRecord word) {
                String naturalKeyMatch = index.words().lookup(word.english());
                if (naturalKeyMatch != null && Objects.equals(word.id(), DerivedIds.forWord(word.english()))) {
                    // the bundle carried no id, so the tenant's word with the same text is the target
                    return Optional.of(ResolvedTarget.inPlace(naturalKeyMatch));
                }
                return Optional.of(resolveById(word, tenantId, index, naturalKeyMatch));
            }

            @Override
            public Optional<ResolvedTarget> visitPerformance(PerformanceRecord performance) {
                return resolvePerformance(performance, tenantId, index);
            }

            @Override
            public Optional<ResolvedTarget> visitTestSession(TestSessionRecord session) {
                return Optional.of(resolveById(session, tenantId, index, null));
            }

            @Override
            public Optional<ResolvedTarget> visitStatistics(StatisticsRecord statistics) {
                return Optional.of(resolveById(statistics, tenantId, index, null));
            }
        });
    }

    private ResolvedTarget resolveById(VocabularyRecord record,
                                       String tenantId,
                                       ReferenceIndex index,
                                       String naturalKeyMatch) {
        RecordCollection collection = record.collection();
        String id = record.id();
        Optional<StoredDocument> existing = store.find(collection, id);
        if (existing.isEmpty() || isOverwritable(existing.get(), tenantId)) {
            return ResolvedTarget.inPlace(id);
        }

        String targetId = reusableTarget(collection, id, tenantId, index, naturalKeyMatch);
        if (targetId == null) {
            targetId = store.allocateId(collection);
        }
        log.info("Remapped record: collection={}, originalId={}, targetId={}, foreignOwner={}, tenantId={}",
                collection.storeName(), id, targetId, existing.get().ownerId(), tenantId);
        return ResolvedTarget.remapped(id, targetId);
    }

    // A previous import of the same record, or a word with the same text, keeps re-imports stable.
    private String reusableTarget(RecordCollection collection,
                                  String originalId,
                                  String tenantId,
                                  ReferenceIndex index,
                                  String naturalKeyMatch) {
        String previous = index.remaps().lookup(collection, originalId);
        if (previous != null && !previous.equals(originalId)) {
            Optional<StoredDocument> atPrevious = store.find(collection, previous);
            if (atPrevious.isEmpty() || isOverwritable(atPrevious.get(), tenantId)) {
                return previous;
            }
        }
        if (naturalKeyMatch != null && !naturalKeyMatch.equals(originalId)) {
            return naturalKeyMatch;
        }
        return null;
    }

    private Optional<ResolvedTarget> resolvePerformance(PerformanceRecord performance,
                                                        String tenantId,
                                                        ReferenceIndex index) {
        String wordId = index.words().lookup(performance.english());
        if (wordId == null) {
            return Optional.empty();
        }
        Optional<StoredDocument> existing = store.find(RecordCollection.performance, wordId);
        if (existing.isPresent() && !isOverwritable(existing.get(), tenantId)) {
            throw new OwnershipConflictException(
                    "Performance slot " + wordId + " is owned by another tenant");
        }
        // following the tenant's word is not an ownership remap, so nothing to repair or count
        String declared = performance.id() != null ? performance.id() : performance.wordId();
        return Optional.of(new ResolvedTarget(declared, wordId, false));
    }

    private boolean isOverwritable(StoredDocument existing, String tenantId) {
        String owner = existing.ownerId();
        return owner == null || owner.equals(tenantId);
    }
}
