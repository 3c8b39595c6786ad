package app.lessico.transfer.reconcile;

import app.lessico.transfer.domain.TransferScope;
import app.lessico.transfer.model.PerformanceRecord;
import app.lessico.transfer.model.RecordVisitor;
import app.lessico.transfer.model.StatisticsRecord;
import app.lessico.transfer.model.TestSessionRecord;
import app.lessico.transfer.model.VocabularyRecord;
import app.lessico.transfer.model.WordRecord;
import app.lessico.transfer.store.DocumentStore;
import app.lessico.transfer.store.StoreUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.TransactionException;

import java.util.List;
import java.util.Optional;

/**
 * Applies a decoded batch to the store one record at a time. Order matters: a word committed
 * early in the batch is visible to every later record that refers to it, so records are never
 * processed in parallel. A failing record is recorded and the batch moves on.
 */
@Component
public class BatchCommitter {

    private static final Logger log = LoggerFactory.getLogger(BatchCommitter.class);

    private final DocumentStore store;
    private final ReferenceIndexBuilder indexBuilder;
    private final OwnershipResolver ownershipResolver;
    private final ReferenceRewriter referenceRewriter;
    private final RemapLedger remapLedger;

    public BatchCommitter(DocumentStore store,
                          ReferenceIndexBuilder indexBuilder,
                          OwnershipResolver ownershipResolver,
                          ReferenceRewriter referenceRewriter,
                          RemapLedger remapLedger) {
        this.store = store;
        this.indexBuilder = indexBuilder;
        this.ownershipResolver = ownershipResolver;
        this.referenceRewriter = referenceRewriter;
        this.remapLedger = remapLedger;
    }

    public BatchResult commit(TransferScope scope, List<VocabularyRecord> records, String tenantId) {
        return commit(scope, records, tenantId, List.of());
    }

    /**
     * @throws StoreUnavailableException when the reference index cannot be built; nothing has
     *                                   been written at that point
     */
    public BatchResult commit(TransferScope scope,
                              List<VocabularyRecord> records,
                              String tenantId,
                              List<String> warnings) {
        ReferenceIndex index = indexBuilder.build(scope, tenantId);
        BatchContext context = new BatchContext(scope, tenantId, index);
        warnings.forEach(context::warn);

        for (VocabularyRecord record : records) {
            commitOne(context, record);
        }

        BatchResult result = context.toResult();
        log.info("Batch committed: scope={}, tenantId={}, records={}, committed={}, skipped={}, failed={}, remapped={}, repaired={}, unresolved={}",
                scope,
                tenantId,
                records.size(),
                result.committed(),
                result.skipped(),
                result.failed(),
                result.remapped(),
                result.repairedReferences(),
                result.unresolvedReferences());
        return result;
    }

    private void commitOne(BatchContext context, VocabularyRecord record) {
        String recordId = describe(record);
        SkipReason invalid = record.accept(VALIDATOR);
        if (invalid != null) {
            context.skipped(recordId, invalid);
            return;
        }
        if (!context.deduplicator().shouldProcess(record.dedupKeys())) {
            log.debug("Skipping duplicate record: collection={}, recordId={}", record.collection().storeName(), recordId);
            context.skipped(recordId, SkipReason.duplicate);
            return;
        }

        try {
            Optional<ResolvedTarget> resolved = ownershipResolver.resolve(record, context.tenantId(), context.index());
            if (resolved.isEmpty()) {
                context.skipped(recordId, SkipReason.no_matching_word);
                return;
            }
            ResolvedTarget target = resolved.get();
            RewriteOutcome outcome = referenceRewriter.rewrite(record, context.tenantId(), target, context.index());

            store.put(record.collection(), target.targetId(), outcome.record().body());
            // only a written document may be the target of a remap
            if (target.remapped() && target.originalId() != null) {
                remapLedger.record(context.tenantId(), record.collection(), target.originalId(), target.targetId());
                context.index().remaps().register(record.collection(), target.originalId(), target.targetId());
            }
            afterCommit(context, outcome.record(), target);
            context.committed(outcome, target);
        } catch (StoreUnavailableException | DataAccessException | TransactionException ex) {
            log.warn("Record not committed, store unavailable: collection={}, recordId={}, error={}",
                    record.collection().storeName(), recordId, ex.getMessage());
            context.failed(recordId, ErrorReason.store_unavailable, summarize(ex));
        } catch (OwnershipConflictException ex) {
            log.warn("Record not committed, ownership conflict: collection={}, recordId={}, error={}",
                    record.collection().storeName(), recordId, ex.getMessage());
            context.failed(recordId, ErrorReason.ownership_conflict, ex.getMessage());
        } catch (RuntimeException ex) {
            log.error("Record not committed: collection={}, recordId={}", record.collection().storeName(), recordId, ex);
            context.failed(recordId, ErrorReason.unexpected, summarize(ex));
        }
    }

    private void afterCommit(BatchContext context, VocabularyRecord written, ResolvedTarget target) {
        if (written instanceof WordRecord word) {
            context.index().words().register(word.english(), target.targetId());
        } else if (written instanceof TestSessionRecord) {
            context.index().registerSession(target.targetId());
        }
    }

    private String describe(VocabularyRecord record) {
        String id = record.id();
        if (id != null) {
            return id;
        }
        if (record instanceof PerformanceRecord performance) {
            return performance.english();
        }
        return null;
    }

    private String summarize(Throwable throwable) {
        Throwable root = throwable;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        String message = root.getMessage();
        if (message != null && !message.isBlank()) {
            return message;
        }
        String fallback = throwable.getMessage();
        if (fallback != null && !fallback.isBlank()) {
            return fallback;
        }
        return throwable.getClass().getSimpleName();
    }

    private static final RecordVisitor<SkipReason> VALIDATOR = new RecordVisitor<>() {
        @Override
        public SkipReason visitWord(WordRecord word) {
            if (word.english() == null || word.english().isBlank()) {
                return SkipReason.missing_natural_key;
            }
            if (word.translation() == null || word.translation().isBlank()) {
                return SkipReason.missing_translation;
            }
            return word.id() == null ? SkipReason.missing_id : null;
        }

        @Override
        public SkipReason visitPerformance(PerformanceRecord performance) {
            String english = performance.english();
            return english == null || english.isBlank() ? SkipReason.missing_natural_key : null;
        }

        @Override
        public SkipReason visitTestSession(TestSessionRecord session) {
            return session.id() == null ? SkipReason.missing_id : null;
        }

        @Override
        public SkipReason visitStatistics(StatisticsRecord statistics) {
            return statistics.id() == null ? SkipReason.missing_id : null;
        }
    };
}
