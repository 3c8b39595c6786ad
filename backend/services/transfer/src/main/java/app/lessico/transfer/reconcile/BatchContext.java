package app.lessico.transfer.reconcile;

import app.lessico.transfer.domain.TransferScope;

import java.util.ArrayList;
import java.util.List;

/**
 * State owned by exactly one batch execution: dedup keys, reference lookups and the running
 * tallies. Never shared between imports.
 */
public class BatchContext {

    private final TransferScope scope;
    private final String tenantId;
    private final ReferenceIndex index;
    private final Deduplicator deduplicator = new Deduplicator();
    private final List<BatchResult.RecordError> errors = new ArrayList<>();
    private final List<BatchResult.SkippedRecord> skippedRecords = new ArrayList<>();
    private final List<String> warnings = new ArrayList<>();
    private int committed;
    private int remapped;
    private int repairedReferences;
    private int unresolvedReferences;

    public BatchContext(TransferScope scope, String tenantId, ReferenceIndex index) {
        this.scope = scope;
        this.tenantId = tenantId;
        this.index = index;
    }

    public TransferScope scope() {
        return scope;
    }

    public String tenantId() {
        return tenantId;
    }

    public ReferenceIndex index() {
        return index;
    }

    public Deduplicator deduplicator() {
        return deduplicator;
    }

    void committed(RewriteOutcome outcome, ResolvedTarget target) {
        committed++;
        if (target.remapped()) {
            remapped++;
        }
        repairedReferences += outcome.repaired();
        unresolvedReferences += outcome.unresolved();
    }

    void skipped(String recordId, SkipReason reason) {
        skippedRecords.add(new BatchResult.SkippedRecord(recordId, reason));
    }

    void failed(String recordId, ErrorReason reason, String message) {
        errors.add(new BatchResult.RecordError(recordId, reason, message));
    }

    public void warn(String warning) {
        warnings.add(warning);
    }

    public BatchResult toResult() {
        return new BatchResult(
                scope,
                committed,
                skippedRecords.size(),
                errors.size(),
                remapped,
                repairedReferences,
                unresolvedReferences,
                errors,
                skippedRecords,
                warnings
        );
    }
}
