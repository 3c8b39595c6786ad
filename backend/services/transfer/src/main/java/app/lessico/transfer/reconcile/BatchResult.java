package app.lessico.transfer.reconcile;

import app.lessico.transfer.domain.TransferScope;

import java.util.List;

/**
 * Outcome of one import batch. Partial success is a valid terminal state: callers must look at
 * the counts, not only at {@link #succeeded()}.
 */
public record BatchResult(
        TransferScope scope,
        int committed,
        int skipped,
        int failed,
        int remapped,
        int repairedReferences,
        int unresolvedReferences,
        List<RecordError> errors,
        List<SkippedRecord> skippedRecords,
        List<String> warnings
) {
    public BatchResult {
        errors = errors != null ? List.copyOf(errors) : List.of();
        skippedRecords = skippedRecords != null ? List.copyOf(skippedRecords) : List.of();
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }

    public boolean succeeded() {
        return errors.isEmpty();
    }

    public boolean partial() {
        return !errors.isEmpty() && committed > 0;
    }

    public record RecordError(String recordId, ErrorReason reason, String message) {
    }

    public record SkippedRecord(String recordId, SkipReason reason) {
    }
}
