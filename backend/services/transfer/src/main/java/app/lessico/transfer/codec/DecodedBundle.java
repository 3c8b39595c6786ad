package app.lessico.transfer.codec;

import app.lessico.transfer.domain.TransferScope;
import app.lessico.transfer.model.VocabularyRecord;

import java.util.List;

/**
 * @param declaredExportType {@code exportType} found in the bundle, null for legacy bundles
 * @param discarded          array entries that were not JSON objects
 */
public record DecodedBundle(
        TransferScope scope,
        List<VocabularyRecord> records,
        String declaredExportType,
        String exportDate,
        int discarded
) {
    public DecodedBundle {
        records = records != null ? List.copyOf(records) : List.of();
    }

    public boolean scopeMismatch() {
        return declaredExportType != null && !declaredExportType.equals(scope.exportType());
    }
}
