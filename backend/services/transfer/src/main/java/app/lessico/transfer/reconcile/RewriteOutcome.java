package app.lessico.transfer.reconcile;

import app.lessico.transfer.model.VocabularyRecord;

/**
 * @param record     independent copy ready to be written
 * @param repaired   references pointed at a new id
 * @param unresolved references left as they were because no target could be found
 */
public record RewriteOutcome(
        VocabularyRecord record,
        int repaired,
        int unresolved
) {
}
