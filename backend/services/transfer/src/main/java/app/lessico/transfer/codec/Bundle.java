package app.lessico.transfer.codec;

import app.lessico.transfer.domain.TransferScope;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Instant;
import java.util.List;

/**
 * Owner-stripped snapshot of one scope, ready to be written out.
 */
public record Bundle(
        TransferScope scope,
        List<ObjectNode> records,
        Instant exportDate
) {
    public Bundle {
        records = records != null ? List.copyOf(records) : List.of();
    }
}
