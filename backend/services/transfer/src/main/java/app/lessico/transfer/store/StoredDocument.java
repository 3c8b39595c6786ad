package app.lessico.transfer.store;

import com.fasterxml.jackson.databind.node.ObjectNode;

public record StoredDocument(
        RecordCollection collection,
        String id,
        String ownerId,
        ObjectNode body
) {
}
