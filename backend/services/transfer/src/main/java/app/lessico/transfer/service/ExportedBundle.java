package app.lessico.transfer.service;

import app.lessico.transfer.domain.TransferScope;

public record ExportedBundle(
        TransferScope scope,
        String fileName,
        int recordCount,
        byte[] content
) {
}
