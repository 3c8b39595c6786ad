package app.lessico.transfer.notify;

import app.lessico.transfer.domain.TransferScope;

import java.time.Instant;

public record TenantDataChangedEvent(
        String tenantId,
        TransferScope scope,
        Instant occurredAt
) {
}
