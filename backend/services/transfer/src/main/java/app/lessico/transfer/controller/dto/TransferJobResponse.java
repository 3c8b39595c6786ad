package app.lessico.transfer.controller.dto;

import app.lessico.transfer.domain.TransferJobStatus;
import app.lessico.transfer.domain.TransferJobType;
import app.lessico.transfer.domain.TransferScope;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.UUID;

public record TransferJobResponse(
        UUID jobId,
        TransferJobType jobType,
        TransferScope scope,
        TransferJobStatus status,
        String sourceName,
        Long sourceSizeBytes,
        Integer totalItems,
        Integer committedItems,
        Integer skippedItems,
        Integer failedItems,
        Integer remappedItems,
        Integer unresolvedReferences,
        JsonNode result,
        Instant createdAt,
        Instant updatedAt,
        Instant startedAt,
        Instant completedAt,
        String errorMessage
) {
}
