package uk.gegc.qaloader.features.staging.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.qaloader.features.staging.domain.model.BatchStatus;

import java.time.Instant;
import java.util.UUID;

@Schema(name = "UploadBatchDto", description = "A staged upload with its question counts per review status")
public record UploadBatchDto(
        UUID id,
        String fileName,
        String uploadedBy,
        String uploadNotes,
        BatchStatus status,
        double duplicateThreshold,
        int totalQuestions,
        long pendingCount,
        long duplicateCount,
        long approvedCount,
        long rejectedCount,
        long importedCount,
        String reviewedBy,
        Instant createdAt,
        Instant reviewStartedAt,
        Instant importCompletedAt
) {
}
