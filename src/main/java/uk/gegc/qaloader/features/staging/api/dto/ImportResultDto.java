package uk.gegc.qaloader.features.staging.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.qaloader.features.ingestion.api.dto.FailedUploadDto;
import uk.gegc.qaloader.features.staging.domain.model.BatchStatus;

import java.util.List;
import java.util.UUID;

@Schema(name = "ImportResultDto", description = "Per-record outcome of importing the approved questions of a batch")
public record ImportResultDto(
        UUID batchId,
        int totalAttempted,
        List<String> importedIds,
        List<FailedUploadDto> failures,
        @Schema(description = "Batch status after the import")
        BatchStatus batchStatus,
        long processingTimeMs
) {
    public ImportResultDto {
        importedIds = importedIds == null ? List.of() : List.copyOf(importedIds);
        failures = failures == null ? List.of() : List.copyOf(failures);
    }

    @JsonProperty
    public int importedCount() {
        return importedIds.size();
    }

    @JsonProperty
    public int failedCount() {
        return failures.size();
    }
}
