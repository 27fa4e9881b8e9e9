package uk.gegc.qaloader.features.ingestion.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

@Schema(name = "BatchUploadResult", description = "Per-record outcome of a committed upload")
public record BatchUploadResult(
        int totalAttempted,
        List<String> successfulIds,
        List<FailedUploadDto> failures,
        List<String> warnings,
        @Schema(description = "Errors of blocks rejected before persistence")
        List<String> validationErrors,
        long processingTimeMs
) {
    public BatchUploadResult {
        successfulIds = successfulIds == null ? List.of() : List.copyOf(successfulIds);
        failures = failures == null ? List.of() : List.copyOf(failures);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
        validationErrors = validationErrors == null ? List.of() : List.copyOf(validationErrors);
    }

    @JsonProperty
    public int successfulUploads() {
        return successfulIds.size();
    }

    @JsonProperty
    public int failedUploads() {
        return failures.size();
    }
}
