package uk.gegc.qaloader.features.ingestion.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.qaloader.features.ingestion.domain.model.PersistenceErrorKind;

@Schema(name = "FailedUploadDto", description = "A block that passed validation but could not be stored")
public record FailedUploadDto(
        int blockIndex,
        int startLine,
        @Schema(description = "Id assigned before the failure, null when no id could be generated")
        String questionId,
        PersistenceErrorKind kind,
        String message
) {
}
