package uk.gegc.qaloader.features.ingestion.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

@Schema(name = "ValidationResult", description = "Outcome of structural and content validation of one document")
public record ValidationResult(
        @Schema(description = "True when there are no errors and at least one block passed every check")
        boolean valid,
        @Schema(description = "Errors in document order, each naming a block index or line number")
        List<String> errors,
        @Schema(description = "Non-blocking warnings")
        List<String> warnings,
        @Schema(description = "Blocks that passed every hard check", example = "12")
        int parsedCount,
        @Schema(description = "Blocks the scanner recognised", example = "13")
        int blockCount
) {
    public ValidationResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }
}
