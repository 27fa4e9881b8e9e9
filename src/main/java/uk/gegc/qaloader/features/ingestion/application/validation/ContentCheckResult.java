package uk.gegc.qaloader.features.ingestion.application.validation;

import uk.gegc.qaloader.features.ingestion.domain.model.ValidatedBlock;

import java.util.List;

public record ContentCheckResult(List<String> errors, List<String> warnings, List<ValidatedBlock> validBlocks) {
    public ContentCheckResult {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
        validBlocks = List.copyOf(validBlocks);
    }
}
