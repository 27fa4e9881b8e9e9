package uk.gegc.qaloader.shared.exception;

import uk.gegc.qaloader.features.ingestion.api.dto.ValidationResult;

/**
 * Raised by a commit when validation left nothing to store.
 */
public class NoValidBlocksException extends RuntimeException {

    private final transient ValidationResult validationResult;

    public NoValidBlocksException(ValidationResult validationResult) {
        super("Document contains 0 valid question blocks");
        this.validationResult = validationResult;
    }

    public ValidationResult getValidationResult() {
        return validationResult;
    }
}
