package uk.gegc.qaloader.features.ingestion.application.validation;

import org.springframework.stereotype.Component;
import uk.gegc.qaloader.features.ingestion.domain.model.UploadMetadata;
import uk.gegc.qaloader.features.question.domain.model.QuestionRecord;
import uk.gegc.qaloader.shared.exception.ValidationException;

/**
 * Length limits of the audit fields, checked before any file is read.
 */
@Component
public class UploadMetadataValidator {

    public void validate(UploadMetadata metadata) {
        if (metadata == null) {
            return;
        }
        validateLength("uploadedBy", metadata.uploadedBy(), QuestionRecord.UPLOADED_BY_MAX_LENGTH);
        validateLength("uploadNotes", metadata.uploadNotes(), QuestionRecord.UPLOAD_NOTES_MAX_LENGTH);
        validateLength("uploadedOn", metadata.uploadedOn(), QuestionRecord.UPLOADED_ON_MAX_LENGTH);
    }

    private void validateLength(String field, String value, int max) {
        if (value != null && value.length() > max) {
            throw new ValidationException(field + " must be at most " + max + " characters");
        }
    }
}
