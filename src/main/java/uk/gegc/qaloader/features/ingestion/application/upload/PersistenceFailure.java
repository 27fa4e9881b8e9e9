package uk.gegc.qaloader.features.ingestion.application.upload;

import uk.gegc.qaloader.features.ingestion.domain.model.PersistenceErrorKind;

public record PersistenceFailure(PersistenceErrorKind kind, String message) {
}
