package uk.gegc.qaloader.features.ingestion.domain.model;

public enum UploadMode {
    VALIDATE_ONLY,
    COMMIT,
    STAGE
}
