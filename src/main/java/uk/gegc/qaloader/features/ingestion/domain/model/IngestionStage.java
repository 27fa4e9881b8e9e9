package uk.gegc.qaloader.features.ingestion.domain.model;

public enum IngestionStage {
    RECEIVED,
    STRUCTURAL_VALIDATION,
    CONTENT_VALIDATION,
    VALIDATE_ONLY,
    ID_ASSIGNMENT,
    PERSISTENCE_LOOP,
    DONE
}
