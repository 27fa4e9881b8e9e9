package uk.gegc.qaloader.features.ingestion.domain.model;

public enum PersistenceErrorKind {
    DUPLICATE_ID,
    CONSTRAINT_VIOLATION,
    CONNECTION,
    UNKNOWN
}
