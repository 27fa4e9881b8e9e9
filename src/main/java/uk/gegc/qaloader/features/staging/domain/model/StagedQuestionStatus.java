package uk.gegc.qaloader.features.staging.domain.model;

public enum StagedQuestionStatus {
    PENDING,
    DUPLICATE,
    APPROVED,
    REJECTED,
    IMPORTED
}
