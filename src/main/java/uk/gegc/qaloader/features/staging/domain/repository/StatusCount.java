package uk.gegc.qaloader.features.staging.domain.repository;

import uk.gegc.qaloader.features.staging.domain.model.StagedQuestionStatus;

import java.util.UUID;

public record StatusCount(UUID batchId, StagedQuestionStatus status, Long count) {
}
