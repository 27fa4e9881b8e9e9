package uk.gegc.qaloader.features.staging.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.qaloader.features.question.domain.model.Difficulty;
import uk.gegc.qaloader.features.question.domain.model.QuestionType;
import uk.gegc.qaloader.features.staging.domain.model.StagedQuestionStatus;

import java.time.Instant;
import java.util.UUID;

@Schema(name = "StagedQuestionDto", description = "A question held in a batch")
public record StagedQuestionDto(
        UUID id,
        int blockIndex,
        int startLine,
        String topic,
        String subtopic,
        Difficulty difficulty,
        QuestionType type,
        String question,
        String answer,
        String notesForTutor,
        StagedQuestionStatus status,
        @Schema(description = "Closest stored question when flagged as a duplicate")
        String duplicateOf,
        Double similarityScore,
        String reviewNotes,
        String reviewedBy,
        Instant reviewedAt,
        @Schema(description = "Id assigned on import")
        String importedQuestionId,
        @Schema(description = "Reason of the last failed import attempt")
        String importError
) {
}
