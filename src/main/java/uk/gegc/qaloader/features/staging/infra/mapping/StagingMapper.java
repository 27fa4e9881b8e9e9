package uk.gegc.qaloader.features.staging.infra.mapping;

import org.springframework.stereotype.Component;
import uk.gegc.qaloader.features.staging.api.dto.StagedQuestionDto;
import uk.gegc.qaloader.features.staging.api.dto.UploadBatchDto;
import uk.gegc.qaloader.features.staging.domain.model.StagedQuestion;
import uk.gegc.qaloader.features.staging.domain.model.StagedQuestionStatus;
import uk.gegc.qaloader.features.staging.domain.model.UploadBatch;

import java.util.List;
import java.util.Map;

@Component
public class StagingMapper {

    public UploadBatchDto toDto(UploadBatch batch, Map<StagedQuestionStatus, Long> counts) {
        if (batch == null) {
            return null;
        }
        Map<StagedQuestionStatus, Long> byStatus = counts != null ? counts : Map.of();
        return new UploadBatchDto(
                batch.getId(),
                batch.getFileName(),
                batch.getUploadedBy(),
                batch.getUploadNotes(),
                batch.getStatus(),
                batch.getDuplicateThreshold(),
                batch.getTotalQuestions(),
                byStatus.getOrDefault(StagedQuestionStatus.PENDING, 0L),
                byStatus.getOrDefault(StagedQuestionStatus.DUPLICATE, 0L),
                byStatus.getOrDefault(StagedQuestionStatus.APPROVED, 0L),
                byStatus.getOrDefault(StagedQuestionStatus.REJECTED, 0L),
                byStatus.getOrDefault(StagedQuestionStatus.IMPORTED, 0L),
                batch.getReviewedBy(),
                batch.getCreatedAt(),
                batch.getReviewStartedAt(),
                batch.getImportCompletedAt());
    }

    public StagedQuestionDto toDto(StagedQuestion question) {
        if (question == null) {
            return null;
        }
        return new StagedQuestionDto(
                question.getId(),
                question.getBlockIndex(),
                question.getStartLine(),
                question.getTopic(),
                question.getSubtopic(),
                question.getDifficulty(),
                question.getType(),
                question.getQuestion(),
                question.getAnswer(),
                question.getNotesForTutor(),
                question.getStatus(),
                question.getDuplicateOf(),
                question.getSimilarityScore(),
                question.getReviewNotes(),
                question.getReviewedBy(),
                question.getReviewedAt(),
                question.getImportedQuestionId(),
                question.getImportError());
    }

    public List<StagedQuestionDto> toDtos(List<StagedQuestion> questions) {
        return questions.stream().map(this::toDto).toList();
    }
}
