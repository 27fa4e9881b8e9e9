package uk.gegc.qaloader.features.staging.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.qaloader.features.ingestion.api.dto.ValidationResult;

import java.util.List;

@Schema(name = "StagingResultDto", description = "A freshly staged batch plus the validation report of its file")
public record StagingResultDto(UploadBatchDto batch, ValidationResult validation, List<StagedQuestionDto> questions) {

    public StagingResultDto {
        questions = questions == null ? List.of() : List.copyOf(questions);
    }
}
