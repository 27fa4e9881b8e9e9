package uk.gegc.qaloader.features.staging.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

@Schema(name = "UploadBatchDetailDto", description = "A batch together with its staged questions")
public record UploadBatchDetailDto(UploadBatchDto batch, List<StagedQuestionDto> questions) {

    public UploadBatchDetailDto {
        questions = questions == null ? List.of() : List.copyOf(questions);
    }
}
