package uk.gegc.qaloader.features.ingestion.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

@Schema(name = "DuplicateMatchDto", description = "Stored records resembling one candidate block")
public record DuplicateMatchDto(
        int blockIndex,
        int startLine,
        String question,
        List<SimilarMatchDto> matches
) {
}
