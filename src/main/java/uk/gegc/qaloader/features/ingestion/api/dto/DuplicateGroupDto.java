package uk.gegc.qaloader.features.ingestion.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

@Schema(name = "DuplicateGroupDto", description = "Stored records connected by pairwise similarity above the threshold")
public record DuplicateGroupDto(
        List<String> questionIds,
        double averageScore
) {
}
