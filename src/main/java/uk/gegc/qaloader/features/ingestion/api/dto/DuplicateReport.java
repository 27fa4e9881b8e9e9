package uk.gegc.qaloader.features.ingestion.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

@Schema(name = "DuplicateReport", description = "Advisory duplicate check of a document against stored records")
public record DuplicateReport(
        double threshold,
        int candidatesChecked,
        List<DuplicateMatchDto> duplicates,
        int exactCount,
        int nearCount
) {
    public DuplicateReport {
        duplicates = duplicates == null ? List.of() : List.copyOf(duplicates);
    }
}
