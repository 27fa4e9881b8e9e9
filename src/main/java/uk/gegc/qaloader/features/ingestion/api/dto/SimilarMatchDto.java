package uk.gegc.qaloader.features.ingestion.api.dto;

public record SimilarMatchDto(String existingId, double similarityScore, boolean exact) {
}
