package uk.gegc.qaloader.features.ingestion.application.duplicate;

public record SimilarMatch(String existingId, double score, boolean exact) {
}
