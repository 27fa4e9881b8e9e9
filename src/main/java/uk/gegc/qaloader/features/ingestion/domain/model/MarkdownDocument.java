package uk.gegc.qaloader.features.ingestion.domain.model;

public record MarkdownDocument(String filename, long sizeBytes, String text) {
}
