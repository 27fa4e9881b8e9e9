package uk.gegc.qaloader.features.question.domain.repository;

/**
 * Read-only projection of the columns duplicate detection needs.
 */
public record CorpusEntry(String questionId, String question, String topic) {
}
