package uk.gegc.qaloader.features.ingestion.application.id;

/**
 * Read access to the ids already taken in the store.
 */
public interface QuestionIdLookup {

    boolean existsById(String questionId);

    /**
     * Highest numeric sequence among ids of the form {@code prefix-NNN}, or 0 when there are none.
     */
    int maxSequenceForPrefix(String prefix);
}
