package uk.gegc.qaloader.features.ingestion.application.duplicate;

import java.util.List;

/**
 * Stored records linked, directly or transitively, by similarity at or above the scan threshold.
 */
public record DuplicateGroup(List<String> questionIds, double averageScore) {
    public DuplicateGroup {
        questionIds = List.copyOf(questionIds);
    }
}
