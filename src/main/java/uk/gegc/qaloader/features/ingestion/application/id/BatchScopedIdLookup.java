package uk.gegc.qaloader.features.ingestion.application.id;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Store lookup that also treats ids handed out earlier in the same batch as taken,
 * whether or not their insert succeeded. One instance per upload.
 */
public class BatchScopedIdLookup implements QuestionIdLookup {

    private final QuestionIdLookup delegate;
    private final Set<String> reserved = new LinkedHashSet<>();

    public BatchScopedIdLookup(QuestionIdLookup delegate) {
        this.delegate = delegate;
    }

    public void reserve(String questionId) {
        reserved.add(questionId);
    }

    @Override
    public boolean existsById(String questionId) {
        return reserved.contains(questionId) || delegate.existsById(questionId);
    }

    @Override
    public int maxSequenceForPrefix(String prefix) {
        int max = delegate.maxSequenceForPrefix(prefix);
        for (String id : reserved) {
            int sequence = QuestionIdGenerator.sequenceOf(prefix, id);
            if (sequence > max) {
                max = sequence;
            }
        }
        return max;
    }
}
