package uk.gegc.qaloader.features.ingestion.domain.model;

import uk.gegc.qaloader.features.question.domain.model.Difficulty;
import uk.gegc.qaloader.features.question.domain.model.QuestionType;

/**
 * A block that passed every content check, with its header labels resolved.
 */
public record ValidatedBlock(QuestionBlock block, Difficulty difficulty, QuestionType type) {

    public int index() {
        return block.index();
    }
}
