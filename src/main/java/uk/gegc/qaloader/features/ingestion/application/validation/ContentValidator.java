package uk.gegc.qaloader.features.ingestion.application.validation;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.qaloader.features.ingestion.config.IngestionProperties;
import uk.gegc.qaloader.features.ingestion.domain.model.QuestionBlock;
import uk.gegc.qaloader.features.ingestion.domain.model.ValidatedBlock;
import uk.gegc.qaloader.features.question.domain.model.Difficulty;
import uk.gegc.qaloader.features.question.domain.model.QuestionType;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Field-level checks, block by block. A failing block is left out of the valid list
 * but never stops the others from being checked.
 */
@Component
@RequiredArgsConstructor
public class ContentValidator {

    private final IngestionProperties properties;

    public ContentCheckResult checkContent(List<QuestionBlock> blocks) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        List<ValidatedBlock> validBlocks = new ArrayList<>();

        for (QuestionBlock block : blocks) {
            int errorsBefore = errors.size();
            String prefix = "Block " + block.index() + " (line " + block.startLine() + "): ";

            if (!block.hasQuestionMarker()) {
                errors.add(prefix + "Missing **Question:** section");
            }
            if (!block.hasAnswerMarker()) {
                errors.add(prefix + "Missing **Answer:** section");
            }

            Optional<QuestionType> type = QuestionType.fromLabel(block.type());
            if (type.isEmpty()) {
                errors.add(prefix + "Invalid type '" + block.type() + "'. Must be one of: "
                        + String.join(", ", QuestionType.labels())
                        + " ('" + QuestionType.QUESTION_SYNONYM + "' is stored as GenConcept)");
            }

            Optional<Difficulty> difficulty = Difficulty.fromLabel(block.difficulty());
            if (difficulty.isEmpty()) {
                errors.add(prefix + "Invalid difficulty '" + block.difficulty() + "'. Must be one of: "
                        + String.join(", ", Difficulty.labels()));
            }

            if (block.hasAnswerMarker() && block.answer().isBlank()) {
                errors.add(prefix + "Answer content is empty");
            }
            if (block.hasQuestionMarker() && block.question().isBlank()) {
                errors.add(prefix + "Question content is empty");
            }

            validateHeaderLength(prefix, "Topic", block.topic(), errors);
            validateHeaderLength(prefix, "Subtopic", block.subtopic(), errors);
            validateTextLengths(prefix, block, errors, warnings);

            if (errors.size() == errorsBefore) {
                validBlocks.add(new ValidatedBlock(block, difficulty.get(), type.get()));
            }
        }

        return new ContentCheckResult(errors, warnings, validBlocks);
    }

    private void validateHeaderLength(String prefix, String label, String value, List<String> errors) {
        int limit = properties.getHeaderMaxLength();
        if (value != null && value.length() > limit) {
            errors.add(prefix + label + " exceeds " + limit + " characters (" + value.length() + ")");
        }
    }

    private void validateTextLengths(String prefix, QuestionBlock block, List<String> errors, List<String> warnings) {
        if (block.hasQuestionMarker()) {
            int length = block.question().length();
            if (length > properties.getQuestionMaxLength()) {
                errors.add(prefix + "Question text exceeds " + properties.getQuestionMaxLength() + " characters (" + length + ")");
            } else if (length > properties.getQuestionWarningLength()) {
                warnings.add(prefix + "Question text is very long (" + length + " characters)");
            }
        }
        if (block.hasAnswerMarker()) {
            int length = block.answer().length();
            if (length > properties.getAnswerMaxLength()) {
                errors.add(prefix + "Answer text exceeds " + properties.getAnswerMaxLength() + " characters (" + length + ")");
            } else if (length > properties.getAnswerWarningLength()) {
                warnings.add(prefix + "Answer text is very long (" + length + " characters)");
            }
        }
    }
}
