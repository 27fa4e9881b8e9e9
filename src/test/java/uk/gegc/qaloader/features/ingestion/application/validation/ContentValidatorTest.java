package uk.gegc.qaloader.features.ingestion.application.validation;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import uk.gegc.qaloader.features.ingestion.config.IngestionProperties;
import uk.gegc.qaloader.features.ingestion.domain.model.QuestionBlock;
import uk.gegc.qaloader.features.ingestion.domain.model.ValidatedBlock;
import uk.gegc.qaloader.features.question.domain.model.Difficulty;
import uk.gegc.qaloader.features.question.domain.model.QuestionType;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ContentValidator")
class ContentValidatorTest {

    private ContentValidator validator;

    @BeforeEach
    void setUp() {
        validator = new ContentValidator(new IngestionProperties());
    }

    private static QuestionBlock block(int index, String difficulty, String type, String question, String answer) {
        return new QuestionBlock(index, index * 10, index * 10 + 5, "DCF", "WACC", difficulty, type, question, answer, null);
    }

    @Test
    @DisplayName("checkContent: valid block passes with resolved enums")
    void checkContent_validBlock_passes() {
        ContentCheckResult result = validator.checkContent(List.of(block(1, "Basic", "Definition", "What is WACC?", "A rate.")));

        assertThat(result.errors()).isEmpty();
        assertThat(result.warnings()).isEmpty();
        assertThat(result.validBlocks()).singleElement().satisfies(valid -> {
            assertThat(valid.difficulty()).isEqualTo(Difficulty.BASIC);
            assertThat(valid.type()).isEqualTo(QuestionType.DEFINITION);
        });
    }

    @Test
    @DisplayName("checkContent: unknown type names the value and the allowed set")
    void checkContent_invalidType_listsAllowedValues() {
        ContentCheckResult result = validator.checkContent(List.of(
                block(1, "Basic", "Medium", "Q", "A"),
                block(2, "Basic", "Problem", "Q", "A")));

        assertThat(result.errors()).singleElement().satisfies(error -> {
            assertThat(error).startsWith("Block 1 (line 10): Invalid type 'Medium'");
            assertThat(error).contains("Definition", "Problem", "GenConcept", "Calculation", "Analysis");
        });
        assertThat(result.validBlocks()).extracting(ValidatedBlock::index).containsExactly(2);
    }

    @Test
    @DisplayName("checkContent: Question is accepted and stored as GenConcept")
    void checkContent_questionSynonym_mapsToGenConcept() {
        ContentCheckResult result = validator.checkContent(List.of(block(1, "Advanced", "Question", "Q", "A")));

        assertThat(result.errors()).isEmpty();
        assertThat(result.validBlocks().get(0).type()).isEqualTo(QuestionType.GEN_CONCEPT);
    }

    @Test
    @DisplayName("checkContent: difficulty match is case-sensitive")
    void checkContent_difficultyCaseSensitive() {
        ContentCheckResult result = validator.checkContent(List.of(block(1, "basic", "Definition", "Q", "A")));

        assertThat(result.errors()).containsExactly(
                "Block 1 (line 10): Invalid difficulty 'basic'. Must be one of: Basic, Advanced");
        assertThat(result.validBlocks()).isEmpty();
    }

    @Test
    @DisplayName("checkContent: whitespace-only answer is always rejected")
    void checkContent_blankAnswer_rejected() {
        ContentCheckResult result = validator.checkContent(List.of(block(1, "Basic", "Definition", "Q", "")));

        assertThat(result.errors()).containsExactly("Block 1 (line 10): Answer content is empty");
        assertThat(result.validBlocks()).isEmpty();
    }

    @Test
    @DisplayName("checkContent: missing markers are reported in order")
    void checkContent_missingMarkers() {
        ContentCheckResult result = validator.checkContent(List.of(block(1, "Basic", "Definition", null, null)));

        assertThat(result.errors()).containsExactly(
                "Block 1 (line 10): Missing **Question:** section",
                "Block 1 (line 10): Missing **Answer:** section");
    }

    @Test
    @DisplayName("checkContent: long texts warn, over-limit texts fail")
    void checkContent_lengthLimits() {
        String longQuestion = "q".repeat(501);
        String longAnswer = "a".repeat(1001);
        String tooLongAnswer = "a".repeat(10001);

        ContentCheckResult result = validator.checkContent(List.of(
                block(1, "Basic", "Definition", longQuestion, longAnswer),
                block(2, "Basic", "Definition", "Q", tooLongAnswer)));

        assertThat(result.warnings()).containsExactly(
                "Block 1 (line 10): Question text is very long (501 characters)",
                "Block 1 (line 10): Answer text is very long (1001 characters)");
        assertThat(result.errors()).containsExactly(
                "Block 2 (line 20): Answer text exceeds 10000 characters (10001)");
        assertThat(result.validBlocks()).extracting(ValidatedBlock::index).containsExactly(1);
    }

    @Test
    @DisplayName("checkContent: topic over the header limit is rejected")
    void checkContent_topicTooLong() {
        QuestionBlock block = new QuestionBlock(1, 1, 6, "T".repeat(101), "WACC", "Basic", "Definition", "Q", "A", null);

        ContentCheckResult result = validator.checkContent(List.of(block));

        assertThat(result.errors()).containsExactly("Block 1 (line 1): Topic exceeds 100 characters (101)");
    }
}
