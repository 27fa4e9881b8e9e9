package uk.gegc.qaloader.features.question.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Question categories accepted by the store. The label is what gets persisted,
 * the code is the single letter used inside semantic question ids.
 */
public enum QuestionType {
    DEFINITION("Definition", 'D'),
    PROBLEM("Problem", 'P'),
    GEN_CONCEPT("GenConcept", 'G'),
    CALCULATION("Calculation", 'C'),
    ANALYSIS("Analysis", 'A');

    /**
     * Label used by the front end for conceptual questions; stored as {@link #GEN_CONCEPT}.
     */
    public static final String QUESTION_SYNONYM = "Question";

    private final String label;
    private final char code;

    QuestionType(String label, char code) {
        this.label = label;
        this.code = code;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public char getCode() {
        return code;
    }

    /**
     * Resolves a header value, normalizing the front-end synonym. Matching is case-sensitive.
     */
    public static Optional<QuestionType> fromLabel(String rawValue) {
        if (rawValue == null) {
            return Optional.empty();
        }
        String trimmed = rawValue.trim();
        if (QUESTION_SYNONYM.equals(trimmed)) {
            return Optional.of(GEN_CONCEPT);
        }
        return Arrays.stream(values())
                .filter(type -> type.label.equals(trimmed))
                .findFirst();
    }

    public static List<String> labels() {
        return Arrays.stream(values()).map(QuestionType::getLabel).toList();
    }
}
