package uk.gegc.qaloader.features.question.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

public enum Difficulty {
    BASIC("Basic", 'B'),
    ADVANCED("Advanced", 'A');

    private final String label;
    private final char code;

    Difficulty(String label, char code) {
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
     * Exact, case-sensitive match against the stored labels.
     */
    public static Optional<Difficulty> fromLabel(String rawValue) {
        if (rawValue == null) {
            return Optional.empty();
        }
        String trimmed = rawValue.trim();
        return Arrays.stream(values())
                .filter(difficulty -> difficulty.label.equals(trimmed))
                .findFirst();
    }

    public static List<String> labels() {
        return Arrays.stream(values()).map(Difficulty::getLabel).toList();
    }
}
