package uk.gegc.qaloader.features.question.domain.model;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter(autoApply = true)
public class DifficultyConverter implements AttributeConverter<Difficulty, String> {

    @Override
    public String convertToDatabaseColumn(Difficulty attribute) {
        return attribute != null ? attribute.getLabel() : null;
    }

    @Override
    public Difficulty convertToEntityAttribute(String dbData) {
        if (dbData == null) {
            return null;
        }
        return Difficulty.fromLabel(dbData)
                .orElseThrow(() -> new IllegalStateException("Unknown difficulty in store: " + dbData));
    }
}
