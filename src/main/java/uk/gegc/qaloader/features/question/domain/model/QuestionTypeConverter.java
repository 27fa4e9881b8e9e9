package uk.gegc.qaloader.features.question.domain.model;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter(autoApply = true)
public class QuestionTypeConverter implements AttributeConverter<QuestionType, String> {

    @Override
    public String convertToDatabaseColumn(QuestionType attribute) {
        return attribute != null ? attribute.getLabel() : null;
    }

    @Override
    public QuestionType convertToEntityAttribute(String dbData) {
        if (dbData == null) {
            return null;
        }
        return QuestionType.fromLabel(dbData)
                .orElseThrow(() -> new IllegalStateException("Unknown question type in store: " + dbData));
    }
}
