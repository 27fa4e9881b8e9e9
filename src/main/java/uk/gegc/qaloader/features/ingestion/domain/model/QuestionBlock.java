package uk.gegc.qaloader.features.ingestion.domain.model;

/**
 * One self-contained question unit as read from the document. Header values are kept raw;
 * question and answer are null when their marker is absent.
 */
public record QuestionBlock(
        int index,
        int startLine,
        int endLine,
        String topic,
        String subtopic,
        String difficulty,
        String type,
        String question,
        String answer,
        String notes
) {
    public boolean hasQuestionMarker() {
        return question != null;
    }

    public boolean hasAnswerMarker() {
        return answer != null;
    }
}
