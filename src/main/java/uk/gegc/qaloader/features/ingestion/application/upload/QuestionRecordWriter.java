package uk.gegc.qaloader.features.ingestion.application.upload;

import uk.gegc.qaloader.features.question.domain.model.QuestionRecord;

/**
 * Stores exactly one record in its own unit of work. Failures surface as runtime exceptions.
 */
public interface QuestionRecordWriter {

    void insert(QuestionRecord record);
}
