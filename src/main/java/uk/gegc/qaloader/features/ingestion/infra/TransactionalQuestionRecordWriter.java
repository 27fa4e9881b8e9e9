package uk.gegc.qaloader.features.ingestion.infra;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;
import uk.gegc.qaloader.features.ingestion.application.upload.QuestionRecordWriter;
import uk.gegc.qaloader.features.question.domain.model.QuestionRecord;
import uk.gegc.qaloader.features.question.domain.repository.QuestionRecordRepository;

/**
 * Inserts each record in a fresh {@code REQUIRES_NEW} transaction and flushes immediately,
 * so constraint violations surface here rather than at some later commit.
 */
@Slf4j
@Component
public class TransactionalQuestionRecordWriter implements QuestionRecordWriter {

    private final QuestionRecordRepository questionRecordRepository;
    private final TransactionTemplate transactionTemplate;

    public TransactionalQuestionRecordWriter(QuestionRecordRepository questionRecordRepository,
                                             PlatformTransactionManager transactionManager) {
        this.questionRecordRepository = questionRecordRepository;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    @Override
    public void insert(QuestionRecord record) {
        transactionTemplate.executeWithoutResult(status -> questionRecordRepository.saveAndFlush(record));
        log.debug("Stored question {}", record.getQuestionId());
    }
}
