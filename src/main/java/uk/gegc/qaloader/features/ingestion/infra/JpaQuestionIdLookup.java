package uk.gegc.qaloader.features.ingestion.infra;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.qaloader.features.ingestion.application.id.QuestionIdGenerator;
import uk.gegc.qaloader.features.ingestion.application.id.QuestionIdLookup;
import uk.gegc.qaloader.features.question.domain.repository.QuestionRecordRepository;

@Component
@RequiredArgsConstructor
public class JpaQuestionIdLookup implements QuestionIdLookup {

    private final QuestionRecordRepository questionRecordRepository;

    @Override
    @Transactional(readOnly = true)
    public boolean existsById(String questionId) {
        return questionRecordRepository.existsById(questionId);
    }

    @Override
    @Transactional(readOnly = true)
    public int maxSequenceForPrefix(String prefix) {
        return questionRecordRepository.findIdsWithPrefix(prefix).stream()
                .mapToInt(id -> QuestionIdGenerator.sequenceOf(prefix, id))
                .max()
                .orElse(0);
    }
}
