package uk.gegc.qaloader.features.question.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.qaloader.features.question.domain.model.QuestionRecord;

import java.util.List;

@Repository
public interface QuestionRecordRepository extends JpaRepository<QuestionRecord, String> {

    @Query("SELECT q.questionId FROM QuestionRecord q WHERE q.questionId LIKE CONCAT(:prefix, '-%')")
    List<String> findIdsWithPrefix(@Param("prefix") String prefix);

    @Query("""
            SELECT new uk.gegc.qaloader.features.question.domain.repository.CorpusEntry(
                q.questionId, q.question, q.topic)
            FROM QuestionRecord q
            ORDER BY q.questionId
            """)
    List<CorpusEntry> findCorpus();

    @Modifying
    @Transactional
    @Query("DELETE FROM QuestionRecord q WHERE q.topic = :topic")
    int deleteByTopic(@Param("topic") String topic);
}
