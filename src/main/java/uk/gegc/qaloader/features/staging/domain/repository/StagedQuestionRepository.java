package uk.gegc.qaloader.features.staging.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import uk.gegc.qaloader.features.staging.domain.model.StagedQuestion;
import uk.gegc.qaloader.features.staging.domain.model.StagedQuestionStatus;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

@Repository
public interface StagedQuestionRepository extends JpaRepository<StagedQuestion, UUID> {

    @Query("SELECT s FROM StagedQuestion s WHERE s.batch.id = :batchId ORDER BY s.blockIndex")
    List<StagedQuestion> findByBatchId(@Param("batchId") UUID batchId);

    @Query("""
            SELECT s FROM StagedQuestion s
            WHERE s.batch.id = :batchId AND s.status IN :statuses
            ORDER BY s.blockIndex
            """)
    List<StagedQuestion> findByBatchIdAndStatusIn(@Param("batchId") UUID batchId,
                                                  @Param("statuses") Collection<StagedQuestionStatus> statuses);

    @Query("SELECT s FROM StagedQuestion s WHERE s.batch.id = :batchId AND s.id IN :ids ORDER BY s.blockIndex")
    List<StagedQuestion> findByBatchIdAndIdIn(@Param("batchId") UUID batchId, @Param("ids") Collection<UUID> ids);

    @Query("""
            SELECT new uk.gegc.qaloader.features.staging.domain.repository.StatusCount(
                s.batch.id, s.status, COUNT(s))
            FROM StagedQuestion s
            WHERE s.batch.id IN :batchIds
            GROUP BY s.batch.id, s.status
            """)
    List<StatusCount> countByStatus(@Param("batchIds") Collection<UUID> batchIds);
}
