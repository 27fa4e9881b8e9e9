package uk.gegc.qaloader.features.staging.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import uk.gegc.qaloader.features.staging.domain.model.BatchStatus;
import uk.gegc.qaloader.features.staging.domain.model.UploadBatch;

import java.util.List;
import java.util.UUID;

@Repository
public interface UploadBatchRepository extends JpaRepository<UploadBatch, UUID> {

    List<UploadBatch> findAllByOrderByCreatedAtDesc();

    List<UploadBatch> findByStatusOrderByCreatedAtDesc(BatchStatus status);
}
