package uk.gegc.qaloader.features.staging.application;

import org.springframework.web.multipart.MultipartFile;
import uk.gegc.qaloader.features.staging.api.dto.ImportResultDto;
import uk.gegc.qaloader.features.staging.api.dto.ReviewRequest;
import uk.gegc.qaloader.features.staging.api.dto.StagingResultDto;
import uk.gegc.qaloader.features.staging.api.dto.UploadBatchDetailDto;
import uk.gegc.qaloader.features.staging.api.dto.UploadBatchDto;
import uk.gegc.qaloader.features.staging.domain.model.BatchStatus;
import uk.gegc.qaloader.features.staging.domain.model.StagedQuestionStatus;

import java.util.List;
import java.util.UUID;

/**
 * Review workflow in front of the question store: a file is staged as a batch, its questions are
 * approved or rejected, and only approved questions are imported.
 */
public interface StagingService {

    /**
     * Validates the file and stages every valid block. Blocks resembling stored questions are
     * flagged as duplicates at the given threshold.
     *
     * @throws uk.gegc.qaloader.shared.exception.NoValidBlocksException when no block survives validation
     */
    StagingResultDto stage(MultipartFile file, String uploadedBy, String uploadNotes, Double threshold);

    List<UploadBatchDto> listBatches(BatchStatus status);

    UploadBatchDetailDto getBatch(UUID batchId, StagedQuestionStatus status);

    /**
     * Re-runs duplicate detection for questions still waiting for review.
     */
    UploadBatchDetailDto detectDuplicates(UUID batchId, Double threshold);

    UploadBatchDto review(UUID batchId, ReviewRequest request);

    /**
     * Stores approved questions one by one, exactly like a direct upload. Failed questions stay
     * approved with the failure recorded so that a later import can retry them.
     */
    ImportResultDto importApproved(UUID batchId);

    UploadBatchDto cancel(UUID batchId);
}
