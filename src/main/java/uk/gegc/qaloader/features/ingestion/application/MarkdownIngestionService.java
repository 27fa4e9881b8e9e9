package uk.gegc.qaloader.features.ingestion.application;

import org.springframework.web.multipart.MultipartFile;
import uk.gegc.qaloader.features.ingestion.api.dto.BatchUploadResult;
import uk.gegc.qaloader.features.ingestion.api.dto.DuplicateGroupDto;
import uk.gegc.qaloader.features.ingestion.api.dto.DuplicateReport;
import uk.gegc.qaloader.features.ingestion.api.dto.TopicReplaceResult;
import uk.gegc.qaloader.features.ingestion.api.dto.ValidationResult;
import uk.gegc.qaloader.features.ingestion.domain.model.UploadMetadata;

import java.util.List;

public interface MarkdownIngestionService {

    /**
     * Checks a document without storing anything. Content problems are reported, never thrown.
     */
    ValidationResult validate(MultipartFile file);

    /**
     * Stores every valid block of the document, each on its own.
     *
     * @throws uk.gegc.qaloader.shared.exception.NoValidBlocksException when no block survives validation
     */
    BatchUploadResult upload(MultipartFile file, UploadMetadata metadata);

    /**
     * Deletes every stored question of {@code topic}, then stores the document like {@link #upload}.
     * The deletion happens only once the document is known to hold valid blocks of that topic alone.
     *
     * @throws uk.gegc.qaloader.shared.exception.ValidationException when a valid block names another topic
     */
    TopicReplaceResult replaceTopic(String topic, MultipartFile file, UploadMetadata metadata);

    DuplicateReport checkDuplicates(MultipartFile file, Double threshold);

    List<DuplicateGroupDto> scanDuplicates(Double threshold);
}
