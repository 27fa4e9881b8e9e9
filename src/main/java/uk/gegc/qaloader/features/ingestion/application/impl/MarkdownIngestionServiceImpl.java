package uk.gegc.qaloader.features.ingestion.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;
import uk.gegc.qaloader.features.ingestion.api.dto.BatchUploadResult;
import uk.gegc.qaloader.features.ingestion.api.dto.DuplicateGroupDto;
import uk.gegc.qaloader.features.ingestion.api.dto.DuplicateMatchDto;
import uk.gegc.qaloader.features.ingestion.api.dto.DuplicateReport;
import uk.gegc.qaloader.features.ingestion.api.dto.SimilarMatchDto;
import uk.gegc.qaloader.features.ingestion.api.dto.TopicReplaceResult;
import uk.gegc.qaloader.features.ingestion.api.dto.ValidationResult;
import uk.gegc.qaloader.features.ingestion.application.MarkdownDocumentReader;
import uk.gegc.qaloader.features.ingestion.application.MarkdownIngestionService;
import uk.gegc.qaloader.features.ingestion.application.duplicate.DuplicateDetector;
import uk.gegc.qaloader.features.ingestion.application.duplicate.IndexedCorpus;
import uk.gegc.qaloader.features.ingestion.application.duplicate.SimilarMatch;
import uk.gegc.qaloader.features.ingestion.application.scan.MarkdownBlockScanner;
import uk.gegc.qaloader.features.ingestion.application.upload.BatchUploadOrchestrator;
import uk.gegc.qaloader.features.ingestion.application.upload.CheckedDocument;
import uk.gegc.qaloader.features.ingestion.application.validation.UploadMetadataValidator;
import uk.gegc.qaloader.features.ingestion.domain.model.MarkdownDocument;
import uk.gegc.qaloader.features.ingestion.domain.model.QuestionBlock;
import uk.gegc.qaloader.features.ingestion.domain.model.UploadMetadata;
import uk.gegc.qaloader.features.ingestion.domain.model.UploadMode;
import uk.gegc.qaloader.features.question.domain.repository.QuestionRecordRepository;
import uk.gegc.qaloader.shared.exception.NoValidBlocksException;
import uk.gegc.qaloader.shared.exception.ValidationException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class MarkdownIngestionServiceImpl implements MarkdownIngestionService {

    private final MarkdownDocumentReader documentReader;
    private final BatchUploadOrchestrator orchestrator;
    private final MarkdownBlockScanner scanner;
    private final DuplicateDetector duplicateDetector;
    private final UploadMetadataValidator metadataValidator;
    private final QuestionRecordRepository questionRecordRepository;

    @Override
    public ValidationResult validate(MultipartFile file) {
        MarkdownDocument document = documentReader.read(file);
        log.info("Validating '{}' ({} bytes)", document.filename(), document.sizeBytes());
        return orchestrator.process(document.text(), UploadMode.VALIDATE_ONLY, null).validation();
    }

    @Override
    public BatchUploadResult upload(MultipartFile file, UploadMetadata metadata) {
        metadataValidator.validate(metadata);
        MarkdownDocument document = documentReader.read(file);
        log.info("Uploading '{}' ({} bytes)", document.filename(), document.sizeBytes());
        return orchestrator.process(document.text(), UploadMode.COMMIT, metadata).upload();
    }

    @Override
    public TopicReplaceResult replaceTopic(String topic, MultipartFile file, UploadMetadata metadata) {
        if (topic == null || topic.isBlank()) {
            throw new ValidationException("Topic is required");
        }
        String target = topic.trim();
        metadataValidator.validate(metadata);
        MarkdownDocument document = documentReader.read(file);

        CheckedDocument checked = orchestrator.check(document.text(), UploadMode.COMMIT);
        if (checked.validBlocks().isEmpty()) {
            throw new NoValidBlocksException(checked.validation());
        }
        List<String> foreign = checked.validBlocks().stream()
                .filter(validBlock -> !target.equals(validBlock.block().topic()))
                .map(validBlock -> "Block " + validBlock.index() + " (line " + validBlock.block().startLine()
                        + "): topic '" + validBlock.block().topic() + "'")
                .toList();
        if (!foreign.isEmpty()) {
            throw new ValidationException("Replacing topic '" + target + "' accepts only questions of that topic. "
                    + String.join("; ", foreign));
        }

        int removed = questionRecordRepository.deleteByTopic(target);
        log.info("Replacing topic '{}' from '{}': removed {} stored questions", target, document.filename(), removed);
        return new TopicReplaceResult(target, removed, orchestrator.commit(checked, metadata));
    }

    @Override
    public DuplicateReport checkDuplicates(MultipartFile file, Double threshold) {
        double resolved = duplicateDetector.resolveThreshold(threshold);
        MarkdownDocument document = documentReader.read(file);
        List<QuestionBlock> candidates = scanner.scanAll(document.text());

        IndexedCorpus corpus = duplicateDetector.loadCorpus();
        Map<QuestionBlock, List<SimilarMatch>> found = duplicateDetector.findDuplicates(candidates, corpus, resolved);

        List<DuplicateMatchDto> duplicates = new ArrayList<>();
        int exactCount = 0;
        int nearCount = 0;
        for (Map.Entry<QuestionBlock, List<SimilarMatch>> entry : found.entrySet()) {
            QuestionBlock block = entry.getKey();
            List<SimilarMatchDto> matches = entry.getValue().stream()
                    .map(match -> new SimilarMatchDto(match.existingId(), match.score(), match.exact()))
                    .toList();
            for (SimilarMatch match : entry.getValue()) {
                if (match.exact()) {
                    exactCount++;
                } else {
                    nearCount++;
                }
            }
            duplicates.add(new DuplicateMatchDto(block.index(), block.startLine(), block.question(), matches));
        }

        log.info("Duplicate check of '{}': {} of {} blocks resemble stored questions ({} exact, {} near)",
                document.filename(), duplicates.size(), candidates.size(), exactCount, nearCount);
        return new DuplicateReport(resolved, candidates.size(), duplicates, exactCount, nearCount);
    }

    @Override
    public List<DuplicateGroupDto> scanDuplicates(Double threshold) {
        double resolved = duplicateDetector.resolveThreshold(threshold);
        return duplicateDetector.scanCorpus(duplicateDetector.loadCorpus(), resolved).stream()
                .map(group -> new DuplicateGroupDto(group.questionIds(), group.averageScore()))
                .toList();
    }
}
