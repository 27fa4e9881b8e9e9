package uk.gegc.qaloader.features.staging.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.web.multipart.MultipartFile;
import uk.gegc.qaloader.features.ingestion.api.dto.FailedUploadDto;
import uk.gegc.qaloader.features.ingestion.application.MarkdownDocumentReader;
import uk.gegc.qaloader.features.ingestion.application.duplicate.DuplicateDetector;
import uk.gegc.qaloader.features.ingestion.application.duplicate.SimilarMatch;
import uk.gegc.qaloader.features.ingestion.application.upload.BatchUploadOrchestrator;
import uk.gegc.qaloader.features.ingestion.application.upload.CheckedDocument;
import uk.gegc.qaloader.features.ingestion.application.upload.RecordOutcome;
import uk.gegc.qaloader.features.ingestion.application.validation.UploadMetadataValidator;
import uk.gegc.qaloader.features.ingestion.domain.model.MarkdownDocument;
import uk.gegc.qaloader.features.ingestion.domain.model.QuestionBlock;
import uk.gegc.qaloader.features.ingestion.domain.model.UploadMetadata;
import uk.gegc.qaloader.features.ingestion.domain.model.UploadMode;
import uk.gegc.qaloader.features.ingestion.domain.model.ValidatedBlock;
import uk.gegc.qaloader.features.staging.api.dto.ImportResultDto;
import uk.gegc.qaloader.features.staging.api.dto.ReviewRequest;
import uk.gegc.qaloader.features.staging.api.dto.StagingResultDto;
import uk.gegc.qaloader.features.staging.api.dto.UploadBatchDetailDto;
import uk.gegc.qaloader.features.staging.api.dto.UploadBatchDto;
import uk.gegc.qaloader.features.staging.application.StagingService;
import uk.gegc.qaloader.features.staging.domain.model.BatchStatus;
import uk.gegc.qaloader.features.staging.domain.model.StagedQuestion;
import uk.gegc.qaloader.features.staging.domain.model.StagedQuestionStatus;
import uk.gegc.qaloader.features.staging.domain.model.StagingStateMachine;
import uk.gegc.qaloader.features.staging.domain.model.UploadBatch;
import uk.gegc.qaloader.features.staging.domain.repository.StagedQuestionRepository;
import uk.gegc.qaloader.features.staging.domain.repository.StatusCount;
import uk.gegc.qaloader.features.staging.domain.repository.UploadBatchRepository;
import uk.gegc.qaloader.features.staging.infra.mapping.StagingMapper;
import uk.gegc.qaloader.shared.exception.InvalidBatchStateException;
import uk.gegc.qaloader.shared.exception.NoValidBlocksException;
import uk.gegc.qaloader.shared.exception.ResourceNotFoundException;
import uk.gegc.qaloader.shared.exception.ValidationException;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
public class StagingServiceImpl implements StagingService {

    private static final List<StagedQuestionStatus> AWAITING_REVIEW =
            List.of(StagedQuestionStatus.PENDING, StagedQuestionStatus.DUPLICATE);

    private final MarkdownDocumentReader documentReader;
    private final UploadMetadataValidator metadataValidator;
    private final BatchUploadOrchestrator orchestrator;
    private final DuplicateDetector duplicateDetector;
    private final UploadBatchRepository uploadBatchRepository;
    private final StagedQuestionRepository stagedQuestionRepository;
    private final StagingMapper stagingMapper;
    private final PlatformTransactionManager transactionManager;
    private final Clock clock;

    @Override
    @Transactional
    public StagingResultDto stage(MultipartFile file, String uploadedBy, String uploadNotes, Double threshold) {
        metadataValidator.validate(new UploadMetadata(uploadedBy, uploadNotes, null));
        double resolved = duplicateDetector.resolveThreshold(threshold);
        MarkdownDocument document = documentReader.read(file);

        CheckedDocument checked = orchestrator.check(document.text(), UploadMode.STAGE);
        if (checked.validBlocks().isEmpty()) {
            throw new NoValidBlocksException(checked.validation());
        }

        UploadBatch batch = new UploadBatch();
        batch.setFileName(truncate(document.filename(), UploadBatch.FILE_NAME_MAX_LENGTH));
        batch.setUploadedBy(uploadedBy);
        batch.setUploadNotes(uploadNotes);
        batch.setStatus(BatchStatus.PENDING);
        batch.setTotalQuestions(checked.validBlocks().size());
        batch.setDuplicateThreshold(resolved);
        batch = uploadBatchRepository.save(batch);

        List<StagedQuestion> staged = new ArrayList<>();
        for (ValidatedBlock validBlock : checked.validBlocks()) {
            staged.add(toStagedQuestion(batch, validBlock));
        }
        flagDuplicates(staged, resolved);
        staged = stagedQuestionRepository.saveAll(staged);

        Map<StagedQuestionStatus, Long> counts = countInMemory(staged);
        log.info("Staged '{}' as batch {}: {} questions, {} flagged as duplicates",
                batch.getFileName(), batch.getId(), staged.size(),
                counts.getOrDefault(StagedQuestionStatus.DUPLICATE, 0L));
        return new StagingResultDto(stagingMapper.toDto(batch, counts), checked.validation(), stagingMapper.toDtos(staged));
    }

    @Override
    @Transactional(readOnly = true)
    public List<UploadBatchDto> listBatches(BatchStatus status) {
        List<UploadBatch> batches = status == null
                ? uploadBatchRepository.findAllByOrderByCreatedAtDesc()
                : uploadBatchRepository.findByStatusOrderByCreatedAtDesc(status);
        if (batches.isEmpty()) {
            return List.of();
        }
        Map<UUID, Map<StagedQuestionStatus, Long>> counts =
                countStored(batches.stream().map(UploadBatch::getId).toList());
        return batches.stream()
                .map(batch -> stagingMapper.toDto(batch, counts.get(batch.getId())))
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public UploadBatchDetailDto getBatch(UUID batchId, StagedQuestionStatus status) {
        UploadBatch batch = findBatch(batchId);
        List<StagedQuestion> questions = status == null
                ? stagedQuestionRepository.findByBatchId(batchId)
                : stagedQuestionRepository.findByBatchIdAndStatusIn(batchId, List.of(status));
        return detail(batch, questions);
    }

    @Override
    @Transactional
    public UploadBatchDetailDto detectDuplicates(UUID batchId, Double threshold) {
        double resolved = duplicateDetector.resolveThreshold(threshold);
        UploadBatch batch = findBatch(batchId);
        requireOpen(batch, "check duplicates of");

        List<StagedQuestion> awaiting = stagedQuestionRepository.findByBatchIdAndStatusIn(batchId, AWAITING_REVIEW);
        flagDuplicates(awaiting, resolved);
        batch.setDuplicateThreshold(resolved);
        log.info("Re-checked {} questions of batch {} at threshold {}", awaiting.size(), batchId, resolved);
        return detail(batch, stagedQuestionRepository.findByBatchId(batchId));
    }

    @Override
    @Transactional
    public UploadBatchDto review(UUID batchId, ReviewRequest request) {
        UploadBatch batch = findBatch(batchId);
        StagedQuestionStatus target = request.action().getTargetStatus();
        requireOpen(batch, "review questions of");

        Set<UUID> ids = new LinkedHashSet<>(request.stagedQuestionIds());
        List<StagedQuestion> questions = stagedQuestionRepository.findByBatchIdAndIdIn(batchId, ids);
        if (questions.size() != ids.size()) {
            Set<UUID> missing = new LinkedHashSet<>(ids);
            questions.forEach(question -> missing.remove(question.getId()));
            throw new ResourceNotFoundException("Staged questions " + missing + " not found in batch " + batchId);
        }
        for (StagedQuestion question : questions) {
            if (question.getStatus() != target && !StagingStateMachine.isValidTransition(question.getStatus(), target)) {
                throw new ValidationException("Staged question " + question.getId() + " in status "
                        + question.getStatus() + " cannot move to " + target);
            }
        }

        Instant now = clock.instant();
        for (StagedQuestion question : questions) {
            question.setStatus(target);
            question.setReviewedBy(request.reviewedBy());
            question.setReviewedAt(now);
            question.setReviewNotes(request.reviewNotes());
        }
        if (batch.getStatus() == BatchStatus.PENDING) {
            batch.setStatus(BatchStatus.REVIEWING);
            batch.setReviewStartedAt(now);
        }
        if (request.reviewedBy() != null) {
            batch.setReviewedBy(request.reviewedBy());
        }
        stagedQuestionRepository.flush();

        log.info("Batch {}: {} questions marked {} by {}", batchId, questions.size(), target, request.reviewedBy());
        return stagingMapper.toDto(batch, countStored(List.of(batchId)).get(batchId));
    }

    @Override
    public ImportResultDto importApproved(UUID batchId) {
        long startedAt = clock.millis();
        TransactionTemplate template = new TransactionTemplate(transactionManager);

        ImportPlan plan = template.execute(status -> {
            UploadBatch batch = findBatch(batchId);
            requireOpen(batch, "import");
            batch.setImportStartedAt(clock.instant());
            List<StagedQuestion> approved = stagedQuestionRepository.findByBatchIdAndStatusIn(
                    batchId, List.of(StagedQuestionStatus.APPROVED));
            return new ImportPlan(
                    new UploadMetadata(batch.getUploadedBy(), batch.getUploadNotes(), null),
                    approved.stream().map(StagedQuestion::getId).toList(),
                    approved.stream().map(this::toValidatedBlock).toList());
        });

        // Each record commits in its own transaction, outside the two batch updates.
        List<RecordOutcome> outcomes = plan.blocks().isEmpty()
                ? List.of()
                : orchestrator.persistAll(plan.blocks(), plan.metadata());

        return template.execute(status -> {
            UploadBatch batch = findBatch(batchId);
            Map<UUID, StagedQuestion> byId = stagedQuestionRepository.findAllById(plan.stagedIds()).stream()
                    .collect(Collectors.toMap(StagedQuestion::getId, Function.identity()));

            List<String> importedIds = new ArrayList<>();
            List<FailedUploadDto> failures = new ArrayList<>();
            for (int i = 0; i < outcomes.size(); i++) {
                RecordOutcome outcome = outcomes.get(i);
                StagedQuestion question = byId.get(plan.stagedIds().get(i));
                if (outcome.stored()) {
                    question.setStatus(StagedQuestionStatus.IMPORTED);
                    question.setImportedQuestionId(outcome.questionId());
                    question.setImportError(null);
                    importedIds.add(outcome.questionId());
                } else {
                    question.setImportError(truncate(outcome.failure().message(), StagedQuestion.IMPORT_ERROR_MAX_LENGTH));
                    failures.add(outcome.failure());
                }
            }

            batch.setImportCompletedAt(clock.instant());
            long awaiting = stagedQuestionRepository.findByBatchIdAndStatusIn(batchId, AWAITING_REVIEW).size();
            if (failures.isEmpty() && awaiting == 0) {
                batch.setStatus(BatchStatus.COMPLETED);
            }

            log.info("Imported batch {}: {} stored, {} failed, {} still awaiting review, status {}",
                    batchId, importedIds.size(), failures.size(), awaiting, batch.getStatus());
            return new ImportResultDto(batchId, outcomes.size(), importedIds, failures, batch.getStatus(),
                    clock.millis() - startedAt);
        });
    }

    @Override
    @Transactional
    public UploadBatchDto cancel(UUID batchId) {
        UploadBatch batch = findBatch(batchId);
        requireOpen(batch, "cancel");
        batch.setStatus(BatchStatus.CANCELLED);
        log.info("Batch {} cancelled", batchId);
        return stagingMapper.toDto(batch, countStored(List.of(batchId)).get(batchId));
    }

    /**
     * Flags questions resembling stored ones and clears the flag of those that no longer do.
     * The closest match is kept.
     */
    private void flagDuplicates(List<StagedQuestion> questions, double threshold) {
        if (questions.isEmpty()) {
            return;
        }
        Map<QuestionBlock, StagedQuestion> byBlock = new LinkedHashMap<>();
        for (StagedQuestion question : questions) {
            byBlock.put(toValidatedBlock(question).block(), question);
        }
        Map<QuestionBlock, List<SimilarMatch>> found = duplicateDetector.findDuplicates(
                new ArrayList<>(byBlock.keySet()), duplicateDetector.loadCorpus(), threshold);

        byBlock.forEach((block, question) -> {
            List<SimilarMatch> matches = found.get(block);
            if (matches == null || matches.isEmpty()) {
                if (question.getStatus() == StagedQuestionStatus.DUPLICATE) {
                    question.setStatus(StagedQuestionStatus.PENDING);
                }
                question.clearDuplicate();
                return;
            }
            SimilarMatch closest = matches.get(0);
            question.setStatus(StagedQuestionStatus.DUPLICATE);
            question.setDuplicateOf(closest.existingId());
            question.setSimilarityScore(closest.score());
        });
    }

    private StagedQuestion toStagedQuestion(UploadBatch batch, ValidatedBlock validBlock) {
        QuestionBlock block = validBlock.block();
        StagedQuestion question = new StagedQuestion();
        question.setBatch(batch);
        question.setBlockIndex(block.index());
        question.setStartLine(block.startLine());
        question.setTopic(block.topic());
        question.setSubtopic(block.subtopic());
        question.setDifficulty(validBlock.difficulty());
        question.setType(validBlock.type());
        question.setQuestion(block.question());
        question.setAnswer(block.answer());
        question.setNotesForTutor(block.notes());
        question.setStatus(StagedQuestionStatus.PENDING);
        return question;
    }

    private ValidatedBlock toValidatedBlock(StagedQuestion question) {
        QuestionBlock block = new QuestionBlock(
                question.getBlockIndex(),
                question.getStartLine(),
                question.getStartLine(),
                question.getTopic(),
                question.getSubtopic(),
                question.getDifficulty().getLabel(),
                question.getType().getLabel(),
                question.getQuestion(),
                question.getAnswer(),
                question.getNotesForTutor());
        return new ValidatedBlock(block, question.getDifficulty(), question.getType());
    }

    private UploadBatchDetailDto detail(UploadBatch batch, List<StagedQuestion> questions) {
        Map<StagedQuestionStatus, Long> counts = countStored(List.of(batch.getId())).get(batch.getId());
        return new UploadBatchDetailDto(stagingMapper.toDto(batch, counts), stagingMapper.toDtos(questions));
    }

    private Map<UUID, Map<StagedQuestionStatus, Long>> countStored(List<UUID> batchIds) {
        Map<UUID, Map<StagedQuestionStatus, Long>> counts = new HashMap<>();
        for (StatusCount row : stagedQuestionRepository.countByStatus(batchIds)) {
            counts.computeIfAbsent(row.batchId(), id -> new EnumMap<>(StagedQuestionStatus.class))
                    .put(row.status(), row.count());
        }
        return counts;
    }

    private static Map<StagedQuestionStatus, Long> countInMemory(List<StagedQuestion> questions) {
        Map<StagedQuestionStatus, Long> counts = new EnumMap<>(StagedQuestionStatus.class);
        questions.forEach(question -> counts.merge(question.getStatus(), 1L, Long::sum));
        return counts;
    }

    private UploadBatch findBatch(UUID batchId) {
        return uploadBatchRepository.findById(batchId)
                .orElseThrow(() -> new ResourceNotFoundException("Upload batch " + batchId + " not found"));
    }

    private static void requireOpen(UploadBatch batch, String action) {
        if (!batch.getStatus().isOpen()) {
            throw new InvalidBatchStateException(batch.getId(), batch.getStatus(), action);
        }
    }

    private static String truncate(String value, int max) {
        if (value == null || value.length() <= max) {
            return value;
        }
        return value.substring(0, max);
    }

    private record ImportPlan(UploadMetadata metadata, List<UUID> stagedIds, List<ValidatedBlock> blocks) {
    }
}
