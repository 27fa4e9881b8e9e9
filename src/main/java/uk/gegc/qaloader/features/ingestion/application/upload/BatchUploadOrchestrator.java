package uk.gegc.qaloader.features.ingestion.application.upload;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.qaloader.features.ingestion.api.dto.BatchUploadResult;
import uk.gegc.qaloader.features.ingestion.api.dto.FailedUploadDto;
import uk.gegc.qaloader.features.ingestion.api.dto.ValidationResult;
import uk.gegc.qaloader.features.ingestion.application.id.BatchScopedIdLookup;
import uk.gegc.qaloader.features.ingestion.application.id.QuestionIdGenerator;
import uk.gegc.qaloader.features.ingestion.application.id.QuestionIdLookup;
import uk.gegc.qaloader.features.ingestion.application.scan.MarkdownBlockScanner;
import uk.gegc.qaloader.features.ingestion.application.validation.ContentCheckResult;
import uk.gegc.qaloader.features.ingestion.application.validation.ContentValidator;
import uk.gegc.qaloader.features.ingestion.application.validation.StructuralValidator;
import uk.gegc.qaloader.features.ingestion.config.IngestionProperties;
import uk.gegc.qaloader.features.ingestion.domain.model.IngestionStage;
import uk.gegc.qaloader.features.ingestion.domain.model.PersistenceErrorKind;
import uk.gegc.qaloader.features.ingestion.domain.model.QuestionBlock;
import uk.gegc.qaloader.features.ingestion.domain.model.UploadMetadata;
import uk.gegc.qaloader.features.ingestion.domain.model.UploadMode;
import uk.gegc.qaloader.features.ingestion.domain.model.ValidatedBlock;
import uk.gegc.qaloader.features.question.domain.model.QuestionRecord;
import uk.gegc.qaloader.shared.exception.IdGenerationException;
import uk.gegc.qaloader.shared.exception.NoValidBlocksException;

import java.time.Clock;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Runs one document through scanning, validation and, in commit mode, per-record persistence.
 * <p>
 * Each valid block is inserted on its own. A failing record is classified and reported while the
 * rest of the batch carries on; nothing wraps the whole batch in one transaction.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BatchUploadOrchestrator {

    private static final DateTimeFormatter UPLOADED_ON_FORMAT =
            DateTimeFormatter.ofPattern("MM/dd/yy h:mma 'ET'", Locale.US);

    private final MarkdownBlockScanner scanner;
    private final StructuralValidator structuralValidator;
    private final ContentValidator contentValidator;
    private final QuestionIdGenerator idGenerator;
    private final QuestionIdLookup idLookup;
    private final QuestionRecordWriter recordWriter;
    private final PersistenceErrorClassifier errorClassifier;
    private final IngestionProperties properties;
    private final Clock clock;

    public IngestionOutcome process(String rawText, UploadMode mode, UploadMetadata metadata) {
        CheckedDocument document = check(rawText, mode);
        if (mode == UploadMode.VALIDATE_ONLY) {
            enter(IngestionStage.VALIDATE_ONLY, mode);
            enter(IngestionStage.DONE, mode);
            return IngestionOutcome.validated(document.validation());
        }
        return new IngestionOutcome(document.validation(), commit(document, metadata));
    }

    /**
     * Scanning plus both validation passes. Nothing is stored.
     */
    public CheckedDocument check(String rawText, UploadMode mode) {
        long startedAt = clock.millis();
        enter(IngestionStage.RECEIVED, mode);

        List<QuestionBlock> blocks = scanner.scanAll(rawText);

        enter(IngestionStage.STRUCTURAL_VALIDATION, mode);
        List<String> errors = new ArrayList<>(structuralValidator.checkStructure(rawText, blocks));
        List<String> warnings = new ArrayList<>(structuralValidator.findSkippedTopics(rawText, blocks));

        enter(IngestionStage.CONTENT_VALIDATION, mode);
        ContentCheckResult content = contentValidator.checkContent(blocks);
        errors.addAll(content.errors());
        warnings.addAll(content.warnings());

        List<ValidatedBlock> validBlocks = content.validBlocks();
        ValidationResult validation = new ValidationResult(
                errors.isEmpty() && !validBlocks.isEmpty(),
                errors,
                warnings,
                validBlocks.size(),
                blocks.size());
        return new CheckedDocument(validation, validBlocks, startedAt);
    }

    /**
     * Stores the valid blocks of a checked document.
     *
     * @throws NoValidBlocksException when the document has no valid block
     */
    public BatchUploadResult commit(CheckedDocument document, UploadMetadata metadata) {
        ValidationResult validation = document.validation();
        if (document.validBlocks().isEmpty()) {
            log.info("Rejecting upload: {} blocks scanned, none valid", validation.blockCount());
            throw new NoValidBlocksException(validation);
        }

        List<RecordOutcome> outcomes = persistAll(document.validBlocks(), metadata);
        enter(IngestionStage.DONE, UploadMode.COMMIT);

        List<String> successfulIds = new ArrayList<>();
        List<FailedUploadDto> failures = new ArrayList<>();
        for (RecordOutcome outcome : outcomes) {
            if (outcome.stored()) {
                successfulIds.add(outcome.questionId());
            } else {
                failures.add(outcome.failure());
            }
        }

        BatchUploadResult upload = new BatchUploadResult(
                outcomes.size(),
                successfulIds,
                failures,
                validation.warnings(),
                validation.errors(),
                clock.millis() - document.startedAtMillis());

        log.info("Upload finished: {} attempted, {} stored, {} failed, {} blocks rejected by validation",
                upload.totalAttempted(), successfulIds.size(), failures.size(),
                validation.blockCount() - validation.parsedCount());
        return upload;
    }

    /**
     * Inserts each block on its own, in order. One outcome per block, in the same order.
     */
    public List<RecordOutcome> persistAll(List<ValidatedBlock> validBlocks, UploadMetadata metadata) {
        UploadMetadata stamped = stampUploadedOn(metadata);
        BatchScopedIdLookup batchLookup = new BatchScopedIdLookup(idLookup);

        enter(IngestionStage.ID_ASSIGNMENT, UploadMode.COMMIT);
        enter(IngestionStage.PERSISTENCE_LOOP, UploadMode.COMMIT);
        List<RecordOutcome> outcomes = new ArrayList<>(validBlocks.size());
        for (ValidatedBlock validBlock : validBlocks) {
            outcomes.add(persistOne(validBlock, stamped, batchLookup));
        }
        return outcomes;
    }

    private RecordOutcome persistOne(ValidatedBlock validBlock, UploadMetadata metadata, BatchScopedIdLookup batchLookup) {
        QuestionBlock block = validBlock.block();
        int maxAttempts = properties.getInsertMaxAttempts();
        String questionId = null;
        PersistenceFailure failure = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            questionId = null;
            try {
                questionId = idGenerator.generate(
                        block.topic(), block.subtopic(), validBlock.difficulty(), validBlock.type(), batchLookup);
                batchLookup.reserve(questionId);
                recordWriter.insert(toRecord(validBlock, questionId, metadata));
                return RecordOutcome.stored(validBlock, questionId);
            } catch (RuntimeException ex) {
                failure = errorClassifier.classify(ex, questionId);
                boolean retryable = failure.kind() == PersistenceErrorKind.DUPLICATE_ID
                        && !(ex instanceof IdGenerationException)
                        && attempt < maxAttempts;
                if (!retryable) {
                    break;
                }
                log.debug("Block {}: id {} taken at insert, assigning a new one (attempt {}/{})",
                        block.index(), questionId, attempt, maxAttempts);
            }
        }

        log.warn("Block {} (line {}) not stored as {}: {}",
                block.index(), block.startLine(), questionId, failure.message());
        return RecordOutcome.failed(validBlock, new FailedUploadDto(
                block.index(), block.startLine(), questionId, failure.kind(), failure.message()));
    }

    private QuestionRecord toRecord(ValidatedBlock validBlock, String questionId, UploadMetadata metadata) {
        QuestionBlock block = validBlock.block();
        QuestionRecord record = new QuestionRecord();
        record.setQuestionId(questionId);
        record.setTopic(block.topic());
        record.setSubtopic(block.subtopic());
        record.setDifficulty(validBlock.difficulty());
        record.setType(validBlock.type());
        record.setQuestion(block.question());
        record.setAnswer(block.answer());
        record.setNotesForTutor(block.notes());
        record.setUploadedBy(metadata.uploadedBy());
        record.setUploadNotes(metadata.uploadNotes());
        record.setUploadedOn(metadata.uploadedOn());
        return record;
    }

    UploadMetadata stampUploadedOn(UploadMetadata metadata) {
        UploadMetadata source = metadata != null ? metadata : UploadMetadata.empty();
        if (source.uploadedOn() != null && !source.uploadedOn().isBlank()) {
            return source;
        }
        ZoneId zone = ZoneId.of(properties.getUploadTimeZone());
        return source.withUploadedOn(UPLOADED_ON_FORMAT.format(clock.instant().atZone(zone)));
    }

    private void enter(IngestionStage stage, UploadMode mode) {
        log.debug("Ingestion [{}] -> {}", mode, stage);
    }
}
