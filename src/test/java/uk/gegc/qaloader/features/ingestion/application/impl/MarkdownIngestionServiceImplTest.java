package uk.gegc.qaloader.features.ingestion.application.impl;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.InjectMocks;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.Spy;
import org.springframework.mock.web.MockMultipartFile;
import uk.gegc.qaloader.BaseUnitTest;
import uk.gegc.qaloader.features.ingestion.api.dto.BatchUploadResult;
import uk.gegc.qaloader.features.ingestion.api.dto.DuplicateGroupDto;
import uk.gegc.qaloader.features.ingestion.api.dto.DuplicateReport;
import uk.gegc.qaloader.features.ingestion.api.dto.TopicReplaceResult;
import uk.gegc.qaloader.features.ingestion.api.dto.ValidationResult;
import uk.gegc.qaloader.features.ingestion.application.MarkdownDocumentReader;
import uk.gegc.qaloader.features.ingestion.application.duplicate.DuplicateDetector;
import uk.gegc.qaloader.features.ingestion.application.duplicate.DuplicateGroup;
import uk.gegc.qaloader.features.ingestion.application.duplicate.IndexedCorpus;
import uk.gegc.qaloader.features.ingestion.application.duplicate.SimilarMatch;
import uk.gegc.qaloader.features.ingestion.application.scan.MarkdownBlockScanner;
import uk.gegc.qaloader.features.ingestion.application.upload.BatchUploadOrchestrator;
import uk.gegc.qaloader.features.ingestion.application.upload.CheckedDocument;
import uk.gegc.qaloader.features.ingestion.application.upload.IngestionOutcome;
import uk.gegc.qaloader.features.ingestion.application.validation.UploadMetadataValidator;
import uk.gegc.qaloader.features.ingestion.domain.model.MarkdownDocument;
import uk.gegc.qaloader.features.ingestion.domain.model.QuestionBlock;
import uk.gegc.qaloader.features.ingestion.domain.model.UploadMetadata;
import uk.gegc.qaloader.features.ingestion.domain.model.UploadMode;
import uk.gegc.qaloader.features.ingestion.domain.model.ValidatedBlock;
import uk.gegc.qaloader.features.question.domain.model.Difficulty;
import uk.gegc.qaloader.features.question.domain.model.QuestionType;
import uk.gegc.qaloader.features.question.domain.repository.QuestionRecordRepository;
import uk.gegc.qaloader.shared.exception.NoValidBlocksException;
import uk.gegc.qaloader.shared.exception.ValidationException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@DisplayName("MarkdownIngestionServiceImpl")
class MarkdownIngestionServiceImplTest extends BaseUnitTest {

    private static final MockMultipartFile FILE =
            new MockMultipartFile("file", "dcf.md", "text/markdown", new byte[]{'#'});
    private static final MarkdownDocument DOCUMENT = new MarkdownDocument("dcf.md", 1, "# Topic: DCF");

    @Mock
    private MarkdownDocumentReader documentReader;

    @Mock
    private BatchUploadOrchestrator orchestrator;

    @Mock
    private MarkdownBlockScanner scanner;

    @Mock
    private DuplicateDetector duplicateDetector;

    @Mock
    private QuestionRecordRepository questionRecordRepository;

    @Spy
    private UploadMetadataValidator metadataValidator = new UploadMetadataValidator();

    @InjectMocks
    private MarkdownIngestionServiceImpl service;

    private static ValidatedBlock validBlock(int index, String topic) {
        QuestionBlock block = new QuestionBlock(index, index * 7, index * 7 + 5, topic, "WACC", "Basic", "Definition",
                "Q" + index, "A", null);
        return new ValidatedBlock(block, Difficulty.BASIC, QuestionType.DEFINITION);
    }

    @Test
    @DisplayName("validate: runs the orchestrator in validate-only mode")
    void validate_delegatesValidateOnly() {
        ValidationResult validation = new ValidationResult(true, List.of(), List.of(), 1, 1);
        when(documentReader.read(FILE)).thenReturn(DOCUMENT);
        when(orchestrator.process(DOCUMENT.text(), UploadMode.VALIDATE_ONLY, null))
                .thenReturn(IngestionOutcome.validated(validation));

        assertThat(service.validate(FILE)).isSameAs(validation);
    }

    @Test
    @DisplayName("upload: commits with the caller's metadata")
    void upload_delegatesCommit() {
        UploadMetadata metadata = new UploadMetadata("alice", null, null);
        ValidationResult validation = new ValidationResult(true, List.of(), List.of(), 1, 1);
        BatchUploadResult result = new BatchUploadResult(1, List.of("DCF-WACC-B-D-001"), List.of(), List.of(), List.of(), 3);
        when(documentReader.read(FILE)).thenReturn(DOCUMENT);
        when(orchestrator.process(DOCUMENT.text(), UploadMode.COMMIT, metadata))
                .thenReturn(new IngestionOutcome(validation, result));

        assertThat(service.upload(FILE, metadata)).isSameAs(result);
    }

    @Test
    @DisplayName("upload: uploader name longer than the column is refused before reading the file")
    void upload_uploadedByTooLong() {
        UploadMetadata metadata = new UploadMetadata("x".repeat(26), null, null);

        assertThatThrownBy(() -> service.upload(FILE, metadata))
                .isInstanceOf(ValidationException.class)
                .hasMessage("uploadedBy must be at most 25 characters");
        verifyNoInteractions(documentReader, orchestrator);
    }

    @Test
    @DisplayName("upload: upload notes longer than the column are refused")
    void upload_uploadNotesTooLong() {
        UploadMetadata metadata = new UploadMetadata(null, "n".repeat(101), null);

        assertThatThrownBy(() -> service.upload(FILE, metadata))
                .isInstanceOf(ValidationException.class)
                .hasMessage("uploadNotes must be at most 100 characters");
    }

    @Test
    @DisplayName("replaceTopic: deletes the topic, then commits the checked document")
    void replaceTopic_deletesThenCommits() {
        UploadMetadata metadata = new UploadMetadata("alice", null, null);
        ValidationResult validation = new ValidationResult(true, List.of(), List.of(), 2, 2);
        CheckedDocument checked = new CheckedDocument(validation, List.of(validBlock(1, "DCF"), validBlock(2, "DCF")), 0L);
        BatchUploadResult result = new BatchUploadResult(
                2, List.of("DCF-WACC-B-D-001", "DCF-WACC-B-D-002"), List.of(), List.of(), List.of(), 5);
        when(documentReader.read(FILE)).thenReturn(DOCUMENT);
        when(orchestrator.check(DOCUMENT.text(), UploadMode.COMMIT)).thenReturn(checked);
        when(questionRecordRepository.deleteByTopic("DCF")).thenReturn(7);
        when(orchestrator.commit(checked, metadata)).thenReturn(result);

        TopicReplaceResult replaced = service.replaceTopic(" DCF ", FILE, metadata);

        assertThat(replaced.topic()).isEqualTo("DCF");
        assertThat(replaced.removedCount()).isEqualTo(7);
        assertThat(replaced.upload()).isSameAs(result);
        InOrder order = inOrder(questionRecordRepository, orchestrator);
        order.verify(questionRecordRepository).deleteByTopic("DCF");
        order.verify(orchestrator).commit(checked, metadata);
    }

    @Test
    @DisplayName("replaceTopic: a block of another topic stops the replacement before anything is deleted")
    void replaceTopic_foreignTopicRefused() {
        ValidationResult validation = new ValidationResult(true, List.of(), List.of(), 2, 2);
        CheckedDocument checked = new CheckedDocument(validation, List.of(validBlock(1, "DCF"), validBlock(2, "LBO")), 0L);
        when(documentReader.read(FILE)).thenReturn(DOCUMENT);
        when(orchestrator.check(DOCUMENT.text(), UploadMode.COMMIT)).thenReturn(checked);

        assertThatThrownBy(() -> service.replaceTopic("DCF", FILE, UploadMetadata.empty()))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("Block 2 (line 14): topic 'LBO'");
        verify(questionRecordRepository, never()).deleteByTopic(anyString());
    }

    @Test
    @DisplayName("replaceTopic: a document without valid blocks deletes nothing")
    void replaceTopic_noValidBlocks() {
        ValidationResult validation = new ValidationResult(false, List.of("Block 1 (line 1): Missing answer"), List.of(), 0, 1);
        when(documentReader.read(FILE)).thenReturn(DOCUMENT);
        when(orchestrator.check(DOCUMENT.text(), UploadMode.COMMIT))
                .thenReturn(new CheckedDocument(validation, List.of(), 0L));

        assertThatThrownBy(() -> service.replaceTopic("DCF", FILE, null))
                .isInstanceOf(NoValidBlocksException.class);
        verifyNoInteractions(questionRecordRepository);
    }

    @Test
    @DisplayName("replaceTopic: blank topic is refused before the file is read")
    void replaceTopic_blankTopic() {
        assertThatThrownBy(() -> service.replaceTopic("  ", FILE, null))
                .isInstanceOf(ValidationException.class)
                .hasMessage("Topic is required");
        verifyNoInteractions(documentReader, orchestrator, questionRecordRepository);
    }

    @Test
    @DisplayName("checkDuplicates: counts exact and near matches per block")
    void checkDuplicates_countsMatches() {
        QuestionBlock first = new QuestionBlock(1, 1, 6, "DCF", "WACC", "Basic", "Definition", "What is WACC?", "A", null);
        QuestionBlock second = new QuestionBlock(2, 8, 13, "DCF", "WACC", "Basic", "Definition", "Define beta", "A", null);
        IndexedCorpus corpus = IndexedCorpus.empty();
        Map<QuestionBlock, List<SimilarMatch>> found = new LinkedHashMap<>();
        found.put(first, List.of(
                new SimilarMatch("DCF-WACC-B-D-001", 1.0, true),
                new SimilarMatch("DCF-WACC-B-D-004", 0.9, false)));

        when(duplicateDetector.resolveThreshold(null)).thenReturn(0.85);
        when(documentReader.read(FILE)).thenReturn(DOCUMENT);
        when(scanner.scanAll(DOCUMENT.text())).thenReturn(List.of(first, second));
        when(duplicateDetector.loadCorpus()).thenReturn(corpus);
        when(duplicateDetector.findDuplicates(List.of(first, second), corpus, 0.85)).thenReturn(found);

        DuplicateReport report = service.checkDuplicates(FILE, null);

        assertThat(report.threshold()).isEqualTo(0.85);
        assertThat(report.candidatesChecked()).isEqualTo(2);
        assertThat(report.exactCount()).isEqualTo(1);
        assertThat(report.nearCount()).isEqualTo(1);
        assertThat(report.duplicates()).singleElement().satisfies(match -> {
            assertThat(match.blockIndex()).isEqualTo(1);
            assertThat(match.question()).isEqualTo("What is WACC?");
            assertThat(match.matches()).hasSize(2);
        });
    }

    @Test
    @DisplayName("checkDuplicates: bad threshold is refused before the file is read")
    void checkDuplicates_badThreshold() {
        when(duplicateDetector.resolveThreshold(2.0))
                .thenThrow(new ValidationException("Similarity threshold must be between 0.1 and 1.0, got 2.0"));

        assertThatThrownBy(() -> service.checkDuplicates(FILE, 2.0)).isInstanceOf(ValidationException.class);
        verifyNoInteractions(documentReader, scanner);
    }

    @Test
    @DisplayName("scanDuplicates: maps groups to DTOs")
    void scanDuplicates_mapsGroups() {
        IndexedCorpus corpus = IndexedCorpus.empty();
        when(duplicateDetector.resolveThreshold(0.9)).thenReturn(0.9);
        when(duplicateDetector.loadCorpus()).thenReturn(corpus);
        when(duplicateDetector.scanCorpus(corpus, 0.9))
                .thenReturn(List.of(new DuplicateGroup(List.of("A-B-B-D-001", "A-B-B-D-002"), 0.95)));

        List<DuplicateGroupDto> groups = service.scanDuplicates(0.9);

        assertThat(groups).containsExactly(new DuplicateGroupDto(List.of("A-B-B-D-001", "A-B-B-D-002"), 0.95));
    }
}
