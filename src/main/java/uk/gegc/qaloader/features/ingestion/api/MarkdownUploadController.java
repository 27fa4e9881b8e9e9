package uk.gegc.qaloader.features.ingestion.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.ArraySchema;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;
import uk.gegc.qaloader.features.ingestion.api.dto.BatchUploadResult;
import uk.gegc.qaloader.features.ingestion.api.dto.DuplicateGroupDto;
import uk.gegc.qaloader.features.ingestion.api.dto.DuplicateReport;
import uk.gegc.qaloader.features.ingestion.api.dto.TopicReplaceResult;
import uk.gegc.qaloader.features.ingestion.api.dto.ValidationResult;
import uk.gegc.qaloader.features.ingestion.application.MarkdownIngestionService;
import uk.gegc.qaloader.features.ingestion.domain.model.UploadMetadata;

import java.util.List;

@RestController
@RequestMapping("/api/v1/uploads")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Uploads", description = "Validate, store and de-duplicate Markdown question files")
public class MarkdownUploadController {

    private final MarkdownIngestionService ingestionService;

    @Operation(
            summary = "Validate a question file",
            description = "Parses and validates a Markdown file without storing anything. Problems are returned in the body."
    )
    @ApiResponses({
            @ApiResponse(
                    responseCode = "200",
                    description = "Validation report",
                    content = @Content(schema = @Schema(implementation = ValidationResult.class))
            ),
            @ApiResponse(responseCode = "400", description = "File missing, wrong type or not valid UTF-8"),
            @ApiResponse(responseCode = "413", description = "File exceeds the size limit")
    })
    @PostMapping(value = "/validate", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<ValidationResult> validate(
            @Parameter(description = "Markdown (.md) or text (.txt) file", required = true)
            @RequestParam("file") MultipartFile file
    ) {
        return ResponseEntity.ok(ingestionService.validate(file));
    }

    @Operation(
            summary = "Upload a question file",
            description = "Stores every valid block as its own record. Failed records are reported without affecting the rest."
    )
    @ApiResponses({
            @ApiResponse(
                    responseCode = "200",
                    description = "Per-record upload result, possibly a partial success",
                    content = @Content(schema = @Schema(implementation = BatchUploadResult.class))
            ),
            @ApiResponse(responseCode = "400", description = "File rejected or metadata too long"),
            @ApiResponse(responseCode = "413", description = "File exceeds the size limit"),
            @ApiResponse(responseCode = "422", description = "Document contains no valid question blocks")
    })
    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<BatchUploadResult> upload(
            @Parameter(description = "Markdown (.md) or text (.txt) file", required = true)
            @RequestParam("file") MultipartFile file,
            @Parameter(description = "Uploader name, at most 25 characters")
            @RequestParam(value = "uploadedBy", required = false) String uploadedBy,
            @Parameter(description = "Free-text notes, at most 100 characters")
            @RequestParam(value = "uploadNotes", required = false) String uploadNotes,
            @Parameter(description = "Eastern Time timestamp, at most 20 characters; stamped by the server when omitted")
            @RequestParam(value = "uploadedOn", required = false) String uploadedOn
    ) {
        BatchUploadResult result = ingestionService.upload(file, new UploadMetadata(uploadedBy, uploadNotes, uploadedOn));
        log.info("Upload by {}: {}/{} records stored", uploadedBy, result.successfulUploads(), result.totalAttempted());
        return ResponseEntity.ok(result);
    }

    @Operation(
            summary = "Replace a topic",
            description = "Deletes every stored question of the topic, then stores the file. "
                    + "Every valid block must belong to the topic; nothing is deleted otherwise."
    )
    @ApiResponses({
            @ApiResponse(
                    responseCode = "200",
                    description = "Number of deleted questions plus the per-record upload result",
                    content = @Content(schema = @Schema(implementation = TopicReplaceResult.class))
            ),
            @ApiResponse(responseCode = "400", description = "File rejected, metadata too long or a block of another topic"),
            @ApiResponse(responseCode = "413", description = "File exceeds the size limit"),
            @ApiResponse(responseCode = "422", description = "Document contains no valid question blocks")
    })
    @PostMapping(value = "/topics/{topic}/replace", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<TopicReplaceResult> replaceTopic(
            @Parameter(description = "Topic whose stored questions are replaced", required = true)
            @PathVariable String topic,
            @Parameter(description = "Markdown (.md) or text (.txt) file", required = true)
            @RequestParam("file") MultipartFile file,
            @RequestParam(value = "uploadedBy", required = false) String uploadedBy,
            @RequestParam(value = "uploadNotes", required = false) String uploadNotes,
            @RequestParam(value = "uploadedOn", required = false) String uploadedOn
    ) {
        TopicReplaceResult result = ingestionService.replaceTopic(
                topic, file, new UploadMetadata(uploadedBy, uploadNotes, uploadedOn));
        log.info("Topic '{}' replaced by {}: {} removed, {} stored",
                result.topic(), uploadedBy, result.removedCount(), result.upload().successfulUploads());
        return ResponseEntity.ok(result);
    }

    @Operation(
            summary = "Check a file for duplicates",
            description = "Compares every question in the file with stored questions. Advisory only; nothing is stored."
    )
    @ApiResponses({
            @ApiResponse(
                    responseCode = "200",
                    description = "Duplicate report",
                    content = @Content(schema = @Schema(implementation = DuplicateReport.class))
            ),
            @ApiResponse(responseCode = "400", description = "File rejected or threshold outside [0.1, 1.0]")
    })
    @PostMapping(value = "/duplicates", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<DuplicateReport> checkDuplicates(
            @Parameter(description = "Markdown (.md) or text (.txt) file", required = true)
            @RequestParam("file") MultipartFile file,
            @Parameter(description = "Similarity threshold between 0.1 and 1.0; configured default when omitted")
            @RequestParam(value = "threshold", required = false) Double threshold
    ) {
        return ResponseEntity.ok(ingestionService.checkDuplicates(file, threshold));
    }

    @Operation(
            summary = "Scan stored questions for duplicates",
            description = "Groups stored questions whose pairwise similarity reaches the threshold"
    )
    @ApiResponses({
            @ApiResponse(
                    responseCode = "200",
                    description = "Duplicate groups, highest average similarity first",
                    content = @Content(array = @ArraySchema(schema = @Schema(implementation = DuplicateGroupDto.class)))
            ),
            @ApiResponse(responseCode = "400", description = "Threshold outside [0.1, 1.0]")
    })
    @GetMapping("/duplicates/scan")
    public ResponseEntity<List<DuplicateGroupDto>> scanDuplicates(
            @Parameter(description = "Similarity threshold between 0.1 and 1.0; configured default when omitted")
            @RequestParam(value = "threshold", required = false) Double threshold
    ) {
        return ResponseEntity.ok(ingestionService.scanDuplicates(threshold));
    }
}
