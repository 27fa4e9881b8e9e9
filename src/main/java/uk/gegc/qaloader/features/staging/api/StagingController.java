package uk.gegc.qaloader.features.staging.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.ArraySchema;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;
import uk.gegc.qaloader.features.staging.api.dto.ImportResultDto;
import uk.gegc.qaloader.features.staging.api.dto.ReviewRequest;
import uk.gegc.qaloader.features.staging.api.dto.StagingResultDto;
import uk.gegc.qaloader.features.staging.api.dto.UploadBatchDetailDto;
import uk.gegc.qaloader.features.staging.api.dto.UploadBatchDto;
import uk.gegc.qaloader.features.staging.application.StagingService;
import uk.gegc.qaloader.features.staging.domain.model.BatchStatus;
import uk.gegc.qaloader.features.staging.domain.model.StagedQuestionStatus;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1/staging/batches")
@RequiredArgsConstructor
@Tag(name = "Staging", description = "Review uploaded questions before they are stored")
public class StagingController {

    private final StagingService stagingService;

    @Operation(
            summary = "Stage a question file",
            description = "Validates the file and holds every valid block for review. "
                    + "Blocks resembling stored questions are flagged as duplicates."
    )
    @ApiResponses({
            @ApiResponse(
                    responseCode = "201",
                    description = "Batch created",
                    content = @Content(schema = @Schema(implementation = StagingResultDto.class))
            ),
            @ApiResponse(responseCode = "400", description = "File rejected, metadata too long or bad threshold"),
            @ApiResponse(responseCode = "413", description = "File exceeds the size limit"),
            @ApiResponse(responseCode = "422", description = "Document contains no valid question blocks")
    })
    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<StagingResultDto> stage(
            @Parameter(description = "Markdown (.md) or text (.txt) file", required = true)
            @RequestParam("file") MultipartFile file,
            @Parameter(description = "Uploader name, at most 25 characters")
            @RequestParam(value = "uploadedBy", required = false) String uploadedBy,
            @Parameter(description = "Free-text notes, at most 100 characters")
            @RequestParam(value = "uploadNotes", required = false) String uploadNotes,
            @Parameter(description = "Duplicate threshold between 0.1 and 1.0; configured default when omitted")
            @RequestParam(value = "threshold", required = false) Double threshold
    ) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(stagingService.stage(file, uploadedBy, uploadNotes, threshold));
    }

    @Operation(summary = "List batches", description = "Newest first, optionally filtered by status")
    @ApiResponse(
            responseCode = "200",
            description = "Batches with question counts",
            content = @Content(array = @ArraySchema(schema = @Schema(implementation = UploadBatchDto.class)))
    )
    @GetMapping
    public ResponseEntity<List<UploadBatchDto>> listBatches(
            @RequestParam(value = "status", required = false) BatchStatus status
    ) {
        return ResponseEntity.ok(stagingService.listBatches(status));
    }

    @Operation(summary = "Get a batch", description = "The batch with its staged questions, optionally filtered by status")
    @ApiResponses({
            @ApiResponse(
                    responseCode = "200",
                    description = "Batch detail",
                    content = @Content(schema = @Schema(implementation = UploadBatchDetailDto.class))
            ),
            @ApiResponse(responseCode = "404", description = "Batch not found")
    })
    @GetMapping("/{batchId}")
    public ResponseEntity<UploadBatchDetailDto> getBatch(
            @PathVariable UUID batchId,
            @RequestParam(value = "status", required = false) StagedQuestionStatus status
    ) {
        return ResponseEntity.ok(stagingService.getBatch(batchId, status));
    }

    @Operation(
            summary = "Re-check duplicates",
            description = "Runs duplicate detection again for questions still awaiting review"
    )
    @ApiResponses({
            @ApiResponse(
                    responseCode = "200",
                    description = "Batch detail after the check",
                    content = @Content(schema = @Schema(implementation = UploadBatchDetailDto.class))
            ),
            @ApiResponse(responseCode = "400", description = "Threshold outside [0.1, 1.0]"),
            @ApiResponse(responseCode = "404", description = "Batch not found"),
            @ApiResponse(responseCode = "409", description = "Batch is completed or cancelled")
    })
    @PostMapping("/{batchId}/duplicates")
    public ResponseEntity<UploadBatchDetailDto> detectDuplicates(
            @PathVariable UUID batchId,
            @RequestParam(value = "threshold", required = false) Double threshold
    ) {
        return ResponseEntity.ok(stagingService.detectDuplicates(batchId, threshold));
    }

    @Operation(summary = "Approve or reject questions")
    @ApiResponses({
            @ApiResponse(
                    responseCode = "200",
                    description = "Batch after the review",
                    content = @Content(schema = @Schema(implementation = UploadBatchDto.class))
            ),
            @ApiResponse(responseCode = "400", description = "Invalid request or a question that cannot change status"),
            @ApiResponse(responseCode = "404", description = "Batch or staged question not found"),
            @ApiResponse(responseCode = "409", description = "Batch is completed or cancelled")
    })
    @PostMapping("/{batchId}/review")
    public ResponseEntity<UploadBatchDto> review(
            @PathVariable UUID batchId,
            @Valid @RequestBody ReviewRequest request
    ) {
        return ResponseEntity.ok(stagingService.review(batchId, request));
    }

    @Operation(
            summary = "Import approved questions",
            description = "Stores approved questions one by one. The batch completes once nothing awaits review or failed."
    )
    @ApiResponses({
            @ApiResponse(
                    responseCode = "200",
                    description = "Per-record import result",
                    content = @Content(schema = @Schema(implementation = ImportResultDto.class))
            ),
            @ApiResponse(responseCode = "404", description = "Batch not found"),
            @ApiResponse(responseCode = "409", description = "Batch is completed or cancelled")
    })
    @PostMapping("/{batchId}/import")
    public ResponseEntity<ImportResultDto> importApproved(@PathVariable UUID batchId) {
        return ResponseEntity.ok(stagingService.importApproved(batchId));
    }

    @Operation(summary = "Cancel a batch")
    @ApiResponses({
            @ApiResponse(
                    responseCode = "200",
                    description = "Cancelled batch",
                    content = @Content(schema = @Schema(implementation = UploadBatchDto.class))
            ),
            @ApiResponse(responseCode = "404", description = "Batch not found"),
            @ApiResponse(responseCode = "409", description = "Batch is already completed or cancelled")
    })
    @PostMapping("/{batchId}/cancel")
    public ResponseEntity<UploadBatchDto> cancel(@PathVariable UUID batchId) {
        return ResponseEntity.ok(stagingService.cancel(batchId));
    }
}
