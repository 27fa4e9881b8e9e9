package uk.gegc.qaloader.shared.api.advice;

import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.lang.NonNull;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;
import uk.gegc.qaloader.shared.api.problem.ErrorTypes;
import uk.gegc.qaloader.shared.api.problem.ProblemDetailBuilder;
import uk.gegc.qaloader.shared.exception.DocumentRejectedException;
import uk.gegc.qaloader.shared.exception.InvalidBatchStateException;
import uk.gegc.qaloader.shared.exception.NoValidBlocksException;
import uk.gegc.qaloader.shared.exception.ResourceNotFoundException;
import uk.gegc.qaloader.shared.exception.ValidationException;

import java.net.URI;
import java.util.List;

/**
 * Maps upload failures to problem details. Content problems inside a readable document never
 * arrive here: they travel in the validation report instead.
 */
@RestControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ProblemDetail> handleValidation(ValidationException ex, HttpServletRequest request) {
        logger.debug("Rejected request to {}: {}", request.getRequestURI(), ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, ErrorTypes.VALIDATION_FAILED, "Validation Failed", ex.getMessage(), request);
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ProblemDetail> handleNotFound(ResourceNotFoundException ex, HttpServletRequest request) {
        return problem(HttpStatus.NOT_FOUND, ErrorTypes.RESOURCE_NOT_FOUND, "Resource Not Found", ex.getMessage(), request);
    }

    @ExceptionHandler(InvalidBatchStateException.class)
    public ResponseEntity<ProblemDetail> handleInvalidBatchState(InvalidBatchStateException ex, HttpServletRequest request) {
        ResponseEntity<ProblemDetail> response = problem(
                HttpStatus.CONFLICT, ErrorTypes.INVALID_BATCH_STATE, "Invalid Batch State", ex.getMessage(), request);
        response.getBody().setProperty("batchId", ex.getBatchId());
        response.getBody().setProperty("currentStatus", ex.getCurrentStatus().name());
        return response;
    }

    @ExceptionHandler(DocumentRejectedException.class)
    public ResponseEntity<ProblemDetail> handleDocumentRejected(DocumentRejectedException ex, HttpServletRequest request) {
        logger.info("Document rejected at {}: {}", request.getRequestURI(), ex.getMessage());
        if (ex.isTooLarge()) {
            return problem(HttpStatus.PAYLOAD_TOO_LARGE, ErrorTypes.PAYLOAD_TOO_LARGE, "Payload Too Large", ex.getMessage(), request);
        }
        return problem(HttpStatus.BAD_REQUEST, ErrorTypes.DOCUMENT_REJECTED, "Document Rejected", ex.getMessage(), request);
    }

    @ExceptionHandler(NoValidBlocksException.class)
    public ResponseEntity<ProblemDetail> handleNoValidBlocks(NoValidBlocksException ex, HttpServletRequest request) {
        ResponseEntity<ProblemDetail> response = problem(
                HttpStatus.UNPROCESSABLE_ENTITY, ErrorTypes.NO_VALID_BLOCKS, "No Valid Question Blocks", ex.getMessage(), request);
        response.getBody().setProperty("validation", ex.getValidationResult());
        return response;
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ProblemDetail> handleTypeMismatch(MethodArgumentTypeMismatchException ex, HttpServletRequest request) {
        Class<?> type = ex.getRequiredType();
        String requiredType = type != null ? type.getSimpleName() : "unknown";
        ResponseEntity<ProblemDetail> response = problem(
                HttpStatus.BAD_REQUEST,
                ErrorTypes.TYPE_MISMATCH,
                "Type Mismatch",
                "Invalid value for parameter '" + ex.getName() + "'. Expected type: " + requiredType + ".",
                request);
        response.getBody().setProperty("parameter", ex.getName());
        response.getBody().setProperty("providedValue", ex.getValue());
        return response;
    }

    @Override
    protected ResponseEntity<Object> handleMethodArgumentNotValid(
            @NonNull MethodArgumentNotValidException ex,
            @NonNull HttpHeaders headers,
            @NonNull HttpStatusCode status,
            @NonNull WebRequest request
    ) {
        List<FieldViolation> violations = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> new FieldViolation(error.getField(), error.getDefaultMessage(), error.getRejectedValue()))
                .toList();
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.BAD_REQUEST,
                ErrorTypes.VALIDATION_FAILED,
                "Validation Failed",
                "Request body has " + violations.size() + " invalid field(s)",
                request
        );
        problem.setProperty("fieldErrors", violations);
        return new ResponseEntity<>(problem, headers, HttpStatus.BAD_REQUEST);
    }

    @Override
    protected ResponseEntity<Object> handleMissingServletRequestPart(
            @NonNull MissingServletRequestPartException ex,
            @NonNull HttpHeaders headers,
            @NonNull HttpStatusCode status,
            @NonNull WebRequest request
    ) {
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.BAD_REQUEST,
                ErrorTypes.DOCUMENT_REJECTED,
                "Document Rejected",
                "Multipart part '" + ex.getRequestPartName() + "' is required",
                request
        );
        return new ResponseEntity<>(problem, headers, HttpStatus.BAD_REQUEST);
    }

    @Override
    protected ResponseEntity<Object> handleMaxUploadSizeExceededException(
            @NonNull MaxUploadSizeExceededException ex,
            @NonNull HttpHeaders headers,
            @NonNull HttpStatusCode status,
            @NonNull WebRequest request
    ) {
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.PAYLOAD_TOO_LARGE,
                ErrorTypes.PAYLOAD_TOO_LARGE,
                "Payload Too Large",
                "Uploaded file exceeds the maximum allowed size",
                request
        );
        problem.setProperty("maxUploadSize", ex.getMaxUploadSize());
        return new ResponseEntity<>(problem, headers, HttpStatus.PAYLOAD_TOO_LARGE);
    }

    @ExceptionHandler(RuntimeException.class)
    public ResponseEntity<ProblemDetail> handleRuntimeException(RuntimeException ex, HttpServletRequest request) {
        logger.error("Unexpected failure at {}: {}", request.getRequestURI(), ex.getMessage(), ex);
        return problem(HttpStatus.INTERNAL_SERVER_ERROR, ErrorTypes.INTERNAL_SERVER_ERROR,
                "Internal Server Error", "An unexpected error occurred", request);
    }

    private static ResponseEntity<ProblemDetail> problem(HttpStatus status, URI type, String title,
                                                         String detail, HttpServletRequest request) {
        return ResponseEntity.status(status).body(ProblemDetailBuilder.create(status, type, title, detail, request));
    }

    private record FieldViolation(String field, String message, Object rejectedValue) {
    }
}
