package uk.gegc.qaloader.shared.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * Raised when an uploaded file cannot be turned into a document at all:
 * wrong extension, empty, too large or not valid UTF-8.
 */
@ResponseStatus(HttpStatus.BAD_REQUEST)
public class DocumentRejectedException extends RuntimeException {

    private final boolean tooLarge;

    public DocumentRejectedException(String message) {
        this(message, false, null);
    }

    public DocumentRejectedException(String message, Throwable cause) {
        this(message, false, cause);
    }

    private DocumentRejectedException(String message, boolean tooLarge, Throwable cause) {
        super(message, cause);
        this.tooLarge = tooLarge;
    }

    public static DocumentRejectedException tooLarge(long size, long limit) {
        return new DocumentRejectedException(
                String.format("File too large: %d bytes exceeds the %d byte limit", size, limit),
                true,
                null);
    }

    public boolean isTooLarge() {
        return tooLarge;
    }
}
