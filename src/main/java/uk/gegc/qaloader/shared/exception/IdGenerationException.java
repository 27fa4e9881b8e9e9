package uk.gegc.qaloader.shared.exception;

public class IdGenerationException extends RuntimeException {
    public IdGenerationException(String message) {
        super(message);
    }
}
