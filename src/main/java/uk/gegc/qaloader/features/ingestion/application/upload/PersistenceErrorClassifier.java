package uk.gegc.qaloader.features.ingestion.application.upload;

import org.springframework.core.NestedExceptionUtils;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.CannotCreateTransactionException;
import uk.gegc.qaloader.features.ingestion.domain.model.PersistenceErrorKind;
import uk.gegc.qaloader.features.question.domain.model.Difficulty;
import uk.gegc.qaloader.features.question.domain.model.QuestionType;
import uk.gegc.qaloader.shared.exception.IdGenerationException;

import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Turns a failed single-record insert into a kind plus a message an administrator can act on.
 * Driver and schema details never reach the message except in the truncated catch-all.
 */
@Component
public class PersistenceErrorClassifier {

    static final int UNKNOWN_MESSAGE_LIMIT = 100;

    public PersistenceFailure classify(Throwable error, String questionId) {
        String message = describe(error).toLowerCase(Locale.ROOT);

        if (error instanceof IdGenerationException) {
            return new PersistenceFailure(PersistenceErrorKind.DUPLICATE_ID, error.getMessage());
        }
        if (error instanceof DuplicateKeyException) {
            return duplicate(questionId);
        }
        if (isConnectionFailure(error)) {
            return connection();
        }
        if (isDuplicateKey(message)) {
            return duplicate(questionId);
        }
        if (isConstraintViolation(message)) {
            return new PersistenceFailure(PersistenceErrorKind.CONSTRAINT_VIOLATION, constraintMessage(message));
        }
        if (message.contains("connection") || message.contains("timeout") || message.contains("timed out")) {
            return connection();
        }

        String raw = describe(error);
        String truncated = raw.length() > UNKNOWN_MESSAGE_LIMIT ? raw.substring(0, UNKNOWN_MESSAGE_LIMIT) : raw;
        return new PersistenceFailure(PersistenceErrorKind.UNKNOWN, "Upload error: " + truncated + "...");
    }

    private static boolean isDuplicateKey(String message) {
        return message.contains("duplicate") || message.contains("unique") || message.contains("primary key");
    }

    private static boolean isConstraintViolation(String message) {
        return message.contains("check constraint")
                || message.contains("value too long")
                || message.contains("data too long")
                || isMissingValue(message)
                || message.contains("invalid input value")
                || message.contains("incorrect");
    }

    // MySQL, Hibernate and H2 wordings
    private static boolean isMissingValue(String message) {
        return message.contains("not null")
                || message.contains("not-null")
                || message.contains("cannot be null")
                || message.contains("null not allowed");
    }

    private static String constraintMessage(String message) {
        if (message.contains("too long")) {
            return "Content too long - topic/subtopic must be under 100 characters";
        }
        if (isMissingValue(message)) {
            return "Missing required fields - question and answer cannot be empty";
        }
        if (message.contains("difficulty")) {
            return "Invalid difficulty - must be " + Difficulty.labels().stream()
                    .map(label -> "'" + label + "'")
                    .collect(Collectors.joining(" or "));
        }
        if (message.contains("type")) {
            return "Invalid question type - must be " + String.join(", ", QuestionType.labels());
        }
        return "Invalid data format - check field values";
    }

    private static boolean isConnectionFailure(Throwable error) {
        return error instanceof TransientDataAccessException
                || error instanceof RecoverableDataAccessException
                || error instanceof DataAccessResourceFailureException
                || error instanceof CannotCreateTransactionException;
    }

    private static PersistenceFailure duplicate(String questionId) {
        return new PersistenceFailure(PersistenceErrorKind.DUPLICATE_ID,
                "Question ID '" + questionId + "' already exists in database");
    }

    private static PersistenceFailure connection() {
        return new PersistenceFailure(PersistenceErrorKind.CONNECTION, "Database connection error - please try again");
    }

    private static String describe(Throwable error) {
        Throwable cause = NestedExceptionUtils.getMostSpecificCause(error);
        String message = cause.getMessage();
        if (message == null) {
            message = error.getMessage();
        }
        return message != null ? message : error.getClass().getSimpleName();
    }
}
