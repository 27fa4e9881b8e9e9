package uk.gegc.qaloader.shared.api.problem;

import java.net.URI;

/**
 * Problem type URIs used in {@code application/problem+json} responses.
 *
 * @see ProblemDetailBuilder
 */
public final class ErrorTypes {

    private static final String BASE_URL = "https://qaloader.gegc.uk/docs/errors";

    // Request
    public static final URI VALIDATION_FAILED = URI.create(BASE_URL + "/validation-failed");
    public static final URI TYPE_MISMATCH = URI.create(BASE_URL + "/type-mismatch");
    public static final URI RESOURCE_NOT_FOUND = URI.create(BASE_URL + "/resource-not-found");

    // Uploaded document
    public static final URI DOCUMENT_REJECTED = URI.create(BASE_URL + "/document-rejected");
    public static final URI PAYLOAD_TOO_LARGE = URI.create(BASE_URL + "/payload-too-large");
    public static final URI NO_VALID_BLOCKS = URI.create(BASE_URL + "/no-valid-blocks");

    // Staging
    public static final URI INVALID_BATCH_STATE = URI.create(BASE_URL + "/invalid-batch-state");

    public static final URI INTERNAL_SERVER_ERROR = URI.create(BASE_URL + "/internal-server-error");

    private ErrorTypes() {
        throw new AssertionError("Utility class - do not instantiate");
    }
}
