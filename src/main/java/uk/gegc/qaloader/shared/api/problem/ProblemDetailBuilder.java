package uk.gegc.qaloader.shared.api.problem;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.context.request.WebRequest;

import java.net.URI;
import java.time.Instant;

/**
 * Builds the RFC 7807 bodies returned by the API: type from {@link ErrorTypes}, the request path
 * as {@code instance} and a {@code timestamp} property.
 */
public final class ProblemDetailBuilder {

    private static final String URI_PREFIX = "uri=";

    private ProblemDetailBuilder() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    public static ProblemDetail create(
            HttpStatus status,
            URI type,
            String title,
            String detail,
            HttpServletRequest request
    ) {
        return build(status, type, title, detail, request != null ? request.getRequestURI() : null);
    }

    /**
     * For {@code ResponseEntityExceptionHandler} overrides, which only see a {@link WebRequest}.
     */
    public static ProblemDetail create(
            HttpStatus status,
            URI type,
            String title,
            String detail,
            WebRequest request
    ) {
        return build(status, type, title, detail, requestPath(request));
    }

    private static ProblemDetail build(HttpStatus status, URI type, String title, String detail, String path) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setType(type);
        problem.setTitle(title);
        if (path != null && !path.isEmpty()) {
            problem.setInstance(URI.create(path));
        }
        problem.setProperty("timestamp", Instant.now());
        return problem;
    }

    private static String requestPath(WebRequest request) {
        if (request == null) {
            return null;
        }
        String description = request.getDescription(false);
        if (description == null) {
            return null;
        }
        return description.startsWith(URI_PREFIX) ? description.substring(URI_PREFIX.length()) : description;
    }
}
