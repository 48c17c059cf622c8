package uk.gegc.learnpath.shared.api.problem;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.context.request.WebRequest;

import java.net.URI;
import java.time.Instant;

/**
 * Builds the RFC 7807 bodies returned by every LearnPath endpoint. Besides the standard members each
 * problem carries {@code code} (last segment of the type URI, e.g. {@code certificate-not-earned})
 * and {@code timestamp}.
 */
public final class ProblemDetailBuilder {

    private ProblemDetailBuilder() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    public static ProblemDetail create(HttpStatus status, URI type, String title, String detail,
                                       HttpServletRequest request) {
        return build(status, type, title, detail, request != null ? request.getRequestURI() : null);
    }

    /**
     * For {@code ResponseEntityExceptionHandler} overrides, which only see a {@link WebRequest}.
     */
    public static ProblemDetail create(HttpStatus status, URI type, String title, String detail,
                                       WebRequest request) {
        String path = null;
        if (request != null && request.getDescription(false) != null) {
            path = request.getDescription(false).replaceFirst("^uri=", "");
        }
        return build(status, type, title, detail, path);
    }

    private static ProblemDetail build(HttpStatus status, URI type, String title, String detail, String path) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setType(type);
        problem.setTitle(title);
        if (path != null && !path.isBlank()) {
            problem.setInstance(URI.create(path));
        }
        problem.setProperty("code", code(type));
        problem.setProperty("timestamp", Instant.now());
        return problem;
    }

    static String code(URI type) {
        if (type == null) {
            return "error";
        }
        String path = type.getPath();
        return path == null || path.isEmpty() ? "error" : path.substring(path.lastIndexOf('/') + 1);
    }
}
