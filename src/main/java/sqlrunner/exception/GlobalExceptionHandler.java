package sqlrunner.exception;

import io.micronaut.context.annotation.Requires;
import io.micronaut.http.HttpRequest;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.HttpStatus;
import io.micronaut.http.annotation.Produces;
import io.micronaut.http.server.exceptions.ExceptionHandler;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sqlrunner.config.RunnerProperties;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Global exception handler for the runner.
 * Converts exceptions to HTTP responses with structured error bodies.
 * Error detail exposure is controlled by runner.error-handling configuration.
 */
@Produces
@Singleton
@Requires(classes = {Exception.class, ExceptionHandler.class})
public class GlobalExceptionHandler implements ExceptionHandler<Exception, HttpResponse<Map<String, Object>>> {

    private static final Logger LOG = LoggerFactory.getLogger(GlobalExceptionHandler.class);
    private static final int MAX_STACK_FRAMES = 10;

    private final RunnerProperties.ErrorHandlingConfig config;

    public GlobalExceptionHandler(RunnerProperties properties) {
        this.config = properties.getErrorHandling();
    }

    @Override
    public HttpResponse<Map<String, Object>> handle(HttpRequest request, Exception exception) {
        Map<String, Object> error = new LinkedHashMap<>();
        error.put("success", false);

        boolean exposeDetails = config.isExposeDetails();
        HttpStatus status;

        if (exception instanceof TableNotFoundException tnf) {
            LOG.debug("Request {} {}: {}", request.getMethod(), request.getPath(), tnf.getMessage());
            status = HttpStatus.NOT_FOUND;
            error.put("error", "Table Not Found");
            error.put("message", tnf.getMessage());
        } else if (exception instanceof IllegalArgumentException) {
            LOG.debug("Request {} {} rejected: {}", request.getMethod(), request.getPath(), exception.getMessage());
            status = HttpStatus.BAD_REQUEST;
            error.put("error", "Bad Request");
            error.put("message", exception.getMessage() != null ? exception.getMessage() : "Invalid request parameters");
        } else if (exception instanceof SqlExecutionException sqe) {
            LOG.error("Data-layer error in {} for {} {}: {}", sqe.getOperation(),
                    request.getMethod(), request.getPath(),
                    sqe.getCause() != null ? sqe.getCause().getMessage() : sqe.getMessage(), sqe);
            status = HttpStatus.INTERNAL_SERVER_ERROR;
            error.put("error", "Database Error");
            if (exposeDetails) {
                error.put("message", sqe.getMessage());
                error.put("operation", sqe.getOperation());
            } else {
                error.put("message", "A database error occurred");
            }
        } else {
            LOG.error("Request {} {} failed: {}",
                    request.getMethod(), request.getPath(), exception.getMessage(), exception);
            status = HttpStatus.INTERNAL_SERVER_ERROR;
            error.put("error", "Internal Server Error");
            error.put("message", exposeDetails ? exception.getMessage() : "An unexpected error occurred");
        }

        error.put("path", request.getPath());
        error.put("method", request.getMethodName());
        addStackTraceIfEnabled(error, exception);
        return HttpResponse.status(status).body(error);
    }

    private void addStackTraceIfEnabled(Map<String, Object> error, Exception exception) {
        if (!config.isExposeStackTrace()) {
            return;
        }
        StackTraceElement[] stackTrace = exception.getStackTrace();
        if (stackTrace != null && stackTrace.length > 0) {
            int frames = Math.min(MAX_STACK_FRAMES, stackTrace.length);
            String[] lines = new String[frames];
            for (int i = 0; i < frames; i++) {
                lines[i] = stackTrace[i].toString();
            }
            error.put("stackTrace", lines);
        }
    }
}
