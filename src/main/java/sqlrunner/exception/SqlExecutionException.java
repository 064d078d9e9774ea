package sqlrunner.exception;

/**
 * Exception thrown when a data-layer operation outside statement execution fails,
 * such as schema introspection or history persistence.
 * Details are logged server-side but not exposed to clients.
 */
public class SqlExecutionException extends RuntimeException {

    private final String operation;

    public SqlExecutionException(String operation, String message, Throwable cause) {
        super(message, cause);
        this.operation = operation;
    }

    public SqlExecutionException(String operation, String message) {
        super(message);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
