package sqlrunner.exception;

/**
 * Exception thrown when a described table does not exist.
 */
public class TableNotFoundException extends RuntimeException {

    private final String tableName;

    public TableNotFoundException(String tableName) {
        super("Table '" + tableName + "' not found");
        this.tableName = tableName;
    }

    public String getTableName() {
        return tableName;
    }
}
