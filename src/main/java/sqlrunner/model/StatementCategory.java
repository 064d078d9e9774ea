package sqlrunner.model;

/**
 * Statement intent as determined by the classifier.
 */
public enum StatementCategory {
    /**
     * SELECT query - returns a row set
     */
    SELECT,

    /**
     * CREATE TABLE statement
     */
    CREATE_TABLE,

    /**
     * CREATE [UNIQUE] INDEX statement
     */
    CREATE_INDEX,

    /**
     * DROP TABLE statement
     */
    DROP_TABLE,

    /**
     * ALTER TABLE statement
     */
    ALTER_TABLE,

    /**
     * INSERT statement - returns affected rows count
     */
    INSERT,

    /**
     * UPDATE statement - returns affected rows count
     */
    UPDATE,

    /**
     * DELETE statement - returns affected rows count
     */
    DELETE,

    /**
     * Anything that matched none of the known prefixes
     */
    OTHER;

    /**
     * @return true when the statement produces a row set rather than an update count
     */
    public boolean isQuery() {
        return this == SELECT;
    }
}
