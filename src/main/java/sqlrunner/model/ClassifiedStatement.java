package sqlrunner.model;

import io.micronaut.core.annotation.Nullable;

import java.util.Objects;

/**
 * A statement after classification.
 *
 * @param text        trimmed statement text with one trailing terminator removed; this is what gets executed
 * @param normalized  uppercase form used only for matching
 * @param category    derived category
 * @param targetTable best-effort table name for CREATE TABLE / DROP TABLE, null otherwise
 */
public record ClassifiedStatement(
        String text,
        String normalized,
        StatementCategory category,
        @Nullable String targetTable
) {

    public static final String UNKNOWN_TABLE = "unknown";

    public ClassifiedStatement {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(normalized, "normalized");
        Objects.requireNonNull(category, "category");
    }

    /**
     * @return the extracted table name, or the placeholder when extraction failed
     */
    public String tableNameOrPlaceholder() {
        return targetTable != null ? targetTable : UNKNOWN_TABLE;
    }
}
