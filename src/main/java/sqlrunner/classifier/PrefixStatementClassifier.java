package sqlrunner.classifier;

import jakarta.inject.Singleton;
import sqlrunner.model.ClassifiedStatement;
import sqlrunner.model.StatementCategory;

import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Keyword-prefix classifier.
 *
 * <p>Rules are evaluated in order and the first match wins. There is no grammar here:
 * text that opens with a comment or a CTE falls through to OTHER, and a keyword used
 * inside another construct is taken at face value.
 */
@Singleton
public class PrefixStatementClassifier implements StatementClassifier {

    private static final List<Rule> RULES = List.of(
            new Rule(StatementCategory.SELECT, "SELECT\\b"),
            new Rule(StatementCategory.CREATE_TABLE, "CREATE\\s+TABLE\\b"),
            new Rule(StatementCategory.CREATE_INDEX, "CREATE\\s+(?:UNIQUE\\s+)?INDEX\\b"),
            new Rule(StatementCategory.DROP_TABLE, "DROP\\s+TABLE\\b"),
            new Rule(StatementCategory.ALTER_TABLE, "ALTER\\s+TABLE\\b"),
            new Rule(StatementCategory.INSERT, "INSERT\\b"),
            new Rule(StatementCategory.UPDATE, "UPDATE\\b"),
            new Rule(StatementCategory.DELETE, "DELETE\\b")
    );

    // Identifier: plain, "quoted", `quoted` or [bracketed], optionally schema-qualified.
    private static final String IDENTIFIER =
            "((?:\"[^\"]{1,128}\"|`[^`]{1,128}`|\\[[^\\]]{1,128}]|[\\w$]{1,128})"
                    + "(?:\\s*\\.\\s*(?:\"[^\"]{1,128}\"|`[^`]{1,128}`|\\[[^\\]]{1,128}]|[\\w$]{1,128})){0,2})";

    private static final Pattern CREATE_TABLE_NAME = Pattern.compile(
            "^CREATE\\s+TABLE\\s+(?:IF\\s+NOT\\s+EXISTS\\s+)?" + IDENTIFIER, Pattern.CASE_INSENSITIVE);

    private static final Pattern DROP_TABLE_NAME = Pattern.compile(
            "^DROP\\s+TABLE\\s+(?:IF\\s+EXISTS\\s+)?" + IDENTIFIER, Pattern.CASE_INSENSITIVE);

    @Override
    public ClassifiedStatement classify(String sql) {
        String text = normalizeText(sql);
        String normalized = text.toUpperCase(Locale.ROOT);

        StatementCategory category = StatementCategory.OTHER;
        for (Rule rule : RULES) {
            if (rule.matches(normalized)) {
                category = rule.category();
                break;
            }
        }

        String targetTable = switch (category) {
            case CREATE_TABLE -> extractTableName(CREATE_TABLE_NAME, text);
            case DROP_TABLE -> extractTableName(DROP_TABLE_NAME, text);
            default -> null;
        };

        return new ClassifiedStatement(text, normalized, category, targetTable);
    }

    /**
     * Trims whitespace and removes exactly one trailing statement terminator.
     */
    static String normalizeText(String sql) {
        if (sql == null) {
            return "";
        }
        String text = sql.strip();
        if (text.endsWith(";")) {
            text = text.substring(0, text.length() - 1).strip();
        }
        return text;
    }

    private static String extractTableName(Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(text);
        if (!matcher.find()) {
            return ClassifiedStatement.UNKNOWN_TABLE;
        }
        String qualified = matcher.group(1);
        String[] parts = qualified.split("\\s*\\.\\s*");
        return unquote(parts[parts.length - 1]);
    }

    private static String unquote(String identifier) {
        if (identifier.length() >= 2) {
            char first = identifier.charAt(0);
            char last = identifier.charAt(identifier.length() - 1);
            if ((first == '"' && last == '"') || (first == '`' && last == '`') || (first == '[' && last == ']')) {
                return identifier.substring(1, identifier.length() - 1);
            }
        }
        return identifier;
    }

    private record Rule(StatementCategory category, Pattern pattern) {

        Rule(StatementCategory category, String prefix) {
            this(category, Pattern.compile("^" + prefix));
        }

        boolean matches(String normalized) {
            return pattern.matcher(normalized).lookingAt();
        }
    }
}
