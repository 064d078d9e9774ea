package sqlrunner.model;

import io.micronaut.core.annotation.Nullable;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Column metadata as reported by the database.
 */
public record ColumnInfo(
        String name,
        String type,
        boolean notNull,
        @Nullable String defaultValue,
        boolean primaryKey
) {

    public Map<String, Object> toMap() {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("name", name);
        result.put("type", type);
        result.put("notnull", notNull);
        result.put("default_value", defaultValue);
        result.put("primary_key", primaryKey);
        return result;
    }
}
