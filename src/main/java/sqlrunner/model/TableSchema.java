package sqlrunner.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Table structure plus a small sample of its rows. Recomputed on every request.
 */
public record TableSchema(
        String name,
        List<ColumnInfo> columns,
        List<Map<String, Object>> sampleData
) {

    public TableSchema {
        columns = List.copyOf(columns);
        sampleData = List.copyOf(sampleData);
    }

    public Map<String, Object> toMap() {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("name", name);
        result.put("columns", columns.stream().map(ColumnInfo::toMap).toList());
        result.put("sample_data", sampleData);
        return result;
    }
}
