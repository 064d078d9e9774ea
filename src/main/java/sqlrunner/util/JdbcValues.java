package sqlrunner.util;

import java.io.IOException;
import java.io.Reader;
import java.sql.Blob;
import java.sql.Clob;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.SQLXML;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Converts JDBC driver values into JSON-safe primitives and reads result sets into ordered row maps.
 */
public final class JdbcValues {

    private static final int MAX_LOB_CHARS = 100_000;
    private static final int MAX_BLOB_BYTES = 100_000;
    private static final int MAX_NESTED_DEPTH = 3;

    private JdbcValues() {
    }

    /**
     * Column labels of a result set, in order.
     */
    public static List<String> columnLabels(ResultSetMetaData metaData) throws SQLException {
        int count = metaData.getColumnCount();
        List<String> labels = new ArrayList<>(count);
        for (int i = 1; i <= count; i++) {
            labels.add(metaData.getColumnLabel(i));
        }
        return labels;
    }

    /**
     * Reads rows until the result set is exhausted or {@code limit} rows were read.
     *
     * @param rs     open result set
     * @param labels column labels as returned by {@link #columnLabels}
     * @param limit  maximum rows to read, 0 for no limit
     * @return rows as ordered maps keyed by column label
     */
    public static List<Map<String, Object>> readRows(ResultSet rs, List<String> labels, int limit)
            throws SQLException {
        List<Map<String, Object>> rows = new ArrayList<>();
        while ((limit <= 0 || rows.size() < limit) && rs.next()) {
            rows.add(readRow(rs, labels));
        }
        return rows;
    }

    private static Map<String, Object> readRow(ResultSet rs, List<String> labels) throws SQLException {
        Map<String, Object> row = new LinkedHashMap<>();
        for (int i = 0; i < labels.size(); i++) {
            row.put(labels.get(i), toJsonSafe(rs.getObject(i + 1)));
        }
        return row;
    }

    /**
     * Converts an arbitrary JDBC value into a value the JSON layer can write.
     */
    public static Object toJsonSafe(Object value) throws SQLException {
        return toJsonSafe(value, 0);
    }

    private static Object toJsonSafe(Object value, int depth) throws SQLException {
        if (value == null) {
            return null;
        }
        if (depth > MAX_NESTED_DEPTH) {
            return String.valueOf(value);
        }
        if (value instanceof Number || value instanceof Boolean || value instanceof String) {
            return value;
        }
        if (value instanceof Clob clob) {
            return readClob(clob);
        }
        if (value instanceof Blob blob) {
            long length = Math.min(blob.length(), MAX_BLOB_BYTES);
            return Base64.getEncoder().encodeToString(blob.getBytes(1, (int) length));
        }
        if (value instanceof SQLXML xml) {
            return xml.getString();
        }
        if (value instanceof byte[] bytes) {
            return Base64.getEncoder().encodeToString(bytes);
        }
        if (value instanceof java.util.Date || value instanceof TemporalAccessor || value instanceof UUID) {
            return value.toString();
        }
        if (value instanceof java.sql.Array array) {
            Object elements = array.getArray();
            if (elements instanceof Object[] objects) {
                List<Object> out = new ArrayList<>(objects.length);
                for (Object element : objects) {
                    out.add(toJsonSafe(element, depth + 1));
                }
                return out;
            }
            return String.valueOf(elements);
        }
        if (value instanceof Object[] objects) {
            List<Object> out = new ArrayList<>(objects.length);
            for (Object element : objects) {
                out.add(toJsonSafe(element, depth + 1));
            }
            return out;
        }
        return value.toString();
    }

    private static String readClob(Clob clob) throws SQLException {
        StringBuilder sb = new StringBuilder();
        char[] buffer = new char[4096];
        try (Reader reader = clob.getCharacterStream()) {
            int read;
            while ((read = reader.read(buffer)) != -1 && sb.length() < MAX_LOB_CHARS) {
                sb.append(buffer, 0, Math.min(read, MAX_LOB_CHARS - sb.length()));
            }
        } catch (IOException e) {
            throw new SQLException("Failed to read CLOB value", e);
        }
        return sb.toString();
    }
}
