package sqlrunner.service;

import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sqlrunner.config.RunnerProperties;
import sqlrunner.exception.SqlExecutionException;
import sqlrunner.exception.TableNotFoundException;
import sqlrunner.model.ColumnInfo;
import sqlrunner.model.TableSchema;
import sqlrunner.util.JdbcValues;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Reads table names, column metadata and sample rows through JDBC metadata.
 * Nothing is cached; each call reflects the current store.
 */
@Singleton
public class SchemaIntrospector {

    private static final Logger LOG = LoggerFactory.getLogger(SchemaIntrospector.class);

    private static final Set<String> BASE_TABLE_TYPES = Set.of("TABLE", "BASE TABLE");

    private final SessionConnections connections;
    private final RunnerProperties.SchemaConfig schemaConfig;

    public SchemaIntrospector(SessionConnections connections, RunnerProperties properties) {
        this.connections = connections;
        this.schemaConfig = properties.getSchema();
    }

    /**
     * Lists user-visible base tables of the current schema, sorted case-insensitively.
     */
    public List<String> listTables() {
        try (Connection connection = connections.acquire()) {
            return visibleTables(connection);
        } catch (SQLException e) {
            throw new SqlExecutionException("listTables", "Failed to list tables: " + e.getMessage(), e);
        }
    }

    /**
     * Describes a table: its columns and a small sample of rows.
     *
     * @param name table name, matched case-insensitively
     * @return schema of the table
     * @throws TableNotFoundException if no visible table has that name
     */
    public TableSchema describeTable(String name) {
        try (Connection connection = connections.acquire()) {
            String actualName = findTable(connection, name)
                    .orElseThrow(() -> new TableNotFoundException(name));

            List<ColumnInfo> columns = readColumns(connection, actualName);
            List<Map<String, Object>> sample = readSample(connection, actualName);
            LOG.debug("Described table {}: {} columns, {} sample rows", actualName, columns.size(), sample.size());
            return new TableSchema(actualName, columns, sample);
        } catch (SQLException e) {
            throw new SqlExecutionException("describeTable", "Failed to describe table '" + name + "': " + e.getMessage(), e);
        }
    }

    private List<String> visibleTables(Connection connection) throws SQLException {
        Set<String> excluded = new HashSet<>();
        for (String table : schemaConfig.getExcludedTables()) {
            excluded.add(table.toLowerCase(Locale.ROOT));
        }

        DatabaseMetaData metaData = connection.getMetaData();
        List<String> tables = new ArrayList<>();
        String schemaPattern = likeLiteral(connection.getSchema(), metaData.getSearchStringEscape());
        try (ResultSet rs = metaData.getTables(connection.getCatalog(), schemaPattern, null, null)) {
            while (rs.next()) {
                String type = rs.getString("TABLE_TYPE");
                String tableName = rs.getString("TABLE_NAME");
                if (type == null || !BASE_TABLE_TYPES.contains(type.toUpperCase(Locale.ROOT))) {
                    continue;
                }
                if (excluded.contains(tableName.toLowerCase(Locale.ROOT))) {
                    continue;
                }
                tables.add(tableName);
            }
        }
        tables.sort(String.CASE_INSENSITIVE_ORDER);
        return tables;
    }

    private Optional<String> findTable(Connection connection, String name) throws SQLException {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        for (String table : visibleTables(connection)) {
            if (table.equalsIgnoreCase(name.trim())) {
                return Optional.of(table);
            }
        }
        return Optional.empty();
    }

    private List<ColumnInfo> readColumns(Connection connection, String table) throws SQLException {
        DatabaseMetaData metaData = connection.getMetaData();
        String catalog = connection.getCatalog();
        String schema = connection.getSchema();

        Set<String> primaryKeys = new HashSet<>();
        try (ResultSet rs = metaData.getPrimaryKeys(catalog, schema, table)) {
            while (rs.next()) {
                primaryKeys.add(rs.getString("COLUMN_NAME"));
            }
        }

        List<ColumnInfo> columns = new ArrayList<>();
        String escape = metaData.getSearchStringEscape();
        try (ResultSet rs = metaData.getColumns(catalog, likeLiteral(schema, escape), likeLiteral(table, escape), null)) {
            while (rs.next()) {
                // the name argument is a pattern; keep only the exact table
                if (!table.equals(rs.getString("TABLE_NAME"))) {
                    continue;
                }
                String columnName = rs.getString("COLUMN_NAME");
                columns.add(new ColumnInfo(
                        columnName,
                        rs.getString("TYPE_NAME"),
                        rs.getInt("NULLABLE") == DatabaseMetaData.columnNoNulls,
                        rs.getString("COLUMN_DEF"),
                        primaryKeys.contains(columnName)));
            }
        }
        return columns;
    }

    /**
     * Escapes LIKE wildcards so a metadata pattern argument matches {@code name} literally.
     */
    static String likeLiteral(String name, String escape) {
        if (name == null || escape == null || escape.isEmpty()) {
            return name;
        }
        return name.replace(escape, escape + escape)
                .replace("_", escape + "_")
                .replace("%", escape + "%");
    }

    private List<Map<String, Object>> readSample(Connection connection, String table) throws SQLException {
        int limit = schemaConfig.getSampleRows();
        String quote = connection.getMetaData().getIdentifierQuoteString();
        if (quote == null || quote.isBlank()) {
            quote = "\"";
        }
        String quoted = quote + table.replace(quote, quote + quote) + quote;

        try (Statement statement = connection.createStatement()) {
            statement.setMaxRows(limit);
            try (ResultSet rs = statement.executeQuery("SELECT * FROM " + quoted)) {
                List<String> labels = JdbcValues.columnLabels(rs.getMetaData());
                return JdbcValues.readRows(rs, labels, limit);
            }
        }
    }
}
