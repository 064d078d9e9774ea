package sqlrunner.lifecycle;

import io.micronaut.context.annotation.Requires;
import io.micronaut.context.event.StartupEvent;
import io.micronaut.runtime.event.annotation.EventListener;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sqlrunner.exception.SqlExecutionException;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;

/**
 * Seeds a small demo schema (customers, orders, shippings) on startup.
 * Tables are created if missing; rows are inserted only into empty tables, so restarts don't duplicate them.
 */
@Singleton
@Requires(property = "runner.sample-data.enabled", value = "true")
public class SampleDataInitializer {

    private static final Logger LOG = LoggerFactory.getLogger(SampleDataInitializer.class);

    private static final List<SeedTable> TABLES = List.of(
            new SeedTable("Customers",
                    "CREATE TABLE IF NOT EXISTS Customers (" +
                            "customer_id INTEGER GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY, " +
                            "first_name VARCHAR(100), " +
                            "last_name VARCHAR(100), " +
                            "age INTEGER, " +
                            "country VARCHAR(100))",
                    "INSERT INTO Customers (first_name, last_name, age, country) VALUES " +
                            "('John', 'Doe', 30, 'USA'), " +
                            "('Robert', 'Luna', 22, 'USA'), " +
                            "('David', 'Robinson', 25, 'UK'), " +
                            "('John', 'Reinhardt', 22, 'UK'), " +
                            "('Betty', 'Doe', 28, 'UAE')"),
            new SeedTable("Orders",
                    "CREATE TABLE IF NOT EXISTS Orders (" +
                            "order_id INTEGER GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY, " +
                            "item VARCHAR(100), " +
                            "amount INTEGER, " +
                            "customer_id INTEGER, " +
                            "FOREIGN KEY (customer_id) REFERENCES Customers(customer_id))",
                    "INSERT INTO Orders (item, amount, customer_id) VALUES " +
                            "('Keyboard', 400, 4), " +
                            "('Mouse', 300, 4), " +
                            "('Monitor', 12000, 3), " +
                            "('Keyboard', 400, 1), " +
                            "('Mousepad', 250, 2)"),
            new SeedTable("Shippings",
                    "CREATE TABLE IF NOT EXISTS Shippings (" +
                            "shipping_id INTEGER GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY, " +
                            "status VARCHAR(100), " +
                            "customer INTEGER)",
                    "INSERT INTO Shippings (status, customer) VALUES " +
                            "('Pending', 2), " +
                            "('Pending', 4), " +
                            "('Delivered', 3), " +
                            "('Pending', 5), " +
                            "('Delivered', 1)")
    );

    private final DataSource dataSource;

    public SampleDataInitializer(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @EventListener
    public void onStartup(StartupEvent event) {
        LOG.info("Initializing sample data");
        seed();
    }

    /**
     * Creates the demo tables and fills any that are empty.
     *
     * @return number of tables that received rows
     */
    public int seed() {
        int seeded = 0;
        try (Connection connection = dataSource.getConnection()) {
            connection.setAutoCommit(false);
            try (Statement statement = connection.createStatement()) {
                for (SeedTable table : TABLES) {
                    statement.execute(table.createSql());
                    if (isEmpty(statement, table.name())) {
                        int rows = statement.executeUpdate(table.insertSql());
                        LOG.info("Seeded {} with {} rows", table.name(), rows);
                        seeded++;
                    }
                }
                connection.commit();
            } catch (SQLException e) {
                connection.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new SqlExecutionException("sampleData", "Failed to initialize sample data: " + e.getMessage(), e);
        }
        LOG.info("Sample data ready ({} table(s) seeded)", seeded);
        return seeded;
    }

    private static boolean isEmpty(Statement statement, String table) throws SQLException {
        try (ResultSet rs = statement.executeQuery("SELECT COUNT(*) FROM " + table)) {
            return rs.next() && rs.getLong(1) == 0;
        }
    }

    private record SeedTable(String name, String createSql, String insertSql) {
    }
}
