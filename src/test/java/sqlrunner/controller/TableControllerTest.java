package sqlrunner.controller;

import io.micronaut.core.type.Argument;
import io.micronaut.http.HttpRequest;
import io.micronaut.http.HttpStatus;
import io.micronaut.http.client.HttpClient;
import io.micronaut.http.client.annotation.Client;
import io.micronaut.http.client.exceptions.HttpClientResponseException;
import io.micronaut.test.extensions.junit5.annotation.MicronautTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.Statement;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@MicronautTest
class TableControllerTest {

    private static final Argument<Map<String, Object>> JSON_MAP = Argument.mapOf(String.class, Object.class);

    @Inject
    @Client("/")
    HttpClient client;

    @Inject
    DataSource dataSource;

    @BeforeEach
    void setUp() throws Exception {
        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement()) {
            stmt.execute("DROP TABLE IF EXISTS http_products");
            stmt.execute("CREATE TABLE http_products (id INT PRIMARY KEY, title VARCHAR(80) NOT NULL)");
            stmt.execute("INSERT INTO http_products VALUES (1, 'Keyboard'), (2, 'Mouse')");
        }
    }

    @AfterEach
    void tearDown() throws Exception {
        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement()) {
            stmt.execute("DROP TABLE IF EXISTS http_products");
        }
    }

    @Test
    @SuppressWarnings("unchecked")
    void testListTables() {
        Map<String, Object> body = client.toBlocking().retrieve(
                HttpRequest.GET("/tables").bearerAuth("alice-token"), JSON_MAP);

        assertThat((List<String>) body.get("tables")).contains("http_products");
    }

    @Test
    @SuppressWarnings("unchecked")
    void testDescribeTable() {
        Map<String, Object> body = client.toBlocking().retrieve(
                HttpRequest.GET("/tables/HTTP_PRODUCTS").bearerAuth("alice-token"), JSON_MAP);

        assertThat(body).containsEntry("name", "http_products");

        List<Map<String, Object>> columns = (List<Map<String, Object>>) body.get("columns");
        assertThat(columns).hasSize(2);
        assertThat(columns.get(0))
                .containsEntry("name", "id")
                .containsEntry("primary_key", true)
                .containsEntry("notnull", true);
        assertThat(columns.get(1))
                .containsEntry("name", "title")
                .containsEntry("primary_key", false);

        List<Map<String, Object>> sample = (List<Map<String, Object>>) body.get("sample_data");
        assertThat(sample).hasSize(2);
        assertThat(sample.get(0)).containsEntry("title", "Keyboard");
    }

    @Test
    @SuppressWarnings("unchecked")
    void testUnknownTableIs404() {
        HttpClientResponseException e = catchThrowableOfType(
                () -> client.toBlocking().exchange(
                        HttpRequest.GET("/tables/http_ghost").bearerAuth("alice-token"), JSON_MAP),
                HttpClientResponseException.class);

        assertThat(e).isNotNull();
        assertThat(e.getStatus().getCode()).isEqualTo(HttpStatus.NOT_FOUND.getCode());
        assertThat(e.getResponse().getBody(Map.class)).hasValueSatisfying(
                error -> assertThat((Map<String, Object>) error).containsEntry("error", "Table Not Found"));
    }

    @Test
    void testTablesRequireAuthentication() {
        HttpClientResponseException e = catchThrowableOfType(
                () -> client.toBlocking().exchange(HttpRequest.GET("/tables"), String.class),
                HttpClientResponseException.class);

        assertThat(e.getStatus().getCode()).isEqualTo(HttpStatus.UNAUTHORIZED.getCode());
    }
}
