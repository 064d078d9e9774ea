package sqlrunner.controller;

import io.micronaut.core.type.Argument;
import io.micronaut.http.HttpRequest;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.HttpStatus;
import io.micronaut.http.client.HttpClient;
import io.micronaut.http.client.annotation.Client;
import io.micronaut.http.client.exceptions.HttpClientResponseException;
import io.micronaut.test.extensions.junit5.annotation.MicronautTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * HTTP-level tests for statement execution and history.
 */
@MicronautTest
class QueryControllerTest {

    private static final String ALICE = "alice-token";
    private static final String BOB = "bob-token";
    private static final Argument<Map<String, Object>> JSON_MAP = Argument.mapOf(String.class, Object.class);

    @Inject
    @Client("/")
    HttpClient client;

    @BeforeEach
    void setUp() {
        clear(ALICE);
        clear(BOB);
    }

    @AfterEach
    void tearDown() {
        execute(ALICE, "DROP TABLE IF EXISTS http_items");
    }

    @Test
    void testExecuteRoundTripOverHttp() {
        execute(ALICE, "CREATE TABLE http_items (x INTEGER)");
        Map<String, Object> insert = execute(ALICE, "INSERT INTO http_items VALUES (1)");
        Map<String, Object> select = execute(ALICE, "SELECT * FROM http_items");

        assertThat(insert)
                .containsEntry("success", true)
                .containsEntry("message", "Successfully inserted 1 row(s)!")
                .containsEntry("affected_rows", 1)
                .containsEntry("category", "INSERT");
        assertThat(select)
                .containsEntry("success", true)
                .containsEntry("columns", List.of("x"))
                .containsEntry("rows", List.of(Map.of("x", 1)))
                .containsKey("execution_time");
    }

    @Test
    void testFailedStatementStillAnswers200() {
        HttpResponse<Map<String, Object>> response = client.toBlocking().exchange(
                HttpRequest.POST("/query/execute", Map.of("query", "SELECT * FROM http_nowhere")).bearerAuth(ALICE),
                JSON_MAP);

        assertThat(response.getStatus().getCode()).isEqualTo(HttpStatus.OK.getCode());
        assertThat(response.body())
                .containsEntry("success", false)
                .containsKey("error");
    }

    @Test
    void testBlankQueryIsRejectedWith400() {
        HttpClientResponseException e = catchThrowableOfType(
                () -> client.toBlocking().exchange(
                        HttpRequest.POST("/query/execute", Map.of("query", "   ")).bearerAuth(ALICE), JSON_MAP),
                HttpClientResponseException.class);

        assertThat(e).isNotNull();
        assertThat(e.getStatus().getCode()).isEqualTo(HttpStatus.BAD_REQUEST.getCode());
        assertThat(history(ALICE)).isEmpty();
    }

    @Test
    void testHistoryIsPerUserAndNewestFirst() {
        execute(ALICE, "SELECT 1");
        execute(ALICE, "SELECT nonsense_column");
        execute(BOB, "SELECT 3");

        List<Map<String, Object>> aliceHistory = history(ALICE);

        assertThat(aliceHistory).hasSize(2);
        assertThat(aliceHistory.get(0))
                .containsEntry("query", "SELECT nonsense_column")
                .containsEntry("success", false)
                .containsKey("timestamp");
        assertThat(aliceHistory.get(1))
                .containsEntry("query", "SELECT 1")
                .containsEntry("success", true)
                .containsEntry("rows_affected", 1);
        assertThat(history(BOB)).extracting(item -> item.get("query")).containsExactly("SELECT 3");
    }

    @Test
    void testClearHistory() {
        execute(ALICE, "SELECT 1");

        Map<String, Object> cleared = client.toBlocking().retrieve(
                HttpRequest.DELETE("/query/history").bearerAuth(ALICE), JSON_MAP);

        assertThat(cleared).containsEntry("message", "Query history cleared successfully");
        assertThat(history(ALICE)).isEmpty();
    }

    @Test
    void testMissingOrUnknownTokenIsUnauthorized() {
        HttpClientResponseException missing = catchThrowableOfType(
                () -> client.toBlocking().exchange(HttpRequest.GET("/query/history"), String.class),
                HttpClientResponseException.class);
        HttpClientResponseException unknown = catchThrowableOfType(
                () -> client.toBlocking().exchange(
                        HttpRequest.GET("/query/history").bearerAuth("forged"), String.class),
                HttpClientResponseException.class);

        assertThat(missing.getStatus().getCode()).isEqualTo(HttpStatus.UNAUTHORIZED.getCode());
        assertThat(unknown.getStatus().getCode()).isEqualTo(HttpStatus.UNAUTHORIZED.getCode());
    }

    private Map<String, Object> execute(String token, String sql) {
        return client.toBlocking().retrieve(
                HttpRequest.POST("/query/execute", Map.of("query", sql)).bearerAuth(token), JSON_MAP);
    }

    private List<Map<String, Object>> history(String token) {
        return client.toBlocking().retrieve(
                HttpRequest.GET("/query/history").bearerAuth(token), Argument.listOf(JSON_MAP));
    }

    private void clear(String token) {
        client.toBlocking().exchange(HttpRequest.DELETE("/query/history").bearerAuth(token));
    }
}
