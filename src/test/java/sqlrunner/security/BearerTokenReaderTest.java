package sqlrunner.security;

import io.micronaut.http.HttpRequest;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class BearerTokenReaderTest {

    private final BearerTokenReader reader = new BearerTokenReader();

    @Test
    void readsBearerToken() {
        assertThat(reader.findToken(HttpRequest.GET("/").header("Authorization", "Bearer abc123")))
                .contains("abc123");
        assertThat(reader.findToken(HttpRequest.GET("/").header("Authorization", "bearer   abc123 ")))
                .contains("abc123");
    }

    @Test
    void ignoresMissingHeaderOrOtherSchemes() {
        assertThat(reader.findToken(HttpRequest.GET("/"))).isEmpty();
        assertThat(reader.findToken(HttpRequest.GET("/").header("Authorization", "Basic dXNlcjpwYXNz"))).isEmpty();
        assertThat(reader.findToken(HttpRequest.GET("/").header("Authorization", "Bearer "))).isEmpty();
    }
}
