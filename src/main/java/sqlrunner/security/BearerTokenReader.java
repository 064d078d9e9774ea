package sqlrunner.security;

import io.micronaut.context.annotation.Requires;
import io.micronaut.http.HttpHeaders;
import io.micronaut.http.HttpRequest;
import io.micronaut.security.token.reader.TokenReader;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Token reader that extracts the token from an {@code Authorization: Bearer <token>} header.
 */
@Singleton
@Requires(property = "runner.security.enabled", value = "true", defaultValue = "true")
public class BearerTokenReader implements TokenReader<HttpRequest<?>> {

    private static final Logger LOG = LoggerFactory.getLogger(BearerTokenReader.class);
    private static final String PREFIX = "Bearer ";

    @Override
    public Optional<String> findToken(HttpRequest<?> request) {
        Optional<String> rawHeader = request.getHeaders().getFirst(HttpHeaders.AUTHORIZATION);
        LOG.trace("Looking for bearer token: present={}", rawHeader.isPresent());

        if (rawHeader.isEmpty()) {
            return Optional.empty();
        }

        String value = rawHeader.get().trim();
        if (!value.regionMatches(true, 0, PREFIX, 0, PREFIX.length())) {
            LOG.debug("Authorization header present but missing Bearer scheme");
            return Optional.empty();
        }
        String token = value.substring(PREFIX.length()).trim();
        return token.isEmpty() ? Optional.empty() : Optional.of(token);
    }
}
