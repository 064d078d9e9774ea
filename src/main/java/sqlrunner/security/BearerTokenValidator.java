package sqlrunner.security;

import io.micronaut.context.annotation.Requires;
import io.micronaut.security.authentication.Authentication;
import io.micronaut.security.token.validator.TokenValidator;
import jakarta.inject.Singleton;
import org.reactivestreams.Publisher;
import org.reactivestreams.Subscriber;
import org.reactivestreams.Subscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sqlrunner.config.RunnerProperties;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Token validator that resolves bearer tokens to user identities.
 * Tokens are configured as {@code username:token} entries under runner.security.tokens.
 */
@Singleton
@Requires(property = "runner.security.enabled", value = "true", defaultValue = "true")
public class BearerTokenValidator<T> implements TokenValidator<T> {

    private static final Logger LOG = LoggerFactory.getLogger(BearerTokenValidator.class);
    static final String ROLE_USER = "ROLE_USER";

    private final Map<String, String> usersByToken;

    public BearerTokenValidator(RunnerProperties properties) {
        this.usersByToken = parseTokens(properties.getSecurity().getTokens());
        if (usersByToken.isEmpty()) {
            throw new IllegalStateException(
                    "runner.security.enabled is true but no runner.security.tokens are configured");
        }
        LOG.info("Bearer token validator loaded {} token(s)", usersByToken.size());
    }

    static Map<String, String> parseTokens(List<String> entries) {
        Map<String, String> result = new HashMap<>();
        if (entries == null) {
            return result;
        }
        for (String entry : entries) {
            int separator = entry == null ? -1 : entry.indexOf(':');
            if (separator <= 0 || separator == entry.length() - 1) {
                throw new IllegalStateException("Invalid token entry, expected username:token");
            }
            String username = entry.substring(0, separator).trim();
            String token = entry.substring(separator + 1).trim();
            if (username.isEmpty() || token.isEmpty()) {
                throw new IllegalStateException("Invalid token entry, expected username:token");
            }
            if (result.putIfAbsent(token, username) != null) {
                throw new IllegalStateException("Duplicate token configured for user " + username);
            }
        }
        return result;
    }

    @Override
    public Publisher<Authentication> validateToken(String token, T request) {
        if (token == null || token.isBlank()) {
            LOG.debug("Empty bearer token provided");
            return this::completeWithoutAuthentication;
        }

        String username = usersByToken.get(token);
        if (username != null) {
            LOG.debug("Bearer token resolved to user {}", username);
            Authentication auth = Authentication.build(username, List.of(ROLE_USER), Map.of());
            return subscriber -> emitAuthentication(subscriber, auth);
        }

        LOG.warn("Invalid bearer token attempt");
        return this::completeWithoutAuthentication;
    }

    private void emitAuthentication(Subscriber<? super Authentication> subscriber, Authentication authentication) {
        subscriber.onSubscribe(new Subscription() {
            private boolean done;
            @Override
            public void request(long n) {
                if (done || n <= 0) {
                    return;
                }
                done = true;
                subscriber.onNext(authentication);
                subscriber.onComplete();
            }

            @Override
            public void cancel() {
                done = true;
            }
        });
    }

    private void completeWithoutAuthentication(Subscriber<? super Authentication> subscriber) {
        subscriber.onSubscribe(new Subscription() {
            private boolean done;
            @Override
            public void request(long n) {
                if (done) {
                    return;
                }
                done = true;
                subscriber.onComplete();
            }

            @Override
            public void cancel() {
                done = true;
            }
        });
    }
}
