package sqlrunner.model;

import io.micronaut.core.annotation.Nullable;
import io.micronaut.serde.annotation.Serdeable;

/**
 * Request body of {@code POST /query/execute}.
 */
@Serdeable
public record QueryRequest(@Nullable String query) {
}
