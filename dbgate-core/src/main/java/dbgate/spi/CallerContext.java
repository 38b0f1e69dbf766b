package dbgate.spi;

import java.util.Map;
import java.util.Objects;

/**
 * Who issued a statement, as seen by a {@link QueryValidator}.
 */
public record CallerContext(String principal, String clientAddress, Map<String, String> attributes) {

    public static final CallerContext ANONYMOUS = new CallerContext("anonymous", "local", Map.of());

    public CallerContext {
        Objects.requireNonNull(principal, "principal");
        Objects.requireNonNull(clientAddress, "clientAddress");
        attributes = Map.copyOf(attributes);
    }

    public static CallerContext of(String principal) {
        return new CallerContext(principal, "local", Map.of());
    }
}
