package dbgate.spi;

import java.util.Objects;

/**
 * Verdict of a pre-flight statement check.
 */
public sealed interface ValidationResult {

    ValidationResult APPROVED = new Approved();

    static ValidationResult denied(String reason) {
        return new Denied(reason);
    }

    static ValidationResult warning(String message) {
        return new Warning(message);
    }

    record Approved() implements ValidationResult {
    }

    /** The statement must not run. */
    record Denied(String reason) implements ValidationResult {
        public Denied {
            Objects.requireNonNull(reason, "reason");
        }
    }

    /** The statement may run; the message is logged. */
    record Warning(String message) implements ValidationResult {
        public Warning {
            Objects.requireNonNull(message, "message");
        }
    }
}
