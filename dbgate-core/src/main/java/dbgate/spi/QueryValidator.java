package dbgate.spi;

/**
 * External pre-flight check consulted before any statement reaches a pool.
 *
 * <p>Injection detection, anomaly scoring and access control plug in here. A
 * {@link ValidationResult.Denied} verdict short-circuits the call without touching the pool.
 */
@FunctionalInterface
public interface QueryValidator {

    /**
     * Validator that approves every statement.
     */
    QueryValidator ALLOW_ALL = (statement, context) -> ValidationResult.APPROVED;

    ValidationResult validate(String statement, CallerContext context);
}
