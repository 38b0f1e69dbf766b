package dbgate.error;

/**
 * Classification of every failure surfaced by the data-access core.
 *
 * <p>{@link #isBackendFailure()} separates failures that happened while talking to a backend
 * from contract violations and pre-execution rejections. Only backend failures count
 * against a circuit breaker and only they mark a connection as unusable.
 */
public enum ErrorKind {
  CONNECTION_FAILED(true),
  QUERY_FAILED(true),
  OPERATION_FAILED(true),
  TRANSACTION_FAILED(true),
  /** Misuse of the API contract: wrong parameter count, operation on a finished transaction. */
  VALIDATION_ERROR(false),
  /** The engine does not declare the capability the operation needs. */
  UNSUPPORTED_OPERATION(false),
  POOL_ERROR(true),
  TIMEOUT(true),
  RESOURCE_LIMIT_EXCEEDED(false),
  CIRCUIT_OPEN(false),
  EMERGENCY_SHUTDOWN(false),
  CONFIGURATION_ERROR(false),
  /** Rejected by the statement policy or by a pre-flight validator. */
  SECURITY_VIOLATION(false),
  /** A value could not be represented without loss. */
  CONVERSION_ERROR(false);

  private final boolean backendFailure;

  ErrorKind(boolean backendFailure) {
    this.backendFailure = backendFailure;
  }

  public boolean isBackendFailure() {
    return backendFailure;
  }
}
