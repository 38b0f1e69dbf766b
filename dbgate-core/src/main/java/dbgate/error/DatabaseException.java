package dbgate.error;

import java.util.Objects;

/**
 * Unchecked exception carrying an {@link ErrorKind}. Adapters translate native driver
 * exceptions into this type at the adapter boundary.
 */
public final class DatabaseException extends RuntimeException {
  private final ErrorKind kind;

  public DatabaseException(ErrorKind kind, String message) {
    super(message);
    this.kind = Objects.requireNonNull(kind, "kind");
  }

  public DatabaseException(ErrorKind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = Objects.requireNonNull(kind, "kind");
  }

  public ErrorKind kind() {
    return kind;
  }

  public boolean isBackendFailure() {
    return kind.isBackendFailure();
  }

  @Override
  public String getMessage() {
    return kind + ": " + super.getMessage();
  }

  /** The message without the kind prefix. */
  public String reason() {
    return super.getMessage();
  }

  public static DatabaseException connectionFailed(String message, Throwable cause) {
    return new DatabaseException(ErrorKind.CONNECTION_FAILED, message, cause);
  }

  public static DatabaseException queryFailed(String message, Throwable cause) {
    return new DatabaseException(ErrorKind.QUERY_FAILED, message, cause);
  }

  public static DatabaseException operationFailed(String message, Throwable cause) {
    return new DatabaseException(ErrorKind.OPERATION_FAILED, message, cause);
  }

  public static DatabaseException transactionFailed(String message, Throwable cause) {
    return new DatabaseException(ErrorKind.TRANSACTION_FAILED, message, cause);
  }

  public static DatabaseException validation(String message) {
    return new DatabaseException(ErrorKind.VALIDATION_ERROR, message);
  }

  public static DatabaseException unsupported(String message) {
    return new DatabaseException(ErrorKind.UNSUPPORTED_OPERATION, message);
  }

  public static DatabaseException poolError(String message) {
    return new DatabaseException(ErrorKind.POOL_ERROR, message);
  }

  public static DatabaseException timeout(String message) {
    return new DatabaseException(ErrorKind.TIMEOUT, message);
  }

  public static DatabaseException resourceLimit(String message) {
    return new DatabaseException(ErrorKind.RESOURCE_LIMIT_EXCEEDED, message);
  }

  public static DatabaseException circuitOpen(String message) {
    return new DatabaseException(ErrorKind.CIRCUIT_OPEN, message);
  }

  public static DatabaseException emergencyShutdown(String message) {
    return new DatabaseException(ErrorKind.EMERGENCY_SHUTDOWN, message);
  }

  public static DatabaseException configuration(String message) {
    return new DatabaseException(ErrorKind.CONFIGURATION_ERROR, message);
  }

  public static DatabaseException security(String message) {
    return new DatabaseException(ErrorKind.SECURITY_VIOLATION, message);
  }

  public static DatabaseException conversion(String message) {
    return new DatabaseException(ErrorKind.CONVERSION_ERROR, message);
  }
}
