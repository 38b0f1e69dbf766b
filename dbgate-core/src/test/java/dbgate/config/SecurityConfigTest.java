package dbgate.config;

import dbgate.error.DatabaseException;
import dbgate.error.ErrorKind;
import dbgate.model.QueryType;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class SecurityConfigTest {

  @Test
  void defaultsAllowDataManipulationOnly() {
    SecurityConfig security = SecurityConfig.defaults();
    assertEquals(10_000, security.maxQueryLength());
    assertEquals(Set.of(QueryType.SELECT, QueryType.INSERT, QueryType.UPDATE, QueryType.DELETE),
        security.allowedOperations());

    security.check("SELECT 1");
    DatabaseException e = assertThrows(DatabaseException.class, () -> security.check("DROP TABLE users"));
    assertEquals(ErrorKind.SECURITY_VIOLATION, e.kind());
  }

  @Test
  void rejectsOverlongStatements() {
    SecurityConfig security = SecurityConfig.builder().maxQueryLength(20).build();

    DatabaseException e = assertThrows(DatabaseException.class,
        () -> security.check("SELECT * FROM a_very_long_table_name"));
    assertEquals(ErrorKind.SECURITY_VIOLATION, e.kind());
  }

  @Test
  void emptyStatementIsValidationError() {
    DatabaseException e = assertThrows(DatabaseException.class, () -> SecurityConfig.defaults().check("  "));
    assertEquals(ErrorKind.VALIDATION_ERROR, e.kind());
  }

  @Test
  void allowExtendsOperations() {
    SecurityConfig security = SecurityConfig.builder().allow(QueryType.CREATE, QueryType.OTHER).build();

    security.check("CREATE TABLE t (id INT)");
    security.check("SET a 1");
    assertThrows(DatabaseException.class, () -> security.check("ALTER TABLE t ADD c INT"));
  }
}
