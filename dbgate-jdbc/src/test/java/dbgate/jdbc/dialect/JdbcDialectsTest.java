package dbgate.jdbc.dialect;

import dbgate.config.ConnectionConfig;
import dbgate.error.DatabaseException;
import dbgate.error.ErrorKind;
import dbgate.model.DatabaseFeature;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.Test;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Proxy;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class JdbcDialectsTest {

  @Test
  void allReturnsBuiltInDialects() {
    List<JdbcDialect> dialects = JdbcDialects.all();

    assertTrue(dialects.size() >= 3);
    assertTrue(dialects.stream().anyMatch(d -> d.name().equals("mysql")));
    assertTrue(dialects.stream().anyMatch(d -> d.name().equals("postgresql")));
    assertTrue(dialects.stream().anyMatch(d -> d.name().equals("h2")));
  }

  @Test
  void getByNameIsCaseInsensitive() {
    assertEquals("mysql", JdbcDialects.get("MySQL").name());
    assertEquals("postgresql", JdbcDialects.get("POSTGRESQL").name());
    assertEquals("h2", JdbcDialects.get("H2").name());
  }

  @Test
  void getByNameThrowsForUnknown() {
    DatabaseException ex = assertThrows(DatabaseException.class, () -> JdbcDialects.get("oracle"));

    assertEquals(ErrorKind.CONFIGURATION_ERROR, ex.kind());
    assertTrue(ex.getMessage().contains("Unknown dialect"));
    assertTrue(ex.getMessage().contains("oracle"));
  }

  @Test
  void detectFromJdbcUrl() {
    assertEquals("mysql", JdbcDialects.detect("jdbc:mysql://localhost:3306/mydb").name());
    assertEquals("mysql", JdbcDialects.detect("jdbc:mariadb://localhost:3306/mydb").name());
    assertEquals("postgresql", JdbcDialects.detect("jdbc:postgresql://localhost:5432/mydb").name());
    assertEquals("h2", JdbcDialects.detect("jdbc:h2:mem:test").name());
  }

  @Test
  void detectFromUnknownUrlThrows() {
    DatabaseException ex = assertThrows(DatabaseException.class,
        () -> JdbcDialects.detect("jdbc:oracle:thin:@localhost:1521:xe"));

    assertEquals(ErrorKind.CONFIGURATION_ERROR, ex.kind());
    assertTrue(ex.getMessage().contains("Supported prefixes"));
  }

  @Test
  void detectFromEmptyUrlThrows() {
    assertThrows(DatabaseException.class, () -> JdbcDialects.detect(""));
    assertThrows(DatabaseException.class, () -> JdbcDialects.detect((String) null));
  }

  @Test
  void detectFromDataSource() {
    JdbcDataSource ds = new JdbcDataSource();
    ds.setURL("jdbc:h2:mem:detect_" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");

    assertEquals("h2", JdbcDialects.detect(ds).name());
  }

  @Test
  void relationalDialectsDeclareTransactionsAndSavepoints() {
    for (JdbcDialect dialect : JdbcDialects.all()) {
      assertTrue(dialect.features().contains(DatabaseFeature.TRANSACTIONS), dialect.name());
      assertTrue(dialect.features().contains(DatabaseFeature.SAVEPOINTS), dialect.name());
      assertTrue(dialect.features().contains(DatabaseFeature.SCHEMA_INTROSPECTION), dialect.name());
      assertFalse(dialect.features().contains(DatabaseFeature.ATOMIC_BATCH), dialect.name());
    }
  }

  @Test
  void urlsFromHostPortAndDatabase() {
    ConnectionConfig config = ConnectionConfig.builder()
        .host("db.internal")
        .database("orders")
        .sslMode("require")
        .build();

    assertEquals("jdbc:postgresql://db.internal:5432/orders?sslmode=require",
        JdbcDialects.get("postgresql").url(config));
    assertEquals("jdbc:mysql://db.internal:3306/orders?sslMode=REQUIRED",
        JdbcDialects.get("mysql").url(config));
    assertEquals("jdbc:h2:mem:orders;DB_CLOSE_DELAY=-1", JdbcDialects.get("h2").url(config));
  }

  @Test
  void explicitPortWins() {
    ConnectionConfig config = ConnectionConfig.builder()
        .host("localhost")
        .port(15432)
        .database("app")
        .sslMode(null)
        .build();

    assertEquals("jdbc:postgresql://localhost:15432/app", JdbcDialects.get("postgresql").url(config));
    assertEquals("jdbc:h2:tcp://localhost:15432/app", JdbcDialects.get("h2").url(config));
  }

  @Test
  void postgresTreatsJsonbAsJson() {
    JdbcDialect postgres = JdbcDialects.get("postgresql");

    assertTrue(postgres.isJsonType("jsonb"));
    assertTrue(postgres.isJsonType("JSON"));
    assertFalse(postgres.isJsonType("text"));
  }

  @Test
  void mySqlCountsMarkersOutsideQuotes() throws Exception {
    JdbcDialect mysql = JdbcDialects.get("mysql");

    assertEquals(2, mysql.parameterCount(null, "SELECT * FROM t WHERE a = ? AND b = ?"));
    assertEquals(1, mysql.parameterCount(null, "SELECT '?', `col?` FROM t WHERE c = ?"));
    assertEquals(0, mysql.parameterCount(null, "SELECT 'it''s \\' ?' FROM t"));
  }

  @Test
  void mySqlIgnoresMarkersInComments() throws Exception {
    JdbcDialect mysql = JdbcDialects.get("mysql");

    assertEquals(1, mysql.parameterCount(null, "SELECT * FROM t -- why not ?\nWHERE id = ?"));
    assertEquals(1, mysql.parameterCount(null, "SELECT * FROM t # owner?\nWHERE id = ?"));
    assertEquals(1, mysql.parameterCount(null, "SELECT /* a ? b */ name FROM t WHERE id = ?"));
    assertEquals(1, mysql.parameterCount(null, "SELECT /* one ? */ * FROM t WHERE a = ? /* trailing ?"));
    // no space after the dashes: arithmetic, not a comment
    assertEquals(2, mysql.parameterCount(null, "SELECT ?--? FROM t"));
  }

  @Test
  void detectFromConnectionPrefersProductName() throws Exception {
    Connection wrapped = urlRewriting("jdbc:h2:mem:product_" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1",
        "jdbc:p6spy:h2:mem:product");
    try (wrapped) {
      assertEquals("h2", JdbcDialects.detect(wrapped).name());
    }
  }

  @Test
  void detectByProductName() {
    assertEquals("postgresql", JdbcDialects.forProductName("PostgreSQL").orElseThrow().name());
    assertEquals("mysql", JdbcDialects.forProductName("MariaDB").orElseThrow().name());
    assertEquals("h2", JdbcDialects.forProductName(" h2 ").orElseThrow().name());
    assertTrue(JdbcDialects.forProductName("Oracle").isEmpty());
    assertTrue(JdbcDialects.forProductName(null).isEmpty());
    assertTrue(JdbcDialects.forUrl("jdbc:p6spy:h2:mem:x").isEmpty());
  }

  /** Opens an H2 connection whose metadata reports {@code reportedUrl}, like a JDBC proxy driver. */
  private static Connection urlRewriting(String url, String reportedUrl) throws SQLException {
    Connection raw = DriverManager.getConnection(url);
    DatabaseMetaData meta = raw.getMetaData();
    DatabaseMetaData reporting = (DatabaseMetaData) Proxy.newProxyInstance(
        DatabaseMetaData.class.getClassLoader(), new Class<?>[] {DatabaseMetaData.class},
        (proxy, method, args) -> method.getName().equals("getURL") ? reportedUrl : invoke(meta, method, args));
    return (Connection) Proxy.newProxyInstance(Connection.class.getClassLoader(),
        new Class<?>[] {Connection.class},
        (proxy, method, args) -> method.getName().equals("getMetaData") ? reporting : invoke(raw, method, args));
  }

  private static Object invoke(Object target, Method method, Object[] args) throws Throwable {
    try {
      return method.invoke(target, args);
    } catch (InvocationTargetException e) {
      throw e.getCause();
    }
  }
}
