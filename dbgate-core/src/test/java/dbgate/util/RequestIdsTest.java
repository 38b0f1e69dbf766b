package dbgate.util;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class RequestIdsTest {

  @Test
  void transactionIdsAreUniqueAndOrdered() {
    long before = RequestIds.transactionCount();

    String first = RequestIds.nextTransactionId();
    String second = RequestIds.nextTransactionId();

    assertTrue(first.startsWith("tx-"));
    assertNotEquals(first, second);
    assertTrue(first.compareTo(second) < 0);
    assertTrue(RequestIds.transactionCount() >= before + 2);
  }

  @Test
  void connectionIdsAreUnique() {
    String first = RequestIds.nextConnectionId();
    String second = RequestIds.nextConnectionId();

    assertTrue(first.startsWith("conn-"));
    assertNotEquals(first, second);
    assertTrue(RequestIds.connectionCount() >= 2);
  }

  @Test
  void requestIdsIncrease() {
    long first = RequestIds.nextRequestId();

    assertTrue(RequestIds.nextRequestId() > first);
    assertFalse(RequestIds.startedAt().isAfter(Instant.now()));
  }
}
