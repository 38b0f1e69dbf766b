package dbgate.tx;

import dbgate.error.DatabaseException;
import dbgate.error.ErrorKind;
import dbgate.model.ExecuteResult;
import dbgate.model.Value;
import dbgate.spi.CommandBatch;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ManagedBatchTest {
  private static final SessionGuard GUARD = SessionGuard.direct(() -> { });

  private final List<String> calls = new ArrayList<>();
  private final AtomicInteger finished = new AtomicInteger();

  private final CommandBatch backend = new CommandBatch() {
    private int queued;

    @Override
    public void queue(String command, List<Value> params) {
      calls.add("queue " + command);
      queued++;
    }

    @Override
    public List<ExecuteResult> exec() {
      calls.add("exec");
      List<ExecuteResult> results = new ArrayList<>();
      for (int i = 0; i < queued; i++) {
        results.add(ExecuteResult.of(1, Duration.ZERO));
      }
      return results;
    }

    @Override
    public void discard() {
      calls.add("discard");
    }
  };

  @Test
  void execAppliesQueuedCommandsOnce() {
    ManagedBatch batch = new ManagedBatch(backend, GUARD, finished::incrementAndGet);
    batch.queue("SET a", List.of(Value.of("1"))).queue("INCR b", List.of());

    assertEquals(2, batch.queuedCount());
    assertEquals(2, batch.exec().size());
    assertFalse(batch.isOpen());
    assertEquals(1, finished.get());

    DatabaseException e = assertThrows(DatabaseException.class, batch::exec);
    assertEquals(ErrorKind.VALIDATION_ERROR, e.kind());
    assertThrows(DatabaseException.class, () -> batch.queue("SET c", List.of()));
    assertEquals(1, calls.stream().filter("exec"::equals).count());
  }

  @Test
  void discardDropsEverything() {
    ManagedBatch batch = new ManagedBatch(backend, GUARD, finished::incrementAndGet);
    batch.queue("SET a", List.of());
    batch.discard();

    assertEquals(List.of("queue SET a", "discard"), calls);
    assertThrows(DatabaseException.class, batch::discard);
  }

  @Test
  void closeDiscardsOnlyOpenBatch() {
    try (ManagedBatch batch = new ManagedBatch(backend, GUARD, finished::incrementAndGet)) {
      batch.queue("SET a", List.of());
    }
    try (ManagedBatch batch = new ManagedBatch(backend, GUARD, () -> { })) {
      batch.exec();
    }

    assertEquals(List.of("queue SET a", "discard", "exec"), calls);
    assertEquals(1, finished.get());
  }

  @Test
  void abandonFinishesWithoutBackendCall() {
    ManagedBatch batch = new ManagedBatch(backend, GUARD, finished::incrementAndGet);
    batch.queue("SET a", List.of());

    batch.abandon();
    batch.abandon();
    batch.close();

    assertFalse(batch.isOpen());
    assertEquals(1, finished.get());
    assertEquals(List.of("queue SET a"), calls);
  }
}
