package dbgate.tx;

public enum TransactionState {
  ACTIVE,
  COMMITTED,
  ROLLED_BACK;

  public boolean isTerminal() {
    return this != ACTIVE;
  }
}
