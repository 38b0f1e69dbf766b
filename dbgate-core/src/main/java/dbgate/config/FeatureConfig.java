package dbgate.config;

import dbgate.model.DatabaseFeature;

import java.util.EnumSet;
import java.util.Set;

/**
 * Operator switches that can narrow what an engine declares. An engine feature is effective
 * only if the engine declares it and it is not switched off here.
 */
public final class FeatureConfig {
  private final boolean enableTransactions;
  private final boolean enablePreparedStatements;
  private final boolean enableSchemaIntrospection;
  private final boolean enableBatches;

  private FeatureConfig(Builder builder) {
    this.enableTransactions = builder.enableTransactions;
    this.enablePreparedStatements = builder.enablePreparedStatements;
    this.enableSchemaIntrospection = builder.enableSchemaIntrospection;
    this.enableBatches = builder.enableBatches;
  }

  public static Builder builder() {
    return new Builder();
  }

  public static FeatureConfig defaults() {
    return builder().build();
  }

  public boolean enableTransactions() {
    return enableTransactions;
  }

  public boolean enablePreparedStatements() {
    return enablePreparedStatements;
  }

  public boolean enableSchemaIntrospection() {
    return enableSchemaIntrospection;
  }

  public boolean enableBatches() {
    return enableBatches;
  }

  /** Engine features minus the ones switched off. Savepoints follow transactions. */
  public Set<DatabaseFeature> effective(Set<DatabaseFeature> engineFeatures) {
    EnumSet<DatabaseFeature> result = engineFeatures.isEmpty()
        ? EnumSet.noneOf(DatabaseFeature.class) : EnumSet.copyOf(engineFeatures);
    if (!enableTransactions) {
      result.remove(DatabaseFeature.TRANSACTIONS);
      result.remove(DatabaseFeature.SAVEPOINTS);
    }
    if (!enablePreparedStatements) {
      result.remove(DatabaseFeature.PREPARED_STATEMENTS);
    }
    if (!enableSchemaIntrospection) {
      result.remove(DatabaseFeature.SCHEMA_INTROSPECTION);
    }
    if (!enableBatches) {
      result.remove(DatabaseFeature.ATOMIC_BATCH);
    }
    return Set.copyOf(result);
  }

  public static final class Builder {
    private boolean enableTransactions = true;
    private boolean enablePreparedStatements = true;
    private boolean enableSchemaIntrospection = true;
    private boolean enableBatches = true;

    private Builder() {
    }

    public Builder enableTransactions(boolean enableTransactions) {
      this.enableTransactions = enableTransactions;
      return this;
    }

    public Builder enablePreparedStatements(boolean enablePreparedStatements) {
      this.enablePreparedStatements = enablePreparedStatements;
      return this;
    }

    public Builder enableSchemaIntrospection(boolean enableSchemaIntrospection) {
      this.enableSchemaIntrospection = enableSchemaIntrospection;
      return this;
    }

    public Builder enableBatches(boolean enableBatches) {
      this.enableBatches = enableBatches;
      return this;
    }

    public FeatureConfig build() {
      return new FeatureConfig(this);
    }
  }
}
