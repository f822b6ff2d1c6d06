package dev.flagkit.engine.integrations;

import javax.annotation.Nullable;

/**
 * Describes a rollback, passed to {@link Hook#afterConfigRollback(ConfigRollbackRecord)}.
 */
public final class ConfigRollbackRecord {
  private final String namespaceId;
  private final int steps;
  private final String version;

  /**
   * Creates an instance.
   *
   * @param namespaceId the namespace id
   * @param steps how many configurations were undone
   * @param version the restored configuration's version, or null
   */
  public ConfigRollbackRecord(String namespaceId, int steps, @Nullable String version) {
    this.namespaceId = namespaceId;
    this.steps = steps;
    this.version = version;
  }

  public String getNamespaceId() {
    return namespaceId;
  }

  public int getSteps() {
    return steps;
  }

  @Nullable
  public String getVersion() {
    return version;
  }

  @Override
  public String toString() {
    return "ConfigRollbackRecord(" + namespaceId + ",steps=" + steps + ",version=" + version + ")";
  }
}
