package dev.flagkit.engine.integrations;

import javax.annotation.Nullable;

/**
 * Describes a configuration load, passed to {@link Hook#afterConfigLoad(ConfigLoadRecord)}.
 */
public final class ConfigLoadRecord {
  private final String namespaceId;
  private final int featureCount;
  private final String version;

  /**
   * Creates an instance.
   *
   * @param namespaceId the namespace id
   * @param featureCount the number of flags in the loaded configuration
   * @param version the loaded configuration's version, or null
   */
  public ConfigLoadRecord(String namespaceId, int featureCount, @Nullable String version) {
    this.namespaceId = namespaceId;
    this.featureCount = featureCount;
    this.version = version;
  }

  public String getNamespaceId() {
    return namespaceId;
  }

  public int getFeatureCount() {
    return featureCount;
  }

  @Nullable
  public String getVersion() {
    return version;
  }

  @Override
  public String toString() {
    return "ConfigLoadRecord(" + namespaceId + ",flags=" + featureCount + ",version=" + version + ")";
  }
}
