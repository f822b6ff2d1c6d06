package dev.flagkit.engine;

import java.util.Objects;

import javax.annotation.Nullable;

/**
 * Descriptive information attached to a {@link Configuration}. The engine never interprets these
 * values; they are reported in diagnostics and hook records so that an evaluation can be traced
 * back to the configuration that produced it.
 */
public final class ConfigurationMetadata {
  /**
   * Metadata with no properties set.
   */
  public static final ConfigurationMetadata EMPTY = new ConfigurationMetadata(null, null, null);

  private final String version;
  private final Long generatedAtEpochMillis;
  private final String source;

  private ConfigurationMetadata(String version, Long generatedAtEpochMillis, String source) {
    this.version = version;
    this.generatedAtEpochMillis = generatedAtEpochMillis;
    this.source = source;
  }

  /**
   * Creates metadata.
   *
   * @param version an opaque version string, or null
   * @param generatedAtEpochMillis when the configuration was produced, or null
   * @param source where the configuration came from, or null
   * @return metadata
   */
  public static ConfigurationMetadata of(@Nullable String version, @Nullable Long generatedAtEpochMillis,
      @Nullable String source) {
    if (version == null && generatedAtEpochMillis == null && source == null) {
      return EMPTY;
    }
    return new ConfigurationMetadata(version, generatedAtEpochMillis, source);
  }

  /**
   * @return the opaque version string, or null
   */
  @Nullable
  public String getVersion() {
    return version;
  }

  /**
   * @return the generation time in milliseconds since the epoch, or null
   */
  @Nullable
  public Long getGeneratedAtEpochMillis() {
    return generatedAtEpochMillis;
  }

  /**
   * @return the configuration source, or null
   */
  @Nullable
  public String getSource() {
    return source;
  }

  @Override
  public boolean equals(Object other) {
    if (other instanceof ConfigurationMetadata) {
      ConfigurationMetadata o = (ConfigurationMetadata)other;
      return Objects.equals(version, o.version) && Objects.equals(generatedAtEpochMillis, o.generatedAtEpochMillis) &&
          Objects.equals(source, o.source);
    }
    return false;
  }

  @Override
  public int hashCode() {
    return Objects.hash(version, generatedAtEpochMillis, source);
  }

  @Override
  public String toString() {
    return "ConfigurationMetadata(version=" + version + ",generatedAt=" + generatedAtEpochMillis +
        ",source=" + source + ")";
  }
}
