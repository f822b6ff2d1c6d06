package dev.flagkit.engine;

/**
 * Thrown when a flag is evaluated against a configuration that does not contain it.
 * <p>
 * This indicates a wiring defect, such as evaluating a feature with a namespace it was not declared
 * in, rather than a data problem; it is never thrown for a context that simply matches no rule.
 */
@SuppressWarnings("serial")
public class FlagNotFoundException extends RuntimeException {
  private final FeatureId featureId;

  /**
   * Creates an instance.
   *
   * @param featureId the missing flag
   * @param namespaceId the namespace whose configuration was searched
   */
  public FlagNotFoundException(FeatureId featureId, String namespaceId) {
    super("Flag \"" + featureId + "\" not found in configuration of namespace \"" + namespaceId + "\"");
    this.featureId = featureId;
  }

  /**
   * @return the missing flag
   */
  public FeatureId getFeatureId() {
    return featureId;
  }
}
