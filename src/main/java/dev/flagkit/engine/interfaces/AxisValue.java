package dev.flagkit.engine.interfaces;

/**
 * A value of a custom targeting dimension.
 * <p>
 * Implement this on an application enum, giving each constant a stable id that will be used in
 * rules and in serialized configuration. The id must not change once configuration referring to it
 * has been published.
 * <pre><code>
 *     enum Environment implements AxisValue {
 *       PROD("prod"), STAGING("staging");
 *
 *       private final String id;
 *       Environment(String id) { this.id = id; }
 *       public String getId() { return id; }
 *     }
 * </code></pre>
 */
public interface AxisValue {
  /**
   * Returns the stable id of this value.
   *
   * @return the value id
   */
  String getId();
}
