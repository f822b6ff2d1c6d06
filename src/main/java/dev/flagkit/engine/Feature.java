package dev.flagkit.engine;

import java.util.Objects;

/**
 * A typed handle to a feature flag declared in a namespace.
 * <p>
 * A feature carries no targeting data; it only names the flag and fixes its value type. The flag's
 * behavior lives in the {@link FlagDefinition} that the namespace's current {@link Configuration}
 * maps its {@link FeatureId} to.
 *
 * @param <T> the flag's value type
 */
public final class Feature<T> {
  private final FeatureId id;
  private final FlagValueType type;
  private final Class<T> valueClass;

  private Feature(FeatureId id, FlagValueType type, Class<T> valueClass) {
    this.id = id;
    this.type = type;
    this.valueClass = valueClass;
  }

  /**
   * @param namespaceSeed the identifier seed of the owning namespace
   * @param key the flag key
   * @return a boolean feature
   */
  public static Feature<Boolean> booleanFeature(String namespaceSeed, String key) {
    return new Feature<>(FeatureId.of(namespaceSeed, key), FlagValueType.BOOLEAN, Boolean.class);
  }

  /**
   * @param namespaceSeed the identifier seed of the owning namespace
   * @param key the flag key
   * @return a string feature
   */
  public static Feature<String> stringFeature(String namespaceSeed, String key) {
    return new Feature<>(FeatureId.of(namespaceSeed, key), FlagValueType.STRING, String.class);
  }

  /**
   * @param namespaceSeed the identifier seed of the owning namespace
   * @param key the flag key
   * @return an integer feature
   */
  public static Feature<Integer> intFeature(String namespaceSeed, String key) {
    return new Feature<>(FeatureId.of(namespaceSeed, key), FlagValueType.INT, Integer.class);
  }

  /**
   * @param namespaceSeed the identifier seed of the owning namespace
   * @param key the flag key
   * @return a floating-point feature
   */
  public static Feature<Double> doubleFeature(String namespaceSeed, String key) {
    return new Feature<>(FeatureId.of(namespaceSeed, key), FlagValueType.DOUBLE, Double.class);
  }

  /**
   * @param <E> the enum type
   * @param namespaceSeed the identifier seed of the owning namespace
   * @param key the flag key
   * @param enumClass the enum type
   * @return an enum feature
   */
  public static <E extends Enum<E>> Feature<E> enumFeature(String namespaceSeed, String key, Class<E> enumClass) {
    return new Feature<>(FeatureId.of(namespaceSeed, key), FlagValueType.ENUM, Objects.requireNonNull(enumClass));
  }

  /**
   * @return the flag identity
   */
  public FeatureId getId() {
    return id;
  }

  /**
   * @return the flag key
   */
  public String getKey() {
    return id.getKey();
  }

  /**
   * @return the kind of value
   */
  public FlagValueType getType() {
    return type;
  }

  /**
   * @return the Java class of the value
   */
  public Class<T> getValueClass() {
    return valueClass;
  }

  /**
   * Checks that a value can be produced by this feature.
   *
   * @param value a candidate value
   * @return the value
   * @throws IllegalArgumentException if the value is null, of the wrong class, or a non-finite double
   */
  T checkValue(Object value) {
    if (value == null) {
      throw new IllegalArgumentException("flag \"" + id + "\" cannot have a null value");
    }
    if (!valueClass.isInstance(value)) {
      throw new IllegalArgumentException("flag \"" + id + "\" expects " + valueClass.getName() +
          " but got " + value.getClass().getName());
    }
    if (value instanceof Double && (((Double)value).isNaN() || ((Double)value).isInfinite())) {
      throw new IllegalArgumentException("flag \"" + id + "\" cannot have a non-finite value");
    }
    return valueClass.cast(value);
  }

  @Override
  public boolean equals(Object other) {
    if (other instanceof Feature) {
      Feature<?> o = (Feature<?>)other;
      return id.equals(o.id) && type == o.type && valueClass.equals(o.valueClass);
    }
    return false;
  }

  @Override
  public int hashCode() {
    return id.hashCode();
  }

  @Override
  public String toString() {
    return "Feature(" + id + ":" + type + ")";
  }
}
