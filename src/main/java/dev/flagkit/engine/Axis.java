package dev.flagkit.engine;

import com.google.common.collect.ImmutableMap;
import dev.flagkit.engine.interfaces.AxisValue;

import java.util.Collection;

/**
 * A custom targeting dimension, backed by an application enum whose constants implement
 * {@link AxisValue}.
 * <p>
 * Axes are created by {@link AxisCatalog#register(String, Class)}, which enforces that an axis id is
 * bound to exactly one enum type within that catalog.
 *
 * @param <E> the backing enum type
 */
public final class Axis<E extends Enum<E> & AxisValue> {
  private final String id;
  private final Class<E> valueType;
  private final ImmutableMap<String, E> valuesById;

  Axis(String id, Class<E> valueType) {
    this.id = id;
    this.valueType = valueType;
    ImmutableMap.Builder<String, E> b = ImmutableMap.builder();
    for (E value: valueType.getEnumConstants()) {
      b.put(value.getId(), value);
    }
    this.valuesById = b.buildOrThrow(); // duplicate value ids are a wiring error
  }

  /**
   * @return the axis id
   */
  public String getId() {
    return id;
  }

  /**
   * @return the backing enum type
   */
  public Class<E> getValueType() {
    return valueType;
  }

  /**
   * Looks up a value by its stable id.
   *
   * @param valueId the value id
   * @return the value, or null if the enum has no constant with that id
   */
  public E valueForId(String valueId) {
    return valuesById.get(valueId);
  }

  /**
   * @return all values of this axis
   */
  public Collection<E> getValues() {
    return valuesById.values();
  }

  @Override
  public boolean equals(Object other) {
    if (other instanceof Axis) {
      Axis<?> o = (Axis<?>)other;
      return id.equals(o.id) && valueType.equals(o.valueType);
    }
    return false;
  }

  @Override
  public int hashCode() {
    return id.hashCode() * 31 + valueType.hashCode();
  }

  @Override
  public String toString() {
    return "Axis(" + id + ":" + valueType.getSimpleName() + ")";
  }
}
