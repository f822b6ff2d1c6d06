package dev.flagkit.engine;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import dev.flagkit.engine.interfaces.AxisValue;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * The custom-axis values carried by a {@link Context}: for each axis id, a set of values.
 * <p>
 * A rule's axis constraint matches when the context holds at least one of the allowed values for
 * that axis.
 */
public final class AxisValues {
  /**
   * An instance with no values for any axis.
   */
  public static final AxisValues EMPTY = new AxisValues(ImmutableMap.of());

  private final ImmutableMap<String, ImmutableSet<AxisValue>> values;

  private AxisValues(ImmutableMap<String, ImmutableSet<AxisValue>> values) {
    this.values = values;
  }

  /**
   * Starts building values whose axes are resolved through a catalog.
   *
   * @param catalog the namespace's axis catalog
   * @return a builder
   */
  public static Builder builder(AxisCatalog catalog) {
    return new Builder(catalog);
  }

  /**
   * Returns the values held for an axis.
   *
   * @param axisId the axis id
   * @return the values, empty if none
   */
  public Set<AxisValue> get(String axisId) {
    ImmutableSet<AxisValue> v = values.get(axisId);
    return v == null ? ImmutableSet.of() : v;
  }

  /**
   * Tests whether any held value for an axis has one of the given ids.
   *
   * @param axisId the axis id
   * @param allowedIds the acceptable value ids
   * @return true if there is an intersection
   */
  public boolean containsAny(String axisId, Set<String> allowedIds) {
    ImmutableSet<AxisValue> v = values.get(axisId);
    if (v == null) {
      return false;
    }
    for (AxisValue value: v) {
      if (allowedIds.contains(value.getId())) {
        return true;
      }
    }
    return false;
  }

  /**
   * @return the axis ids that have at least one value
   */
  public Set<String> getAxisIds() {
    return values.keySet();
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof AxisValues && values.equals(((AxisValues)other).values);
  }

  @Override
  public int hashCode() {
    return values.hashCode();
  }

  @Override
  public String toString() {
    return "AxisValues" + values;
  }

  /**
   * Builder for {@link AxisValues}.
   */
  public static final class Builder {
    private final AxisCatalog catalog;
    private final Map<String, Set<AxisValue>> values = new LinkedHashMap<>();

    private Builder(AxisCatalog catalog) {
      this.catalog = catalog;
    }

    /**
     * Adds values for an axis.
     *
     * @param <E> the backing enum type
     * @param axis the axis
     * @param axisValues the values to add
     * @return the builder
     */
    @SafeVarargs
    public final <E extends Enum<E> & AxisValue> Builder put(Axis<E> axis, E... axisValues) {
      Set<AxisValue> set = values.computeIfAbsent(axis.getId(), k -> new LinkedHashSet<>());
      for (E v: axisValues) {
        set.add(v);
      }
      return this;
    }

    /**
     * Adds a value, resolving its axis from its enum type through the catalog.
     *
     * @param <E> the backing enum type
     * @param value the value to add
     * @return the builder
     * @throws IllegalArgumentException if the value's type is not registered in the catalog
     */
    public <E extends Enum<E> & AxisValue> Builder put(E value) {
      Axis<E> axis = catalog.axisFor(value.getDeclaringClass());
      if (axis == null) {
        throw new IllegalArgumentException("no axis is registered for " + value.getDeclaringClass().getName()
            + " in this namespace");
      }
      return put(axis, value);
    }

    /**
     * Adds every value held by another instance.
     *
     * @param other the values to add
     * @return the builder
     */
    public Builder putAll(AxisValues other) {
      for (Map.Entry<String, ImmutableSet<AxisValue>> e: other.values.entrySet()) {
        values.computeIfAbsent(e.getKey(), k -> new LinkedHashSet<>()).addAll(e.getValue());
      }
      return this;
    }

    /**
     * @return the immutable values
     */
    public AxisValues build() {
      if (values.isEmpty()) {
        return EMPTY;
      }
      ImmutableMap.Builder<String, ImmutableSet<AxisValue>> b = ImmutableMap.builder();
      for (Map.Entry<String, Set<AxisValue>> e: values.entrySet()) {
        b.put(e.getKey(), ImmutableSet.copyOf(e.getValue()));
      }
      return new AxisValues(b.build());
    }
  }
}
