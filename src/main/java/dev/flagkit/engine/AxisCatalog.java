package dev.flagkit.engine;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.launchdarkly.logging.LDLogger;
import dev.flagkit.engine.interfaces.AxisValue;

import java.util.List;

/**
 * A registry of custom targeting axes, scoped to one namespace.
 * <p>
 * There is no process-wide axis registry: axes registered in one catalog are invisible to every
 * other catalog, so two namespaces may even use the same axis id for different enum types.
 * <p>
 * Lookups read an immutable map and never block. Registrations are serialized with a lock and
 * publish a new map.
 */
public final class AxisCatalog {
  private volatile ImmutableMap<String, Axis<?>> axesById = ImmutableMap.of();
  private volatile ImmutableMap<Class<?>, Axis<?>> axesByType = ImmutableMap.of();
  private final Object writeLock = new Object();
  private final LDLogger logger;

  /**
   * Creates an empty catalog.
   */
  public AxisCatalog() {
    this(LDLogger.none());
  }

  AxisCatalog(LDLogger logger) {
    this.logger = logger;
  }

  /**
   * Registers an axis, or returns the existing one if the same id and type were already registered.
   *
   * @param <E> the backing enum type
   * @param axisId the axis id
   * @param valueType the backing enum type
   * @return the axis
   * @throws IllegalArgumentException if the id is already bound to a different type, if the type is
   *   already bound to a different id, or if two enum constants share a value id
   */
  @SuppressWarnings("unchecked")
  public <E extends Enum<E> & AxisValue> Axis<E> register(String axisId, Class<E> valueType) {
    if (axisId == null || axisId.trim().isEmpty()) {
      throw new IllegalArgumentException("axis id must not be blank");
    }
    synchronized (writeLock) {
      Axis<?> byId = axesById.get(axisId);
      if (byId != null) {
        if (!byId.getValueType().equals(valueType)) {
          throw new IllegalArgumentException("axis \"" + axisId + "\" is already registered with type "
              + byId.getValueType().getName() + ", cannot register it with " + valueType.getName());
        }
        return (Axis<E>)byId;
      }
      Axis<?> byType = axesByType.get(valueType);
      if (byType != null) {
        throw new IllegalArgumentException("type " + valueType.getName() + " is already registered as axis \""
            + byType.getId() + "\", cannot register it as \"" + axisId + "\"");
      }
      Axis<E> axis;
      try {
        axis = new Axis<>(axisId, valueType);
      } catch (IllegalArgumentException e) {
        throw new IllegalArgumentException("axis \"" + axisId + "\" has duplicate value ids: " + e.getMessage(), e);
      }
      axesById = ImmutableMap.<String, Axis<?>>builder().putAll(axesById).put(axisId, axis).build();
      axesByType = ImmutableMap.<Class<?>, Axis<?>>builder().putAll(axesByType).put(valueType, axis).build();
      logger.debug("Registered axis \"{}\" ({})", axisId, valueType.getName());
      return axis;
    }
  }

  /**
   * Looks up an axis by id.
   *
   * @param axisId the axis id
   * @return the axis, or null if not registered in this catalog
   */
  public Axis<?> axisById(String axisId) {
    return axesById.get(axisId);
  }

  /**
   * Looks up the axis backed by an enum type.
   *
   * @param <E> the backing enum type
   * @param valueType the backing enum type
   * @return the axis, or null if not registered in this catalog
   */
  @SuppressWarnings("unchecked")
  public <E extends Enum<E> & AxisValue> Axis<E> axisFor(Class<E> valueType) {
    return (Axis<E>)axesByType.get(valueType);
  }

  /**
   * @return every registered axis, in registration order
   */
  public List<Axis<?>> getAxes() {
    return ImmutableList.copyOf(axesById.values());
  }

  /**
   * @return true if the id is registered in this catalog
   */
  boolean contains(String axisId) {
    return axesById.containsKey(axisId);
  }
}
