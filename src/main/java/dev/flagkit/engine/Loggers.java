package dev.flagkit.engine;

/**
 * Static logger names to be shared by implementation code in the main {@code dev.flagkit.engine}
 * package.
 * <p>
 * Most classes in the engine are package-private implementation details whose names are not
 * meaningful to users, so log output uses a base name plus one of these stable suffixes rather
 * than class names. This also makes it convenient to define SLF4J logger name filters.
 */
abstract class Loggers {
  private Loggers() {}

  static final String BASE_LOGGER_NAME = Namespace.class.getName();
  static final String AXES_LOGGER_NAME = "Axes";
  static final String EVALUATION_LOGGER_NAME = "Evaluation";
  static final String HOOKS_LOGGER_NAME = "Hooks";
  static final String REGISTRY_LOGGER_NAME = "Registry";
  static final String SERIALIZATION_LOGGER_NAME = "Serialization";
}
