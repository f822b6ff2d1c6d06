/**
 * Interfaces and configuration holders for engine components.
 * <p>
 * Most applications will not need to refer to these types directly. The central one is
 * {@link dev.flagkit.engine.subsystems.NamespaceRegistry}, which owns the active configuration of a
 * namespace; the package also includes concrete types produced by the configuration builders.
 */
package dev.flagkit.engine.subsystems;
