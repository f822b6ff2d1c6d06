/**
 * Types that are part of the public API, but are not needed for basic use of the engine.
 * <p>
 * This package contains the extension points an application implements: {@link dev.flagkit.engine.interfaces.AxisValue}
 * for custom targeting dimensions, {@link dev.flagkit.engine.interfaces.TargetingExtension} for opaque custom
 * rule conditions, and listener interfaces used by shadow evaluation and snapshot loading.
 */
package dev.flagkit.engine.interfaces;
