/**
 * Integration points for connecting the engine to other software: the {@link dev.flagkit.engine.integrations.Hook}
 * observer API used for metrics and tracing, and the configuration builders for hooks and logging.
 */
package dev.flagkit.engine.integrations;
