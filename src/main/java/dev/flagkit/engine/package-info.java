/**
 * Main package for the flagkit engine, containing namespaces, the flag model and configuration classes.
 * <p>
 * You will most often use {@link dev.flagkit.engine.Namespace} (a group of flags with its own registry),
 * {@link dev.flagkit.engine.FlagDefinition} and {@link dev.flagkit.engine.Rule} (what a flag does), and
 * {@link dev.flagkit.engine.Context} (what a flag is evaluated for). Remote configuration is read with
 * {@link dev.flagkit.engine.ConfigurationCodec} and {@link dev.flagkit.engine.NamespaceSnapshotLoader}.
 */
package dev.flagkit.engine;
