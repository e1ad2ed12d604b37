/**
 * Configuration layering (defaults, YAML, CLI) and the composition root of the {@code render} command.
 */
package ca.gc.cra.geolayer.config;
