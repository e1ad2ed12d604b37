/**
 * Command-line entry points. {@link ca.gc.cra.geolayer.api.Main} dispatches to
 * {@link ca.gc.cra.geolayer.api.RenderCli}.
 */
package ca.gc.cra.geolayer.api;
