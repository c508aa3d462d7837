/**
 * <strong>Purpose:</strong> Ports the configuration core depends on: process environment and metrics.
 * <p><strong>Role:</strong> Adapters implement these interfaces; tests substitute fixed or recording versions.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.taskwerk.application.port;
