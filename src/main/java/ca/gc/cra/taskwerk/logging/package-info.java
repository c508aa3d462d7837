/**
 * <strong>Purpose:</strong> Logging utilities that tune verbosity and sanitize configuration values before emission.
 * <p><strong>Observability:</strong> Coordinates with SLF4J/Logback; no custom metrics.
 * <p><strong>Security:</strong> Provides redaction helpers so secrets never reach log output.
 *
 * @since 0.1.0
 */
package ca.gc.cra.taskwerk.logging;
