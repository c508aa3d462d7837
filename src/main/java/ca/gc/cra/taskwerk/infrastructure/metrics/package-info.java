/**
 * OpenTelemetry implementation of the metrics port.
 * <p><strong>Role:</strong> Adapter selected at process entry; {@code MetricsPort.NO_OP} is used otherwise.</p>
 * <p><strong>Configuration:</strong> Standard {@code OTEL_*} environment variables.</p>
 */
package ca.gc.cra.taskwerk.infrastructure.metrics;
