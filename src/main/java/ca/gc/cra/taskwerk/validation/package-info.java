/**
 * <strong>Purpose:</strong> Validation helpers for caller-supplied paths and identifiers.
 * <p><strong>Concurrency:</strong> Stateless utilities safe for concurrent invocation.
 * <p><strong>Observability:</strong> No direct metrics or logging; failures surface via {@link IllegalArgumentException}.
 * <p><strong>Security:</strong> Rejects control characters before they reach file paths or log lines.
 *
 * @since 0.1.0
 */
package ca.gc.cra.taskwerk.validation;
