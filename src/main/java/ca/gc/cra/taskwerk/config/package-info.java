/**
 * <strong>Purpose:</strong> Layered configuration core: schema registry, merge engine, validator, environment
 * overlay and the {@link ca.gc.cra.taskwerk.config.ConfigManager} facade.
 * <p><strong>Pipeline:</strong> defaults, global file, local file and environment are merged in that order and
 * validated against the schema.</p>
 * <p><strong>Errors:</strong> Every failure is a subclass of
 * {@link ca.gc.cra.taskwerk.config.ConfigurationException}.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.taskwerk.config;
