/**
 * Configuration domain model: layers, typed paths, the schema tree and violation records.
 * <p><strong>Role:</strong> Domain layer shared by the schema registry, merge engine, validator and layer store.</p>
 * <p><strong>Concurrency:</strong> Schema and path types are immutable. Trees handled by {@link
 * ca.gc.cra.taskwerk.domain.config.ConfigTrees} are plain mutable maps owned by the caller.</p>
 * <p><strong>Security:</strong> Sensitivity is declared on {@link ca.gc.cra.taskwerk.domain.config.SchemaField};
 * masking itself happens at the persistence boundary.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.taskwerk.domain.config;
