package ca.gc.cra.taskwerk.domain.config;

/**
 * Node of the configuration schema tree: either a {@link ConfigSection} that groups children or a
 * {@link SchemaField} leaf.
 *
 * <p>Merge, source tracking and validation decide between "recurse" and "treat as a value" from this tag,
 * never from the shape of the data. An {@code object}-typed field is therefore still a leaf.</p>
 *
 * @since 0.1.0
 */
public sealed interface SchemaNode permits ConfigSection, SchemaField {}
