/**
 * Adapters binding the configuration core to the file system and to metrics backends.
 */
package ca.gc.cra.taskwerk.infrastructure;
