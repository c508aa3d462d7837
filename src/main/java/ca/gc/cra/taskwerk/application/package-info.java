/**
 * Application layer: ports and the JSON helper shared by the configuration core.
 */
package ca.gc.cra.taskwerk.application;
