/** JSON text to object-graph conversion on top of the Jackson streaming API. */
package ca.gc.cra.taskwerk.application.json;
