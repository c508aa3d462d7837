/** Small filesystem helpers shared by the layer store. */
package ca.gc.cra.taskwerk.util;
