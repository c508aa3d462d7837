/**
 * File-backed persistence of the global and local configuration layers.
 * <p><strong>Role:</strong> Adapter layer between in-memory layer trees and YAML/JSON files.</p>
 * <p><strong>Concurrency:</strong> No file locking; callers serialize concurrent writers externally.</p>
 * <p><strong>Security:</strong> Secrets are masked before serialization; the global file is restricted to its owner.</p>
 */
package ca.gc.cra.taskwerk.infrastructure.persistence;
