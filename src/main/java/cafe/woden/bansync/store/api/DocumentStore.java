package cafe.woden.bansync.store.api;

import org.jmolecules.architecture.layered.InfrastructureLayer;

/**
 * Durable storage for whole named documents.
 *
 * <p>Each overwrite is atomic at the document level: after an interruption either the previous or
 * the new full content is readable, never a mix.
 */
@InfrastructureLayer
public interface DocumentStore {

  /**
   * Returns the full content of {@code documentName}.
   *
   * @throws DocumentStoreException if the document is absent or cannot be read. An absent document
   *     is an initialization error, not an empty state.
   */
  String read(String documentName);

  /** Replaces the full content of {@code documentName}. */
  void overwrite(String documentName, String content);

  boolean exists(String documentName);

  /**
   * Creates {@code documentName} with {@code initialContent} unless it already exists.
   *
   * @return true if the document was created
   */
  boolean initializeIfAbsent(String documentName, String initialContent);
}
