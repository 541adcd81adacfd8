package cafe.woden.bansync.store.api;

/** A document could not be read or written. */
public class DocumentStoreException extends RuntimeException {

  private final String documentName;

  public DocumentStoreException(String documentName, String message) {
    super(message);
    this.documentName = documentName;
  }

  public DocumentStoreException(String documentName, String message, Throwable cause) {
    super(message, cause);
    this.documentName = documentName;
  }

  public String documentName() {
    return documentName;
  }
}
