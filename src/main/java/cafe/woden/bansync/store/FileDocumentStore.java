package cafe.woden.bansync.store;

import cafe.woden.bansync.config.BanSyncProperties;
import cafe.woden.bansync.store.api.DocumentStore;
import cafe.woden.bansync.store.api.DocumentStoreException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.Objects;
import org.jmolecules.architecture.layered.InfrastructureLayer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * {@link DocumentStore} backed by one file per document under the configured data directory.
 *
 * <p>Writes go to a sibling {@code .tmp} file which is then moved over the target.
 */
@Component
@InfrastructureLayer
public class FileDocumentStore implements DocumentStore {

  private static final Logger log = LoggerFactory.getLogger(FileDocumentStore.class);

  private final Path dataDir;

  @Autowired
  public FileDocumentStore(BanSyncProperties props) {
    this(Paths.get(props.dataDir()));
  }

  public FileDocumentStore(Path dataDir) {
    this.dataDir = Objects.requireNonNull(dataDir, "dataDir");
  }

  public Path dataDir() {
    return dataDir;
  }

  @Override
  public String read(String documentName) {
    Path file = resolve(documentName);
    if (!Files.exists(file)) {
      throw new DocumentStoreException(
          documentName, "Document '" + documentName + "' has not been initialized at " + file);
    }
    try {
      return Files.readString(file, StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new DocumentStoreException(
          documentName, "Could not read document '" + documentName + "' from " + file, e);
    }
  }

  @Override
  public synchronized void overwrite(String documentName, String content) {
    Path file = resolve(documentName);
    Path tmp = file.resolveSibling(file.getFileName().toString() + ".tmp");
    try {
      Files.createDirectories(dataDir);
      Files.writeString(tmp, Objects.requireNonNullElse(content, ""), StandardCharsets.UTF_8);
      try {
        Files.move(
            tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
      } catch (AtomicMoveNotSupportedException atomicNotSupported) {
        log.debug("[bansync] Atomic move unsupported for '{}', using plain replace", file);
        Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
      }
    } catch (IOException e) {
      deleteQuietly(tmp);
      throw new DocumentStoreException(
          documentName, "Could not write document '" + documentName + "' to " + file, e);
    }
  }

  @Override
  public boolean exists(String documentName) {
    return Files.exists(resolve(documentName));
  }

  @Override
  public synchronized boolean initializeIfAbsent(String documentName, String initialContent) {
    if (exists(documentName)) return false;
    overwrite(documentName, initialContent);
    log.info("[bansync] Initialized document '{}' in {}", documentName, dataDir);
    return true;
  }

  private Path resolve(String documentName) {
    String name = Objects.toString(documentName, "").trim();
    if (name.isEmpty() || name.contains("/") || name.contains("\\") || name.equals("..")) {
      throw new IllegalArgumentException("Invalid document name: '" + documentName + "'");
    }
    return dataDir.resolve(name);
  }

  private static void deleteQuietly(Path tmp) {
    try {
      Files.deleteIfExists(tmp);
    } catch (IOException e) {
      log.warn("[bansync] Could not remove temporary file '{}'", tmp, e);
    }
  }
}
