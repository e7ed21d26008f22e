package org.waabox.completist.store.fs;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.completist.store.InMemoryLibraryStore;
import org.waabox.completist.store.LibraryContents;

/**
 * A {@link org.waabox.completist.store.LibraryStore} kept in memory and
 * saved as a single JSON document on the local filesystem.
 *
 * <p>The document lives at {@code <baseDir>/library.json}. It is loaded when
 * the store is created and rewritten on every flush: outside a write batch
 * after each mutation, inside one on {@code forceCheckpoint()} and
 * {@code endWriteBatch()}. Writes go to a temporary file that is then
 * atomically renamed over the document, so a crash never leaves a partial
 * file behind.
 *
 * <p>Unknown JSON properties are ignored on load, so documents written by a
 * newer version can still be read.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class FileSystemLibraryStore extends InMemoryLibraryStore {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      FileSystemLibraryStore.class);

  /** The document file name. */
  static final String DATA_FILE = "library.json";

  /** The mapper for the document. */
  private static final ObjectMapper MAPPER = new ObjectMapper()
      .registerModule(new JavaTimeModule())
      .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
      .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

  /** The document path, never null. */
  private final Path dataFile;

  /** The temporary file written before each rename, never null. */
  private final Path tempFile;

  /**
   * Creates a store in the given directory, loading the existing document
   * if there is one.
   *
   * @param baseDir the directory holding the document, never null
   *
   * @throws UncheckedIOException if the directory cannot be created or the
   *         document cannot be read
   */
  public FileSystemLibraryStore(final Path baseDir) {
    Objects.requireNonNull(baseDir, "baseDir must not be null");
    dataFile = baseDir.resolve(DATA_FILE);
    tempFile = baseDir.resolve(DATA_FILE + ".tmp");

    try {
      Files.createDirectories(baseDir);
    } catch (final IOException e) {
      throw new UncheckedIOException(
          "Failed to create base directory: " + baseDir, e);
    }
    load();
  }

  /**
   * Returns the path of the document.
   *
   * @return the path, never null
   */
  public Path dataFile() {
    return dataFile;
  }

  /** {@inheritDoc} */
  @Override
  protected void persist(final LibraryContents contents) {
    try {
      MAPPER.writeValue(tempFile.toFile(), contents);
      Files.move(tempFile, dataFile,
          StandardCopyOption.REPLACE_EXISTING,
          StandardCopyOption.ATOMIC_MOVE);
      log.debug("Saved library to {}", dataFile);
    } catch (final IOException e) {
      throw new UncheckedIOException(
          "Failed to save library to: " + dataFile, e);
    }
  }

  /** Loads the document, if it exists, into memory. */
  private void load() {
    if (!Files.exists(dataFile)) {
      log.info("No library at {}, starting empty", dataFile);
      return;
    }
    try {
      final LibraryContents contents = MAPPER.readValue(dataFile.toFile(),
          LibraryContents.class);
      restore(contents);
      log.info("Loaded library from {}: {} owned items, {} albums",
          dataFile, contents.ownedItems().size(), contents.albums().size());
    } catch (final IOException e) {
      throw new UncheckedIOException(
          "Failed to load library from: " + dataFile, e);
    }
  }
}
