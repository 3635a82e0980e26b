package tech.yump.settings.storage;

import java.nio.file.Path;

/**
 * Contract for the plain text storage a settings document is persisted to.
 * One document maps to exactly one file; implementations do not coordinate
 * concurrent writers.
 */
public interface TextFileStore {

  /**
   * @param file Absolute path of the file.
   * @return true if the path exists and is a regular file.
   */
  boolean exists(Path file);

  /**
   * Reads the whole file as UTF-8 text.
   *
   * @param file Absolute path of the file. Must exist.
   * @return The file content.
   * @throws StorageException If the file cannot be read.
   */
  String read(Path file) throws StorageException;

  /**
   * Replaces the content of the file, creating it if needed. The write is not
   * atomic: a crash part way through can leave a truncated file behind.
   *
   * @param file    Absolute path of the file.
   * @param content UTF-8 text to write.
   * @throws StorageException If the file cannot be written.
   */
  void write(Path file, String content) throws StorageException;

  /**
   * Creates the directory and any missing parents.
   *
   * @param directory Absolute path of the directory.
   * @throws StorageException If the path exists but is not a directory, or cannot be created.
   */
  void ensureDirectory(Path directory) throws StorageException;

  /**
   * Overwrites the file content with zeros before deleting it.
   *
   * @param file Absolute path of the file.
   * @return true if a file was deleted, false if there was nothing to delete.
   * @throws StorageException If overwriting or deleting fails.
   */
  boolean secureDelete(Path file) throws StorageException;
}
