package tech.yump.settings.storage;

/**
 * Runtime exception for failures of the underlying text file store
 * (missing permissions, full disk, unreadable files).
 */
public class StorageException extends RuntimeException {

  public StorageException(String message) {
    super(message);
  }

  public StorageException(String message, Throwable cause) {
    super(message, cause);
  }
}
