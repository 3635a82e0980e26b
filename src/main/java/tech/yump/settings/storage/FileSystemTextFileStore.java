package tech.yump.settings.storage;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class FileSystemTextFileStore implements TextFileStore {

  private static final int WIPE_CHUNK_BYTES = 8192;

  @Override
  public boolean exists(Path file) {
    return Files.isRegularFile(file);
  }

  @Override
  public String read(Path file) throws StorageException {
    log.debug("Reading settings text from {}", file);
    try {
      return Files.readString(file, StandardCharsets.UTF_8);
    } catch (IOException e) {
      log.error("Failed to read {}: {}", file, e.getMessage(), e);
      throw new StorageException("Failed to read file: " + file, e);
    }
  }

  @Override
  public void write(Path file, String content) throws StorageException {
    if (content == null) {
      throw new IllegalArgumentException("Content cannot be null for write operation.");
    }
    log.debug("Writing {} characters to {}", content.length(), file);
    try {
      Files.writeString(file, content, StandardCharsets.UTF_8,
          StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING);
    } catch (IOException e) {
      log.error("Failed to write {}: {}", file, e.getMessage(), e);
      throw new StorageException("Failed to write file: " + file, e);
    }
  }

  @Override
  public void ensureDirectory(Path directory) throws StorageException {
    if (Files.exists(directory, LinkOption.NOFOLLOW_LINKS)) {
      if (!Files.isDirectory(directory)) {
        throw new StorageException("Settings path exists but is not a directory: " + directory);
      }
      return;
    }
    try {
      Files.createDirectories(directory);
      log.info("Created settings directory: {}", directory);
    } catch (IOException e) {
      log.error("Failed to create directory {}: {}", directory, e.getMessage(), e);
      throw new StorageException("Failed to create directory: " + directory, e);
    }
  }

  @Override
  public boolean secureDelete(Path file) throws StorageException {
    if (!Files.isRegularFile(file, LinkOption.NOFOLLOW_LINKS)) {
      log.debug("Nothing to delete at {}", file);
      return false;
    }
    try {
      overwriteWithZeros(file);
      Files.delete(file);
      log.info("Securely deleted {}", file);
      return true;
    } catch (AccessDeniedException e) {
      log.error("Permission denied while deleting {}: {}", file, e.getMessage(), e);
      throw new StorageException("Permission denied deleting file: " + file, e);
    } catch (IOException e) {
      log.error("Failed to securely delete {}: {}", file, e.getMessage(), e);
      throw new StorageException("Failed to delete file: " + file, e);
    }
  }

  private void overwriteWithZeros(Path file) throws IOException {
    try (FileChannel channel = FileChannel.open(file, StandardOpenOption.WRITE)) {
      long remaining = channel.size();
      ByteBuffer zeros = ByteBuffer.allocate(WIPE_CHUNK_BYTES);
      channel.position(0);
      while (remaining > 0) {
        zeros.clear();
        zeros.limit((int) Math.min(WIPE_CHUNK_BYTES, remaining));
        remaining -= channel.write(zeros);
      }
      channel.force(true);
    }
  }
}
