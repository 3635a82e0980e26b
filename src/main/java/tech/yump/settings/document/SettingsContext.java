package tech.yump.settings.document;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Getter;
import tech.yump.settings.crypto.EncryptionService;
import tech.yump.settings.prompt.ConsolePasswordPrompt;
import tech.yump.settings.prompt.PasswordPrompt;
import tech.yump.settings.storage.FileSystemTextFileStore;
import tech.yump.settings.storage.TextFileStore;
import tech.yump.settings.walker.GraphWalker;

/**
 * Collaborators shared by settings documents. One context is normally created per
 * application (see {@code SettingsConfiguration}) and passed to every document constructor.
 */
@Getter
public class SettingsContext {

  private final ObjectMapper objectMapper;
  private final EncryptionService encryptionService;
  private final TextFileStore fileStore;
  private final PasswordPrompt prompt;
  private final GraphWalker graphWalker;
  private final SettingsPersistence persistence;

  public SettingsContext(ObjectMapper objectMapper, EncryptionService encryptionService,
                         TextFileStore fileStore, PasswordPrompt prompt) {
    this.objectMapper = objectMapper;
    this.encryptionService = encryptionService;
    this.fileStore = fileStore;
    this.prompt = prompt;
    this.graphWalker = new GraphWalker();
    this.persistence = new SettingsPersistence(objectMapper, fileStore, graphWalker);
  }

  /**
   * Console prompting, local files, default key derivation strength.
   */
  public static SettingsContext defaults() {
    return new SettingsContext(SettingsJson.newObjectMapper(), new EncryptionService(),
        new FileSystemTextFileStore(), new ConsolePasswordPrompt());
  }
}
