package tech.yump.settings.shell;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import tech.yump.settings.config.LiteSettingsProperties;
import tech.yump.settings.crypto.EncryptionService;
import tech.yump.settings.descriptor.FieldDescriptor;
import tech.yump.settings.descriptor.SettingsDescriptor;
import tech.yump.settings.document.SettingsContext;
import tech.yump.settings.document.SettingsJson;
import tech.yump.settings.prompt.ScriptedPasswordPrompt;
import tech.yump.settings.storage.FileSystemTextFileStore;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SettingsShellTest {

  @TempDir
  Path tempDir;

  private ScriptedPasswordPrompt prompt;
  private SettingsContext context;
  private SettingsShell shell;

  @BeforeEach
  void setUp() {
    prompt = new ScriptedPasswordPrompt();
    context = new SettingsContext(SettingsJson.newObjectMapper(), new EncryptionService(1000),
        new FileSystemTextFileStore(), prompt);
    LiteSettingsProperties properties = new LiteSettingsProperties(
        new LiteSettingsProperties.CryptoProperties(1000),
        new LiteSettingsProperties.ShellProperties(true, tempDir.toString(), "profile"));
    shell = new SettingsShell(context, properties);
  }

  private FieldDescriptor slot(String name) {
    return SettingsDescriptor.of(ProfileSettings.class).findField(name).orElseThrow();
  }

  private ProfileSettings profile() {
    return new ProfileSettings(context, tempDir.toString(), "profile", "p1");
  }

  @Test
  @DisplayName("Typed input is converted to the field type; invalid input asks again")
  void edit_ConvertsTypedValue() {
    ProfileSettings profile = profile();
    prompt.answer("many", "", "7");

    shell.edit(profile, slot("retries"));

    assertEquals(7, profile.getRetries());
    assertThat(prompt.getShown()).contains("Invalid value for Retries. Please try again.", "A value is required.");
  }

  @Test
  @DisplayName("Blank input clears a non-primitive setting")
  void edit_BlankClearsObjectField() {
    ProfileSettings profile = profile();
    profile.setDisplayName("Alice");
    prompt.answer("  ");

    shell.edit(profile, slot("displayName"));

    assertNull(profile.getDisplayName());
  }

  @Test
  @DisplayName("Encrypted settings are read as secrets and masked when shown")
  void edit_EncryptedField_MaskedInShow() {
    ProfileSettings profile = profile();
    prompt.answer("key-123");

    shell.edit(profile, slot("apiKey"));
    shell.show(profile);

    assertEquals("key-123", profile.getApiKey());
    assertEquals(1, prompt.getSecretReads());
    assertThat(prompt.getShown()).contains("API key: " + SettingsShell.MASK).doesNotContain("API key: key-123");
  }

  @Test
  @DisplayName("Save writes ciphertext and reloads plaintext into the profile")
  void save_ReloadsPlaintext() throws IOException {
    ProfileSettings profile = profile();
    profile.setApiKey("key-123");
    profile.getServers().add(new ServerEntry("api.example.com", "tok"));

    shell.save(profile);

    String written = Files.readString(tempDir.resolve("profile.json"));
    assertFalse(written.contains("key-123"));
    assertFalse(written.contains("\"tok\""));
    assertTrue(written.contains("api.example.com"));
    assertEquals("key-123", profile.getApiKey());
    assertEquals("tok", profile.getServers().get(0).getToken());
    assertThat(prompt.getShown()).contains("Settings saved.");
  }

  @Test
  @DisplayName("The main menu adds a server, saves, and exits")
  void menu_AddServerSaveExit() {
    ProfileSettings profile = profile();
    prompt.answer("3", "db.local", "secret-token", "4", "6");

    shell.menuFor(profile).run();

    assertEquals(1, profile.getServers().size());
    assertEquals("secret-token", profile.getServers().get(0).getToken());
    assertTrue(Files.exists(tempDir.resolve("profile.json")));
  }

  @Test
  @DisplayName("run() creates the password on first start and leaves on exit")
  void run_FirstStart() {
    prompt.answer("p1", "p1", "6");

    shell.run();

    assertTrue(Files.exists(tempDir.resolve("profile.json")));
    assertThat(prompt.getShown()).contains("Encryption password set successfully.", "=== Profile Settings ===");
  }

  @Test
  @DisplayName("run() stops quietly when password entry is cancelled")
  void run_Cancelled() {
    prompt.cancel();

    shell.run();

    assertThat(prompt.getShown()).anyMatch(line -> line.startsWith("Cannot open settings:"));
  }
}
