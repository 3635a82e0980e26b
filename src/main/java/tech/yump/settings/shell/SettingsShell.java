package tech.yump.settings.shell;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import tech.yump.settings.config.LiteSettingsProperties;
import tech.yump.settings.core.SettingsAuthenticationException;
import tech.yump.settings.core.SettingsLockedException;
import tech.yump.settings.descriptor.FieldDescriptor;
import tech.yump.settings.descriptor.SettingsDescriptor;
import tech.yump.settings.descriptor.SlotKind;
import tech.yump.settings.document.SettingsContext;
import tech.yump.settings.document.SettingsParseException;
import tech.yump.settings.prompt.PasswordPrompt;
import tech.yump.settings.prompt.PromptResponse;

/**
 * Interactive console for a {@link ProfileSettings} document.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "lite-settings.shell.enabled", havingValue = "true", matchIfMissing = true)
public class SettingsShell implements CommandLineRunner {

  static final String MASK = "********";
  static final String NOT_SET = "(not set)";

  private final SettingsContext context;
  private final LiteSettingsProperties.ShellProperties shellProperties;
  private final PasswordPrompt prompt;
  private final ObjectMapper objectMapper;

  public SettingsShell(SettingsContext context, LiteSettingsProperties properties) {
    this.context = context;
    this.shellProperties = properties.shell();
    this.prompt = context.getPrompt();
    this.objectMapper = context.getObjectMapper();
  }

  @Override
  public void run(String... args) {
    ProfileSettings profile;
    try {
      profile = new ProfileSettings(context, shellProperties.directory(), shellProperties.fileName());
    } catch (SettingsAuthenticationException | SettingsParseException e) {
      log.warn("Cannot open profile settings: {}", e.getMessage());
      prompt.show("Cannot open settings: " + e.getMessage());
      return;
    }
    menuFor(profile).run();
  }

  ShellMenu menuFor(ProfileSettings profile) {
    return new ShellMenu(prompt, "Profile Settings", "File: " + profile.getFilePath())
        .option("Show settings", () -> {
          show(profile);
          return true;
        })
        .option("Edit a setting", () -> {
          editMenuFor(profile).run();
          return true;
        })
        .option("Add a server", () -> {
          addServer(profile);
          return true;
        })
        .option("Save settings", () -> {
          save(profile);
          return true;
        })
        .option("Delete settings file", () -> {
          prompt.show(profile.delete() ? "Settings file deleted." : "No settings file to delete.");
          return true;
        })
        .option("Exit", () -> false);
  }

  void show(ProfileSettings profile) {
    for (FieldDescriptor slot : SettingsDescriptor.of(profile.getClass()).getPersistedFields()) {
      prompt.show(slot.label() + ": " + render(slot, slot.get(profile)));
    }
  }

  private ShellMenu editMenuFor(ProfileSettings profile) {
    ShellMenu menu = new ShellMenu(prompt, "Edit Setting", "Pick the setting to change.");
    for (FieldDescriptor slot : editableSlots(profile)) {
      menu.option(slot.label(), () -> {
        edit(profile, slot);
        return false;
      });
    }
    return menu.option("Back", () -> false);
  }

  /**
   * Reads a new value for one slot, converting the typed text to the slot's type. Invalid
   * input asks again; blank input clears a non-primitive slot; a cancelled read keeps the
   * current value.
   */
  void edit(ProfileSettings profile, FieldDescriptor slot) {
    if (!slot.description().isBlank()) {
      prompt.show(slot.description());
    }
    String label = slot.label() + ": ";
    while (true) {
      PromptResponse response = slot.encrypted() ? prompt.readSecret(label) : prompt.readLine(label);
      if (response.cancelled()) {
        return;
      }
      if (response.isBlank()) {
        if (slot.declaredType().isPrimitive()) {
          prompt.show("A value is required.");
          continue;
        }
        slot.set(profile, null);
        return;
      }
      try {
        Object value = objectMapper.convertValue(response.value().trim(),
            objectMapper.getTypeFactory().constructType(slot.genericType()));
        slot.set(profile, value);
        return;
      } catch (IllegalArgumentException e) {
        log.debug("Rejected input for {}: {}", slot.qualifiedName(), e.getMessage());
        prompt.show("Invalid value for " + slot.label() + ". Please try again.");
      }
    }
  }

  private void addServer(ProfileSettings profile) {
    PromptResponse host = prompt.readLine("Host: ");
    if (host.cancelled() || host.isBlank()) {
      return;
    }
    PromptResponse token = prompt.readSecret("Token: ");
    if (token.cancelled()) {
      return;
    }
    profile.getServers().add(new ServerEntry(host.value().trim(), token.isBlank() ? null : token.value()));
    prompt.show("Server added. Save to keep it.");
  }

  /**
   * Saves, then reloads so the in-memory values are plaintext again.
   */
  void save(ProfileSettings profile) {
    try {
      if (profile.save()) {
        profile.load();
        prompt.show("Settings saved.");
      } else {
        prompt.show("Settings could not be saved. See the log for details.");
      }
    } catch (SettingsLockedException e) {
      log.warn("Save refused: {}", e.getMessage());
      prompt.show("Settings are locked: " + e.getMessage());
    }
  }

  private List<FieldDescriptor> editableSlots(ProfileSettings profile) {
    return SettingsDescriptor.of(profile.getClass()).getPersistedFields().stream()
        .filter(slot -> slot.kind() == SlotKind.VALUE || slot.kind() == SlotKind.ENCRYPTED)
        .toList();
  }

  private String render(FieldDescriptor slot, Object value) {
    if (value == null) {
      return NOT_SET;
    }
    return slot.encrypted() ? MASK : String.valueOf(value);
  }
}
