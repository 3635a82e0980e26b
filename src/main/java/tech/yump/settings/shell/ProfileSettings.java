package tech.yump.settings.shell;

import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import tech.yump.settings.descriptor.Encrypted;
import tech.yump.settings.descriptor.SettingInfo;
import tech.yump.settings.document.SettingsContext;
import tech.yump.settings.document.SettingsDocument;

/**
 * User profile edited by the interactive shell.
 */
@Getter
@Setter
public class ProfileSettings extends SettingsDocument {

  @SettingInfo(name = "Display name", description = "Name shown to other users.")
  private String displayName = "";

  @SettingInfo(name = "Retries", description = "How often a failed request is repeated.")
  private int retries = 3;

  @Encrypted
  @SettingInfo(name = "API key", description = "Key sent with every request. Stored encrypted.")
  private String apiKey;

  @SettingInfo(name = "Servers")
  private List<ServerEntry> servers = new ArrayList<>();

  public ProfileSettings(SettingsContext context, String directory, String fileName) {
    this(context, directory, fileName, null);
  }

  public ProfileSettings(SettingsContext context, String directory, String fileName, String password) {
    super(context, directory, fileName, password);
    open();
  }
}
