package tech.yump.settings.shell;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import tech.yump.settings.descriptor.Encrypted;

/**
 * A remote server the profile talks to. The access token is stored encrypted.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class ServerEntry {

  private String host;

  @Encrypted
  private String token;

  @Override
  public String toString() {
    return host + (token != null ? " (token set)" : "");
  }
}
