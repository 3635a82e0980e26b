package tech.yump.settings.prompt;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConsolePasswordPromptTest {

  private final ByteArrayOutputStream output = new ByteArrayOutputStream();

  private ConsolePasswordPrompt promptWithInput(String input) {
    return new ConsolePasswordPrompt(null,
        new ByteArrayInputStream(input.getBytes(StandardCharsets.UTF_8)),
        new PrintStream(output, true, StandardCharsets.UTF_8));
  }

  @Test
  @DisplayName("Without a console, lines and secrets are read from the input stream")
  void readsFromStreamWithoutConsole() {
    ConsolePasswordPrompt prompt = promptWithInput("alice\ns3cret\n");

    PromptResponse name = prompt.readLine("Name: ");
    PromptResponse secret = prompt.readSecret("Password: ");

    assertEquals("alice", name.value());
    assertFalse(name.cancelled());
    assertEquals("s3cret", secret.value());
    String printed = output.toString(StandardCharsets.UTF_8);
    assertTrue(printed.contains("Name: "));
    assertTrue(printed.contains("Password: "));
  }

  @Test
  @DisplayName("End of input is reported as a cancelled response")
  void endOfInputIsCancellation() {
    ConsolePasswordPrompt prompt = promptWithInput("");

    PromptResponse response = prompt.readSecret("> ");

    assertTrue(response.cancelled());
    assertNull(response.value());
    assertFalse(response.isBlank());
  }

  @Test
  @DisplayName("An empty line is a blank value, not a cancellation")
  void emptyLineIsBlank() {
    ConsolePasswordPrompt prompt = promptWithInput("\n");

    PromptResponse response = prompt.readLine("> ");

    assertFalse(response.cancelled());
    assertTrue(response.isBlank());
  }

  @Test
  @DisplayName("show() prints the message on its own line")
  void showPrintsLine() {
    ConsolePasswordPrompt prompt = promptWithInput("");

    prompt.show("Encryption is enabled for these settings.");

    assertEquals("Encryption is enabled for these settings." + System.lineSeparator(),
        output.toString(StandardCharsets.UTF_8));
  }
}
