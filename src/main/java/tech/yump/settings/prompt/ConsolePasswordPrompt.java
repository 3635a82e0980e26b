package tech.yump.settings.prompt;

import java.io.BufferedReader;
import java.io.Console;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import lombok.extern.slf4j.Slf4j;

/**
 * {@link PasswordPrompt} on the process console. Secrets are masked through
 * {@link Console#readPassword} when a console is attached; when input is piped there is
 * no console and secrets are read as plain lines.
 */
@Slf4j
public class ConsolePasswordPrompt implements PasswordPrompt {

  private final Console console;
  private final BufferedReader reader;
  private final PrintStream out;

  public ConsolePasswordPrompt() {
    this(System.console(), System.in, System.out);
  }

  ConsolePasswordPrompt(Console console, InputStream in, PrintStream out) {
    this.console = console;
    this.reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
    this.out = out;
  }

  @Override
  public void show(String message) {
    if (console != null) {
      console.printf("%s%n", message);
      console.flush();
    } else {
      out.println(message);
    }
  }

  @Override
  public PromptResponse readLine(String prompt) {
    if (console != null) {
      String line = console.readLine("%s", prompt);
      return line == null ? PromptResponse.cancelledResponse() : PromptResponse.of(line);
    }
    out.print(prompt);
    out.flush();
    return readFromStream();
  }

  @Override
  public PromptResponse readSecret(String prompt) {
    if (console == null) {
      log.debug("No console attached; secret input will be echoed.");
      out.print(prompt);
      out.flush();
      return readFromStream();
    }
    char[] secret = console.readPassword("%s", prompt);
    if (secret == null) {
      return PromptResponse.cancelledResponse();
    }
    String value = new String(secret);
    Arrays.fill(secret, ' ');
    return PromptResponse.of(value);
  }

  private PromptResponse readFromStream() {
    try {
      String line = reader.readLine();
      return line == null ? PromptResponse.cancelledResponse() : PromptResponse.of(line);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read from standard input.", e);
    }
  }
}
