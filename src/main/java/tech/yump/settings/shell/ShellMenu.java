package tech.yump.settings.shell;

import java.util.ArrayList;
import java.util.List;
import java.util.function.BooleanSupplier;
import tech.yump.settings.prompt.PasswordPrompt;
import tech.yump.settings.prompt.PromptResponse;

/**
 * Numbered console menu. Each option's action returns {@code true} to show the menu again
 * or {@code false} to leave it; a cancelled read (end of input) also leaves it.
 */
public class ShellMenu {

  static final String CHOICE_PROMPT = "Choose an option: ";

  private final PasswordPrompt prompt;
  private final String title;
  private final String description;
  private final List<Option> options = new ArrayList<>();

  public ShellMenu(PasswordPrompt prompt, String title) {
    this(prompt, title, null);
  }

  public ShellMenu(PasswordPrompt prompt, String title, String description) {
    this.prompt = prompt;
    this.title = title;
    this.description = description;
  }

  public ShellMenu option(String label, BooleanSupplier action) {
    options.add(new Option(label, action));
    return this;
  }

  public void run() {
    while (true) {
      render();
      PromptResponse response = prompt.readLine(CHOICE_PROMPT);
      if (response.cancelled()) {
        return;
      }
      Integer choice = parseChoice(response.value());
      if (choice == null) {
        prompt.show("Invalid choice. Please enter a number between 1 and " + options.size() + ".");
        continue;
      }
      if (!options.get(choice - 1).action().getAsBoolean()) {
        return;
      }
    }
  }

  private void render() {
    prompt.show("");
    prompt.show("=== " + title + " ===");
    if (description != null && !description.isBlank()) {
      prompt.show(description);
    }
    for (int i = 0; i < options.size(); i++) {
      prompt.show((i + 1) + ". " + options.get(i).label());
    }
  }

  private Integer parseChoice(String input) {
    try {
      int choice = Integer.parseInt(input.trim());
      return choice >= 1 && choice <= options.size() ? choice : null;
    } catch (NumberFormatException e) {
      return null;
    }
  }

  private record Option(String label, BooleanSupplier action) {
  }
}
