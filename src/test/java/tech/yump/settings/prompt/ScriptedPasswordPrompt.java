package tech.yump.settings.prompt;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * {@link PasswordPrompt} that answers from a script and records everything shown.
 * Running out of answers fails the test instead of blocking.
 */
public class ScriptedPasswordPrompt implements PasswordPrompt {

  private final Deque<PromptResponse> answers = new ArrayDeque<>();
  private final List<String> shown = new ArrayList<>();
  private final List<String> asked = new ArrayList<>();
  private int secretReads;

  public ScriptedPasswordPrompt answer(String... values) {
    for (String value : values) {
      answers.add(PromptResponse.of(value));
    }
    return this;
  }

  public ScriptedPasswordPrompt cancel() {
    answers.add(PromptResponse.cancelledResponse());
    return this;
  }

  @Override
  public void show(String message) {
    shown.add(message);
  }

  @Override
  public PromptResponse readLine(String prompt) {
    return next(prompt);
  }

  @Override
  public PromptResponse readSecret(String prompt) {
    secretReads++;
    return next(prompt);
  }

  public List<String> getShown() {
    return shown;
  }

  public List<String> getAsked() {
    return asked;
  }

  public int getSecretReads() {
    return secretReads;
  }

  public int remainingAnswers() {
    return answers.size();
  }

  private PromptResponse next(String prompt) {
    asked.add(prompt);
    if (answers.isEmpty()) {
      throw new IllegalStateException("Unexpected prompt, no scripted answer left: " + prompt);
    }
    return answers.poll();
  }
}
