package dev.ragjudge.judge.prompt;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A system prompt plus a user template with {@code {placeholder}} variables.
 *
 * @param name template identifier, equal to the judge operation it serves
 * @param version template revision, for tracking prompt changes
 * @param description what the template asks the model to do
 * @param systemPrompt system message defining the judge's role
 * @param userTemplate user message with placeholders
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PromptTemplate(
    String name, String version, String description, String systemPrompt, String userTemplate) {

  private static final Pattern PLACEHOLDER = Pattern.compile("\\{([a-z_]+)\\}");

  public PromptTemplate {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("Prompt name must not be blank");
    }
    if (systemPrompt == null || systemPrompt.isBlank()) {
      throw new IllegalArgumentException("Prompt '" + name + "' has no system prompt");
    }
    if (userTemplate == null || userTemplate.isBlank()) {
      throw new IllegalArgumentException("Prompt '" + name + "' has no user template");
    }
    version = version == null ? "1.0" : version;
    description = description == null ? "" : description;
  }

  /**
   * Substitutes placeholders in a single pass, so substituted values are never re-expanded.
   * Placeholders without a matching variable are left untouched.
   */
  public String formatUserPrompt(Map<String, String> variables) {
    Matcher matcher = PLACEHOLDER.matcher(userTemplate);
    StringBuilder out = new StringBuilder(userTemplate.length());
    while (matcher.find()) {
      String value = variables.get(matcher.group(1));
      String replacement = value == null ? matcher.group() : value;
      matcher.appendReplacement(out, Matcher.quoteReplacement(replacement));
    }
    matcher.appendTail(out);
    return out.toString();
  }
}
