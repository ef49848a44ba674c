package dev.ragjudge.judge.prompt;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import org.junit.jupiter.api.Test;

class ClasspathPromptProviderTest {

  private final ClasspathPromptProvider provider = new ClasspathPromptProvider(new ObjectMapper());

  @Test
  void listPromptsFindsEveryJudgeOperation() {
    assertThat(provider.listPrompts())
        .containsExactly(
            "extract_claims",
            "faithfulness",
            "generate_answer",
            "generate_questions",
            "relevance",
            "verify_claim");
  }

  @Test
  void everyBundledTemplateDeclaresItsOwnNameAndAsksForJson() {
    for (String name : provider.listPrompts()) {
      PromptTemplate template = provider.get(name);
      assertThat(template.name()).isEqualTo(name);
      assertThat(template.systemPrompt()).contains("JSON");
    }
  }

  @Test
  void getCachesParsedTemplates() {
    assertThat(provider.get("relevance")).isSameAs(provider.get("relevance"));
  }

  @Test
  void getRejectsUnknownTemplate() {
    assertThatThrownBy(() -> provider.get("coherence"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("Prompt template not found: coherence");
  }

  @Test
  void formatContextNumbersDocumentsFromOne() {
    assertThat(provider.formatContext(List.of("alpha", "beta")))
        .isEqualTo("Document 1:\nalpha\n\n---\n\nDocument 2:\nbeta");
    assertThat(provider.formatContext(List.of())).isEmpty();
  }
}
