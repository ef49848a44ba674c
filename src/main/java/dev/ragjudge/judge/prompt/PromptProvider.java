package dev.ragjudge.judge.prompt;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/** Source of the prompt templates used by the judge, keyed by operation name. */
public interface PromptProvider {

  String CONTEXT_SEPARATOR = "\n\n---\n\n";

  /**
   * Returns the template for an operation.
   *
   * @throws IllegalArgumentException if no template exists under that name
   */
  PromptTemplate get(String name);

  /** Numbers each document from 1 and separates them with a horizontal rule. */
  default String formatContext(List<String> documents) {
    return IntStream.range(0, documents.size())
        .mapToObj(i -> "Document " + (i + 1) + ":\n" + documents.get(i))
        .collect(Collectors.joining(CONTEXT_SEPARATOR));
  }
}
