package dev.ragjudge.testcase;

import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * A single RAG interaction to be scored: the user query, the retrieved context documents in rank
 * order, and the generated response.
 *
 * <p>{@code query} and {@code response} are trimmed and must be non-empty afterwards. {@code
 * expectedFacts} is optional ground truth used by context recall; {@code null} means "not
 * provided", which is different from an empty list.
 *
 * @param id unique identifier
 * @param name human-readable display name
 * @param query the user question
 * @param context retrieved documents, highest-ranked first
 * @param response the generated answer under evaluation
 * @param expectedAnswer optional ground-truth answer
 * @param expectedFacts optional facts the context is expected to cover
 * @param tags free-form labels for filtering and grouping
 */
public record TestCase(
    String id,
    String name,
    String query,
    List<String> context,
    String response,
    @Nullable String expectedAnswer,
    @Nullable List<String> expectedFacts,
    List<String> tags) {

  public TestCase {
    if (id == null || id.isBlank()) {
      throw new IllegalArgumentException("Test case id must not be blank");
    }
    if (name == null) {
      throw new IllegalArgumentException("Test case name must not be null");
    }
    query = query == null ? "" : query.strip();
    if (query.isEmpty()) {
      throw new IllegalArgumentException("Query must not be blank");
    }
    response = response == null ? "" : response.strip();
    if (response.isEmpty()) {
      throw new IllegalArgumentException("Response must not be blank");
    }
    context = context == null ? List.of() : List.copyOf(context);
    expectedFacts = expectedFacts == null ? null : List.copyOf(expectedFacts);
    tags = tags == null ? List.of() : List.copyOf(tags);
  }

  /** Convenience constructor without ground truth or tags. */
  public TestCase(String id, String name, String query, List<String> context, String response) {
    this(id, name, query, context, response, null, null, List.of());
  }

  /** Returns a copy of this test case carrying the given expected facts. */
  public TestCase withExpectedFacts(@Nullable List<String> facts) {
    return new TestCase(id, name, query, context, response, expectedAnswer, facts, tags);
  }
}
