package dev.ragjudge.judge;

import java.util.List;

/**
 * Atomic claims extracted from a response, in the order the judge returned them.
 *
 * @param claims extracted claim strings
 * @param tokensUsed tokens consumed by the extraction call
 */
public record ClaimsResult(List<String> claims, int tokensUsed) {

  public ClaimsResult {
    claims = claims == null ? List.of() : List.copyOf(claims);
    if (tokensUsed < 0) {
      throw new IllegalArgumentException("tokensUsed must not be negative");
    }
  }

  public static ClaimsResult empty() {
    return new ClaimsResult(List.of(), 0);
  }
}
