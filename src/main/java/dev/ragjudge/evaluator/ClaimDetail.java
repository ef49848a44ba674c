package dev.ragjudge.evaluator;

import dev.ragjudge.judge.Verdict;
import java.util.Map;

/** A claim with the verdict and evidence the judge gave for it. */
public record ClaimDetail(String claim, Verdict verdict, String evidence) {

  public boolean isSupported() {
    return verdict == Verdict.SUPPORTED;
  }

  Map<String, Object> toRaw() {
    return Map.of("claim", claim, "verdict", verdict.name(), "evidence", evidence);
  }
}
