package dev.ragjudge.judge;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.Test;

class TraceCollectorTest {

  private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

  private static JudgeTrace success(String operation, int in, int out, long latencyMs) {
    return new JudgeTrace(NOW, operation, "model", in, out, latencyMs, true, null);
  }

  private static JudgeTrace failure(String operation) {
    return new JudgeTrace(NOW, operation, "model", 0, 0, 5, false, "JudgeApiException: boom");
  }

  @Test
  void aggregatesTokensLatencyAndOutcomes() {
    var collector = new TraceCollector();
    collector.add(success("verify_claim", 100, 20, 40));
    collector.add(success("extract_claims", 300, 50, 60));
    collector.add(failure("verify_claim"));

    assertThat(collector.size()).isEqualTo(3);
    assertThat(collector.totalInputTokens()).isEqualTo(400);
    assertThat(collector.totalOutputTokens()).isEqualTo(70);
    assertThat(collector.totalTokens()).isEqualTo(470);
    assertThat(collector.totalLatencyMs()).isEqualTo(105);
    assertThat(collector.successCount()).isEqualTo(2);
    assertThat(collector.failureCount()).isEqualTo(1);
    assertThat(collector.byOperation("verify_claim")).hasSize(2);
    assertThat(collector.failures())
        .extracting(JudgeTrace::operation)
        .containsExactly("verify_claim");
  }

  @Test
  void costEstimateUsesPerMillionTokenRates() {
    var collector = new TraceCollector();
    collector.add(success("evaluate_relevance", 1_000_000, 1_000_000, 1));

    assertThat(collector.totalCostEstimate()).isCloseTo(18.0, within(1e-9));
  }

  @Test
  void clearRemovesAllTraces() {
    var collector = new TraceCollector();
    collector.add(success("verify_claim", 1, 1, 1));

    collector.clear();

    assertThat(collector.size()).isZero();
    assertThat(collector.toString()).startsWith("TraceCollector(calls=0, tokens=0");
  }

  @Test
  void concurrentAddsAreNeverLost() {
    var collector = new TraceCollector();
    ExecutorService pool = Executors.newFixedThreadPool(8);
    try {
      List<CompletableFuture<Void>> writers = new ArrayList<>();
      for (int writer = 0; writer < 8; writer++) {
        writers.add(
            CompletableFuture.runAsync(
                () -> {
                  for (int i = 0; i < 500; i++) {
                    collector.add(success("verify_claim", 1, 1, 1));
                  }
                },
                pool));
      }
      writers.forEach(CompletableFuture::join);
    } finally {
      pool.shutdown();
    }

    assertThat(collector.size()).isEqualTo(4000);
    assertThat(collector.totalTokens()).isEqualTo(8000);
  }
}
