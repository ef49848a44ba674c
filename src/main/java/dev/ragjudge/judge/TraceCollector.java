package dev.ragjudge.judge;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Append-only sink of {@link JudgeTrace} records with aggregate statistics for cost and latency
 * accounting.
 *
 * <p>Many judge calls append concurrently, so every read and write is guarded by the collector's
 * monitor. Aggregates are computed on demand from a consistent view of the list.
 */
public class TraceCollector {

  /** Approximate input price in USD per million tokens. */
  static final double INPUT_COST_PER_MILLION = 3.0;

  /** Approximate output price in USD per million tokens. */
  static final double OUTPUT_COST_PER_MILLION = 15.0;

  private final List<JudgeTrace> traces = new ArrayList<>();

  public synchronized void add(JudgeTrace trace) {
    traces.add(trace);
  }

  /** Snapshot of all traces in insertion order. */
  public synchronized List<JudgeTrace> traces() {
    return List.copyOf(traces);
  }

  public synchronized int size() {
    return traces.size();
  }

  public synchronized int totalTokens() {
    return traces.stream().mapToInt(JudgeTrace::totalTokens).sum();
  }

  public synchronized int totalInputTokens() {
    return traces.stream().mapToInt(JudgeTrace::inputTokens).sum();
  }

  public synchronized int totalOutputTokens() {
    return traces.stream().mapToInt(JudgeTrace::outputTokens).sum();
  }

  public synchronized long totalLatencyMs() {
    return traces.stream().mapToLong(JudgeTrace::latencyMs).sum();
  }

  public synchronized long successCount() {
    return traces.stream().filter(JudgeTrace::success).count();
  }

  public synchronized long failureCount() {
    return traces.stream().filter(t -> !t.success()).count();
  }

  /**
   * Rough USD cost based on Sonnet-class list prices. Actual cost depends on the model and the
   * provider's current pricing.
   */
  public synchronized double totalCostEstimate() {
    double input = totalInputTokens() / 1_000_000.0 * INPUT_COST_PER_MILLION;
    double output = totalOutputTokens() / 1_000_000.0 * OUTPUT_COST_PER_MILLION;
    return input + output;
  }

  public synchronized List<JudgeTrace> byOperation(String operation) {
    return traces.stream().filter(t -> t.operation().equals(operation)).toList();
  }

  public synchronized List<JudgeTrace> failures() {
    return traces.stream().filter(t -> !t.success()).toList();
  }

  public synchronized void clear() {
    traces.clear();
  }

  @Override
  public synchronized String toString() {
    return String.format(
        Locale.US,
        "TraceCollector(calls=%d, tokens=%d, latency=%dms, costEstimate=$%.4f)",
        traces.size(),
        totalTokens(),
        totalLatencyMs(),
        totalCostEstimate());
  }
}
