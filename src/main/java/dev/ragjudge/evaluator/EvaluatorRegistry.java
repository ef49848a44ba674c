package dev.ragjudge.evaluator;

import dev.ragjudge.concurrent.FanOut;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Name-to-factory map of available evaluators.
 *
 * <p>{@link #withBuiltIns(Executor)} registers faithfulness, hallucination, relevance, context
 * precision and context recall. Callers may add their own evaluators under unused names.
 */
public class EvaluatorRegistry {

  private static final Logger log = LoggerFactory.getLogger(EvaluatorRegistry.class);

  private final Map<String, EvaluatorFactory> factories = new ConcurrentHashMap<>();

  /** Empty registry. */
  public EvaluatorRegistry() {}

  public static EvaluatorRegistry withBuiltIns() {
    return withBuiltIns(FanOut.sharedExecutor());
  }

  /** Registry holding every built-in evaluator, each fanning out on {@code executor}. */
  public static EvaluatorRegistry withBuiltIns(Executor executor) {
    EvaluatorRegistry registry = new EvaluatorRegistry();
    registry.register(
        FaithfulnessEvaluator.NAME,
        threshold ->
            new FaithfulnessEvaluator(
                threshold == null ? AbstractEvaluator.DEFAULT_THRESHOLD : threshold, executor));
    registry.register(
        HallucinationEvaluator.NAME,
        threshold ->
            new HallucinationEvaluator(
                threshold == null
                    ? HallucinationEvaluator.DEFAULT_HALLUCINATION_THRESHOLD
                    : threshold,
                executor));
    registry.register(
        RelevanceEvaluator.NAME,
        threshold ->
            new RelevanceEvaluator(
                threshold == null ? AbstractEvaluator.DEFAULT_THRESHOLD : threshold, executor));
    registry.register(
        ContextPrecisionEvaluator.NAME,
        threshold ->
            new ContextPrecisionEvaluator(
                threshold == null ? AbstractEvaluator.DEFAULT_THRESHOLD : threshold, executor));
    registry.register(
        ContextRecallEvaluator.NAME,
        threshold ->
            new ContextRecallEvaluator(
                threshold == null ? AbstractEvaluator.DEFAULT_THRESHOLD : threshold, executor));
    return registry;
  }

  /**
   * Registers an evaluator factory.
   *
   * <p>The factory is invoked once with the default threshold to check that it produces an
   * evaluator reporting the same name.
   *
   * @throws IllegalArgumentException if the name is blank or taken, or the factory does not
   *     produce a matching evaluator
   */
  public void register(String name, EvaluatorFactory factory) {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("Evaluator name cannot be empty");
    }
    if (factory == null) {
      throw new IllegalArgumentException("Evaluator factory for '" + name + "' must not be null");
    }
    Evaluator sample = factory.create(null);
    if (sample == null) {
      throw new IllegalArgumentException("Factory for '" + name + "' did not create an evaluator");
    }
    if (!name.equals(sample.name())) {
      throw new IllegalArgumentException(
          "Factory for '"
              + name
              + "' creates "
              + sample.getClass().getSimpleName()
              + " named '"
              + sample.name()
              + "'");
    }
    if (factories.putIfAbsent(name, factory) != null) {
      throw new IllegalArgumentException("Evaluator '" + name + "' is already registered");
    }
    log.debug("Registered evaluator '{}'", name);
  }

  /**
   * Creates the named evaluator.
   *
   * @param threshold override, or {@code null} for the evaluator's default
   * @throws IllegalArgumentException if no evaluator is registered under that name
   */
  public Evaluator create(String name, @Nullable Double threshold) {
    EvaluatorFactory factory = factories.get(name);
    if (factory == null) {
      throw new IllegalArgumentException(
          "Unknown evaluator: '"
              + name
              + "'. Available evaluators: "
              + String.join(", ", names()));
    }
    return factory.create(threshold);
  }

  public Evaluator create(String name) {
    return create(name, null);
  }

  public boolean contains(String name) {
    return factories.containsKey(name);
  }

  /** Registered names, sorted. */
  public List<String> names() {
    return factories.keySet().stream().sorted().toList();
  }
}
