package dev.ragjudge;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Entry point for the RAG judge.
 *
 * <p>Runs without a web server; the evaluation pipeline is exposed as beans, chiefly {@link
 * dev.ragjudge.runner.EvaluationRunner}.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class RagJudgeApplication {
  public static void main(String[] args) {
    SpringApplication.run(RagJudgeApplication.class, args);
  }
}
