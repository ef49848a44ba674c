package dev.ragjudge.judge.prompt;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;

/**
 * Loads prompt templates from {@code prompts/<name>.json} on the classpath. Templates are parsed
 * once and cached.
 */
public class ClasspathPromptProvider implements PromptProvider {

  private static final Logger log = LoggerFactory.getLogger(ClasspathPromptProvider.class);

  static final String DEFAULT_LOCATION = "prompts";

  private final ObjectMapper objectMapper;
  private final String location;
  private final Map<String, PromptTemplate> cache = new ConcurrentHashMap<>();

  public ClasspathPromptProvider(ObjectMapper objectMapper) {
    this(objectMapper, DEFAULT_LOCATION);
  }

  public ClasspathPromptProvider(ObjectMapper objectMapper, String location) {
    this.objectMapper = objectMapper;
    this.location = location;
  }

  @Override
  public PromptTemplate get(String name) {
    return cache.computeIfAbsent(name, this::load);
  }

  /** Names of all templates available at the configured location, sorted. */
  public List<String> listPrompts() {
    try {
      Resource[] resources =
          new PathMatchingResourcePatternResolver()
              .getResources("classpath*:" + location + "/*.json");
      return Arrays.stream(resources)
          .map(Resource::getFilename)
          .filter(Objects::nonNull)
          .map(filename -> filename.substring(0, filename.length() - ".json".length()))
          .sorted()
          .distinct()
          .toList();
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to list prompt templates under " + location, e);
    }
  }

  private PromptTemplate load(String name) {
    ClassPathResource resource = new ClassPathResource(location + "/" + name + ".json");
    if (!resource.exists()) {
      throw new IllegalArgumentException("Prompt template not found: " + name);
    }
    try (InputStream is = resource.getInputStream()) {
      PromptTemplate template = objectMapper.readValue(is, PromptTemplate.class);
      log.debug("Loaded prompt template '{}' version {}", template.name(), template.version());
      return template;
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read prompt template " + name, e);
    }
  }
}
