package com.gentoro.graphrag.prompt.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.graphrag.exception.ExceptionUtil;
import com.gentoro.graphrag.exception.NotFoundException;
import com.gentoro.graphrag.exception.PromptException;
import com.gentoro.graphrag.exception.ValidationException;
import com.gentoro.graphrag.llm.LlmClient;
import com.gentoro.graphrag.prompt.PromptRepository;
import com.gentoro.graphrag.prompt.PromptTemplate;
import com.gentoro.graphrag.utility.JacksonUtility;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Loads sectioned prompt YAML files from the classpath. With base path {@code prompts} the id
 * {@code intent-analysis} resolves to {@code prompts/intent-analysis.yaml}.
 *
 * <pre>
 * sections:
 *   - role: system
 *     id: instructions
 *     enabled: true
 *     content: |
 *       ...
 * </pre>
 */
public class ClasspathPromptRepository implements PromptRepository {
  public static final String DEFAULT_BASE_PATH = "prompts";

  private final String basePath;
  private final ClassLoader classLoader;

  public ClasspathPromptRepository(String basePath) {
    this(basePath, Thread.currentThread().getContextClassLoader());
  }

  public ClasspathPromptRepository(String basePath, ClassLoader classLoader) {
    this.basePath = normalize(Objects.requireNonNull(basePath, "basePath"));
    this.classLoader =
        Objects.requireNonNullElseGet(
            classLoader, () -> ClasspathPromptRepository.class.getClassLoader());
  }

  @Override
  public PromptTemplate get(String name) {
    String id = name.startsWith("/") ? name.substring(1) : name;
    String resource = resolveExisting(id);
    if (resource == null) {
      throw new NotFoundException("Prompt not found on classpath: " + name);
    }
    try (InputStream is = classLoader.getResourceAsStream(resource)) {
      if (is == null) {
        throw new NotFoundException("Prompt resource not found: " + resource);
      }
      String yaml = new String(is.readAllBytes(), StandardCharsets.UTF_8);
      return new PebblePromptTemplate(id, parseSections(id, yaml));
    } catch (Exception e) {
      throw ExceptionUtil.rethrowIfUnchecked(
          e, ex -> new PromptException("Failed to read prompt file: " + name, ex));
    }
  }

  static List<PromptTemplate.PromptSection> parseSections(String id, String yaml)
      throws java.io.IOException {
    JsonNode root = JacksonUtility.getYamlMapper().readTree(yaml);
    JsonNode arr = root == null ? null : root.get("sections");
    if (arr == null || !arr.isArray()) {
      throw new ValidationException("Prompt YAML must contain a 'sections' array: " + id);
    }
    List<PromptTemplate.PromptSection> sections = new ArrayList<>();
    for (JsonNode n : arr) {
      String roleStr = n.path("role").asText(null);
      if (roleStr == null) {
        throw new ValidationException("Missing role for a section in prompt: " + id);
      }
      LlmClient.Role role =
          switch (roleStr.toLowerCase(Locale.ROOT)) {
            case "user" -> LlmClient.Role.USER;
            case "assistant" -> LlmClient.Role.ASSISTANT;
            case "system" -> LlmClient.Role.SYSTEM;
            default -> throw new ValidationException(
                "Unknown role '" + roleStr + "' in prompt: " + id);
          };
      String sectionId = n.path("id").asText(null);
      if (sectionId == null || sectionId.isBlank()) {
        throw new ValidationException("Missing section id in prompt: " + id);
      }
      String content = n.path("content").asText("");
      if (content.isBlank()) {
        throw new ValidationException(
            "Empty content for section '" + sectionId + "' in prompt: " + id);
      }
      sections.add(
          new PromptTemplate.PromptSection(
              role, sectionId, n.path("enabled").asBoolean(false), content));
    }
    return sections;
  }

  private String resolveExisting(String id) {
    String yaml = basePath + "/" + id + ".yaml";
    if (classLoader.getResource(yaml) != null) return yaml;
    String yml = basePath + "/" + id + ".yml";
    if (classLoader.getResource(yml) != null) return yml;
    return null;
  }

  private static String normalize(String p) {
    String out = p.trim();
    if (out.startsWith("/")) out = out.substring(1);
    if (out.endsWith("/")) out = out.substring(0, out.length() - 1);
    return out;
  }
}
