package ca.gc.cra.flowstart.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads output configuration from a YAML document.
 *
 * <p>Expected layout:
 * <pre>
 * default-log-dir: /var/log/flowstart
 * logging:
 *   verbose: no
 * engine:
 *   mode: ips
 * outputs:
 *   - eve-log:
 *       filename: eve.json
 *       types:
 *         - flow_start
 *   - flow_start-json-log:
 *       enabled: yes
 * </pre>
 * Each output entry is a single-key mapping. Scalar options are flattened into dotted keys; lists are
 * only accepted under {@code types}.
 */
public final class OutputConfigLoader {
  private static final Logger log = LoggerFactory.getLogger(OutputConfigLoader.class);

  private OutputConfigLoader() {}

  /**
   * Loads and types the configuration at {@code path}.
   *
   * @param path YAML file
   * @return typed configuration
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the YAML structure is invalid
   */
  public static OutputsConfig load(Path path) throws IOException {
    Objects.requireNonNull(path, "path");
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      OutputsConfig config = parse(new Yaml().load(reader), path.toString());
      log.info("Loaded {} output section(s) from {}", config.outputs().size(), path);
      return config;
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML config at " + path, ex);
    }
  }

  /**
   * Types an already loaded YAML string.
   *
   * @param yaml YAML document
   * @return typed configuration
   * @throws IllegalArgumentException when the YAML is malformed or structurally invalid
   */
  public static OutputsConfig parse(String yaml) {
    Objects.requireNonNull(yaml, "yaml");
    try {
      return parse(new Yaml().load(yaml), "<inline>");
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML config", ex);
    }
  }

  private static OutputsConfig parse(Object document, String source) {
    if (document == null) {
      return new OutputsConfig(OutputsConfig.DEFAULT_LOG_DIR, EngineMode.IDS, List.of());
    }
    Map<String, Object> root = asMap(document, "root");

    Object logDir = root.get("default-log-dir");
    Path defaultLogDir = logDir == null ? OutputsConfig.DEFAULT_LOG_DIR : Path.of(logDir.toString());

    EngineMode mode = EngineMode.IDS;
    Object engine = root.get("engine");
    if (engine != null) {
      Object rawMode = asMap(engine, "engine").get("mode");
      mode = EngineMode.parse(rawMode == null ? null : rawMode.toString());
    }

    boolean verbose = false;
    Object logging = root.get("logging");
    if (logging != null) {
      Object rawVerbose = asMap(logging, "logging").get("verbose");
      verbose = rawVerbose != null
          && OutputConfig.of("logging", Map.of("verbose", rawVerbose.toString())).getBoolean("verbose", false);
    }

    List<OutputConfig> outputs = new ArrayList<>();
    Object outputsNode = root.get("outputs");
    if (outputsNode != null) {
      if (!(outputsNode instanceof List<?> entries)) {
        throw new IllegalArgumentException("outputs must be a list in " + source);
      }
      for (Object entry : entries) {
        outputs.add(readOutput(entry, "outputs"));
      }
    }
    return new OutputsConfig(defaultLogDir, mode, outputs, verbose);
  }

  private static OutputConfig readOutput(Object entry, String context) {
    if (entry instanceof String bare) {
      return OutputConfig.of(bare.trim(), Map.of());
    }
    Map<String, Object> wrapper = asMap(entry, context);
    if (wrapper.size() != 1) {
      throw new IllegalArgumentException(context + " entries must have exactly one key, found " + wrapper.keySet());
    }
    Map.Entry<String, Object> only = wrapper.entrySet().iterator().next();
    String name = only.getKey().trim();
    if (name.isEmpty()) {
      throw new IllegalArgumentException(context + " entry has a blank name");
    }
    Object body = only.getValue();
    if (body == null) {
      return OutputConfig.of(name, Map.of());
    }
    Map<String, Object> section = asMap(body, name);
    Map<String, String> options = new LinkedHashMap<>();
    List<OutputConfig> types = new ArrayList<>();
    for (Map.Entry<String, Object> option : section.entrySet()) {
      if (option.getKey().equals("types")) {
        if (!(option.getValue() instanceof List<?> typeList)) {
          throw new IllegalArgumentException(name + ".types must be a list");
        }
        for (Object type : typeList) {
          types.add(readOutput(type, name + ".types"));
        }
      } else {
        flatten(option.getKey(), option.getValue(), options);
      }
    }
    return new OutputConfig(name, options, types);
  }

  private static Map<String, Object> asMap(Object node, String context) {
    if (!(node instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException(context + " section must be a mapping");
    }
    Map<String, Object> map = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      if (!(entry.getKey() instanceof String key)) {
        throw new IllegalArgumentException(context + " section contains non-string key");
      }
      map.put(key, entry.getValue());
    }
    return map;
  }

  private static void flatten(String key, Object value, Map<String, String> target) {
    if (key.isBlank()) {
      throw new IllegalArgumentException("YAML contains blank keys");
    }
    if (value == null) {
      target.put(key, "");
    } else if (value instanceof Map<?, ?> nested) {
      for (Map.Entry<String, Object> entry : asMap(nested, key).entrySet()) {
        flatten(key + '.' + entry.getKey(), entry.getValue(), target);
      }
    } else if (value instanceof Iterable<?>) {
      throw new IllegalArgumentException("YAML arrays are not supported for key " + key);
    } else {
      target.put(key, value.toString());
    }
  }
}
