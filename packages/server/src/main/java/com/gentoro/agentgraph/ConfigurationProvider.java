package com.gentoro.agentgraph;

import com.gentoro.agentgraph.exception.ConfigException;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.YAMLConfiguration;
import org.apache.commons.configuration2.ex.ConfigurationException;
import org.apache.commons.configuration2.interpol.Lookup;

/**
 * Application configuration read from YAML into an Apache Commons {@link Configuration}.
 *
 * <p>The location is either {@code classpath:<resource>} or a filesystem path ({@code file:} URIs
 * accepted). {@code ${env:NAME}} placeholders resolve against the process environment, then
 * against {@code KEY=value} lines of a {@code .env.local} file in the working directory. A
 * placeholder neither source knows stays literal.
 */
public final class ConfigurationProvider {
  private static final org.slf4j.Logger log =
      com.gentoro.agentgraph.logging.LoggingService.getLogger(ConfigurationProvider.class);

  static final String CLASSPATH_PREFIX = "classpath:";
  static final Path ENV_FILE = Path.of(".env.local");

  private final Configuration configuration;

  public ConfigurationProvider(String location) {
    String where =
        location == null || location.isBlank() ? CLASSPATH_PREFIX + "application.yaml" : location;
    YAMLConfiguration yaml =
        where.startsWith(CLASSPATH_PREFIX)
            ? fromClasspath(where.substring(CLASSPATH_PREFIX.length()))
            : fromFile(toPath(where.trim()));
    yaml.getInterpolator().registerLookup("env", new EnvLookup(ENV_FILE));
    this.configuration = yaml;
  }

  public Configuration config() {
    return configuration;
  }

  private static YAMLConfiguration fromClasspath(String resource) {
    String name = resource.startsWith("/") ? resource.substring(1) : resource;
    InputStream in = Thread.currentThread().getContextClassLoader().getResourceAsStream(name);
    if (in == null) {
      // Empty config lets every component fall back to its defaults.
      log.warn("Configuration resource {} not found on classpath, using defaults", name);
      return new YAMLConfiguration();
    }
    log.info("Loading configuration from classpath resource {}", name);
    try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
      return read(reader, name);
    } catch (IOException e) {
      throw new ConfigException("Could not read classpath resource " + name, e);
    }
  }

  private static YAMLConfiguration fromFile(Path file) {
    if (!Files.isRegularFile(file)) {
      throw new ConfigException("Configuration file does not exist: " + file.toAbsolutePath());
    }
    log.info("Loading configuration from file {}", file.toAbsolutePath());
    try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
      return read(reader, file.toString());
    } catch (IOException e) {
      throw new ConfigException("Could not read configuration file " + file, e);
    }
  }

  private static YAMLConfiguration read(Reader reader, String source) {
    YAMLConfiguration yaml = new YAMLConfiguration();
    try {
      yaml.read(reader);
    } catch (ConfigurationException e) {
      throw new ConfigException("Invalid YAML in " + source, e);
    }
    return yaml;
  }

  private static Path toPath(String location) {
    if (location.regionMatches(true, 0, "file:", 0, 5)) {
      try {
        return Path.of(URI.create(location));
      } catch (IllegalArgumentException e) {
        throw new ConfigException("Invalid configuration URI: " + location, e);
      }
    }
    return Path.of(location);
  }

  /** Environment first, then the env file, read once on first miss. */
  static final class EnvLookup implements Lookup {
    private final Path envFile;
    private Map<String, String> fileValues;

    EnvLookup(Path envFile) {
      this.envFile = envFile;
    }

    @Override
    public Object lookup(String key) {
      String fromEnv = System.getenv(key);
      if (fromEnv != null && !fromEnv.isEmpty()) {
        return fromEnv;
      }
      return fileValues().get(key);
    }

    private synchronized Map<String, String> fileValues() {
      if (fileValues == null) {
        fileValues = Files.isRegularFile(envFile) ? parse(envFile) : Map.of();
      }
      return fileValues;
    }

    static Map<String, String> parse(Path file) {
      List<String> lines;
      try {
        lines = Files.readAllLines(file, StandardCharsets.UTF_8);
      } catch (IOException e) {
        log.warn("Ignoring unreadable env file {}: {}", file.toAbsolutePath(), e.getMessage());
        return Map.of();
      }
      Map<String, String> values = new LinkedHashMap<>();
      for (String raw : lines) {
        String line = raw.trim();
        if (line.startsWith("export ")) line = line.substring("export ".length()).trim();
        int eq = line.indexOf('=');
        if (line.isEmpty() || line.startsWith("#") || eq <= 0) continue;
        values.put(line.substring(0, eq).trim(), unquote(line.substring(eq + 1).trim()));
      }
      log.info("Read {} entries from {}", values.size(), file.toAbsolutePath());
      return values;
    }

    private static String unquote(String value) {
      if (value.length() >= 2) {
        char first = value.charAt(0);
        if ((first == '"' || first == '\'') && value.charAt(value.length() - 1) == first) {
          return value.substring(1, value.length() - 1);
        }
      }
      return value;
    }
  }
}
