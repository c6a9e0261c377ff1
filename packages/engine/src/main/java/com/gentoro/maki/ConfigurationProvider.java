package com.gentoro.maki;

import com.gentoro.maki.exception.ConfigException;
import com.gentoro.maki.logging.LoggingService;
import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.YAMLConfiguration;
import org.apache.commons.configuration2.builder.FileBasedConfigurationBuilder;
import org.apache.commons.configuration2.builder.fluent.Parameters;
import org.apache.commons.configuration2.ex.ConfigurationException;
import org.apache.commons.configuration2.interpol.Lookup;
import org.slf4j.Logger;

/**
 * Loads the engine YAML configuration into an Apache Commons {@link Configuration}.
 *
 * <p>Supported locations: {@code classpath:path/app.yaml}, a {@code file:} URI, or a plain file
 * system path. A blank location means {@code classpath:application.yaml}. Values may reference
 * {@code ${env:NAME}}; unset variables are resolved from a {@code .env.local} file when present.
 */
public final class ConfigurationProvider {
  private static final Logger log = LoggingService.getLogger(ConfigurationProvider.class);

  public static final String DEFAULT_LOCATION = "classpath:application.yaml";
  private static final String CLASSPATH_PREFIX = "classpath:";
  private static final List<String> ENV_FILE_CANDIDATES =
      List.of(".env.local", "packages/engine/.env.local");

  private final Configuration configuration;

  public ConfigurationProvider(String location) {
    this.configuration = withEnvLookup(load(location));
  }

  public Configuration config() {
    return configuration;
  }

  private static Configuration load(String location) {
    String loc = location == null || location.isBlank() ? DEFAULT_LOCATION : location.trim();
    if (loc.startsWith(CLASSPATH_PREFIX)) {
      return fromClasspath(loc.substring(CLASSPATH_PREFIX.length()));
    }
    if (loc.regionMatches(true, 0, "file:", 0, 5)) {
      try {
        return fromFile(new File(URI.create(loc)));
      } catch (IllegalArgumentException e) {
        throw new ConfigException("Malformed configuration URI: " + loc, e);
      }
    }
    return fromFile(new File(loc));
  }

  private static Configuration fromClasspath(String resource) {
    ClassLoader cl = Thread.currentThread().getContextClassLoader();
    try (InputStream in = cl.getResourceAsStream(resource)) {
      if (in == null) {
        throw new ConfigException("Configuration resource not found on classpath: " + resource);
      }
      log.info("Loading configuration from classpath resource: {}", resource);
      YAMLConfiguration yaml = new YAMLConfiguration();
      yaml.read(new InputStreamReader(in, StandardCharsets.UTF_8));
      return yaml;
    } catch (IOException | ConfigurationException e) {
      throw new ConfigException("Failed to read YAML from classpath resource: " + resource, e);
    }
  }

  private static Configuration fromFile(File file) {
    if (!file.isFile()) {
      throw new ConfigException("Configuration file not found: " + file.getAbsolutePath());
    }
    log.info("Loading configuration from file: {}", file.getAbsolutePath());
    try {
      FileBasedConfigurationBuilder<YAMLConfiguration> builder =
          new FileBasedConfigurationBuilder<>(YAMLConfiguration.class)
              .configure(new Parameters().fileBased().setFile(file));
      return builder.getConfiguration();
    } catch (ConfigurationException e) {
      throw new ConfigException("Failed to load YAML file: " + file, e);
    }
  }

  private static Configuration withEnvLookup(Configuration config) {
    config.getInterpolator().registerLookup("env", new EnvFileLookup());
    return config;
  }

  /** Environment lookup that consults {@code .env.local} for variables the process lacks. */
  static final class EnvFileLookup implements Lookup {
    private volatile Map<String, String> fileValues;

    @Override
    public Object lookup(String key) {
      String val = System.getenv(key);
      if (val != null && !val.isEmpty()) {
        return val;
      }
      return fileValues().get(key);
    }

    private Map<String, String> fileValues() {
      Map<String, String> values = fileValues;
      if (values == null) {
        synchronized (this) {
          if (fileValues == null) {
            fileValues = readEnvFile();
          }
          values = fileValues;
        }
      }
      return values;
    }

    private static Map<String, String> readEnvFile() {
      for (String candidate : ENV_FILE_CANDIDATES) {
        Path path = Paths.get(candidate);
        if (Files.isRegularFile(path)) {
          log.info("Reading environment fallback file: {}", path.toAbsolutePath());
          return parse(path);
        }
      }
      log.debug("No .env.local found; environment lookups use process variables only");
      return Map.of();
    }

    static Map<String, String> parse(Path path) {
      Map<String, String> out = new HashMap<>();
      try (BufferedReader br = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
        String line;
        while ((line = br.readLine()) != null) {
          line = line.trim();
          if (line.isEmpty() || line.startsWith("#")) continue;
          int idx = line.indexOf('=');
          if (idx <= 0) continue;
          String value = line.substring(idx + 1).trim();
          if (value.length() >= 2
              && ((value.startsWith("\"") && value.endsWith("\""))
                  || (value.startsWith("'") && value.endsWith("'")))) {
            value = value.substring(1, value.length() - 1);
          }
          out.put(line.substring(0, idx).trim(), value);
        }
      } catch (IOException e) {
        log.warn("Failed to read environment fallback file {}", path, e);
      }
      return out;
    }
  }
}
