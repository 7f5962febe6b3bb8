package com.codeheadsystems.emulator.util;

import com.codeheadsystems.emulator.model.Configuration;
import com.codeheadsystems.emulator.model.ImmutableConfiguration;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads {@link Configuration} from JSON. Missing fields keep their defaults.
 */
@Singleton
public class ConfigurationLoader {

  /**
   * Class path resource read by {@code EmulatorComponent.instance()}.
   */
  public static final String DEFAULT_RESOURCE = "emulator.json";

  private static final Logger log = LoggerFactory.getLogger(ConfigurationLoader.class);

  private final ObjectMapper objectMapper;

  /**
   * Instantiates a new Configuration loader.
   */
  public ConfigurationLoader() {
    this(new ObjectMapper());
  }

  /**
   * Instantiates a new Configuration loader.
   *
   * @param objectMapper the object mapper
   */
  @Inject
  public ConfigurationLoader(final ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  /**
   * The configuration with every default.
   *
   * @return the configuration
   */
  public Configuration defaults() {
    return ImmutableConfiguration.builder().build();
  }

  /**
   * Reads configuration from a stream.
   *
   * @param inputStream the input stream
   * @return the configuration
   */
  public Configuration load(final InputStream inputStream) {
    try {
      final Configuration configuration = objectMapper.readValue(inputStream, Configuration.class);
      log.info("Loaded configuration: {}", configuration);
      return configuration;
    } catch (IOException e) {
      throw new UncheckedIOException("Unable to read configuration", e);
    }
  }

  /**
   * Reads configuration from a class path resource, falling back to the defaults when the resource
   * does not exist.
   *
   * @param resource the resource name
   * @return the configuration
   */
  public Configuration loadResource(final String resource) {
    log.trace("loadResource({})", resource);
    try (InputStream inputStream = ConfigurationLoader.class.getClassLoader().getResourceAsStream(resource)) {
      if (inputStream == null) {
        log.info("No configuration resource {}, using defaults", resource);
        return defaults();
      }
      return load(inputStream);
    } catch (IOException e) {
      throw new UncheckedIOException("Unable to read configuration " + resource, e);
    }
  }
}
