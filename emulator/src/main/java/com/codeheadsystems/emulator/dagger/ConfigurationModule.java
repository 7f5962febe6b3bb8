package com.codeheadsystems.emulator.dagger;

import com.codeheadsystems.emulator.model.Configuration;
import dagger.Module;
import dagger.Provides;
import javax.inject.Singleton;

/**
 * The type Configuration module.
 */
@Module
public class ConfigurationModule {

  private final Configuration configuration;

  /**
   * Instantiates a new Configuration module.
   *
   * @param configuration the configuration
   */
  public ConfigurationModule(final Configuration configuration) {
    this.configuration = configuration;
  }

  /**
   * Configuration configuration.
   *
   * @return the configuration
   */
  @Provides
  @Singleton
  public Configuration configuration() {
    return configuration;
  }
}
