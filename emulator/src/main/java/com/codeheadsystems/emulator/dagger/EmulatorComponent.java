package com.codeheadsystems.emulator.dagger;

import com.codeheadsystems.emulator.EmulatorDynamoDbClient;
import com.codeheadsystems.emulator.expression.ConditionEvaluator;
import com.codeheadsystems.emulator.expression.ConditionExpressionParser;
import com.codeheadsystems.emulator.expression.ProjectionExpressionParser;
import com.codeheadsystems.emulator.expression.UpdateExpressionParser;
import com.codeheadsystems.emulator.manager.ItemManager;
import com.codeheadsystems.emulator.manager.QueryManager;
import com.codeheadsystems.emulator.manager.TableManager;
import com.codeheadsystems.emulator.model.Configuration;
import com.codeheadsystems.emulator.util.ConfigurationLoader;
import dagger.Component;
import javax.inject.Singleton;

/**
 * The interface Emulator component. Each instance is an independent emulator with its own tables.
 */
@Singleton
@Component(modules = {ConfigurationModule.class, CommonModule.class})
public interface EmulatorComponent {

  /**
   * Instance emulator component.
   *
   * @param configuration the configuration
   * @return the emulator component
   */
  static EmulatorComponent instance(final Configuration configuration) {
    return DaggerEmulatorComponent.builder().configurationModule(new ConfigurationModule(configuration)).build();
  }

  /**
   * Instance configured from the {@value ConfigurationLoader#DEFAULT_RESOURCE} class path resource,
   * or the defaults when there is none.
   *
   * @return the emulator component
   */
  static EmulatorComponent instance() {
    return instance(new ConfigurationLoader().loadResource(ConfigurationLoader.DEFAULT_RESOURCE));
  }

  /**
   * Emulator dynamo db client.
   *
   * @return the emulator dynamo db client
   */
  EmulatorDynamoDbClient dynamoDbClient();

  /**
   * Table manager.
   *
   * @return the table manager
   */
  TableManager tableManager();

  /**
   * Item manager.
   *
   * @return the item manager
   */
  ItemManager itemManager();

  /**
   * Query manager.
   *
   * @return the query manager
   */
  QueryManager queryManager();

  ConditionExpressionParser conditionExpressionParser();

  UpdateExpressionParser updateExpressionParser();

  ProjectionExpressionParser projectionExpressionParser();

  ConditionEvaluator conditionEvaluator();

  /**
   * Configuration the graph was built with.
   *
   * @return the configuration
   */
  Configuration configuration();

  /**
   * Configuration loader.
   *
   * @return the configuration loader
   */
  ConfigurationLoader configurationLoader();
}
