package com.codeheadsystems.emulator.util;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.emulator.model.Configuration;
import java.io.ByteArrayInputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ConfigurationLoaderTest {

  private ConfigurationLoader loader;

  @BeforeEach
  void setup() {
    loader = new ConfigurationLoader();
  }

  @Test
  void defaults() {
    final Configuration configuration = loader.defaults();

    assertThat(configuration.region()).isEqualTo("us-east-1");
    assertThat(configuration.maxPageSizeBytes()).isEqualTo(1024 * 1024);
    assertThat(configuration.maxItemSizeBytes()).isEqualTo(400 * 1024);
    assertThat(configuration.defaultPageLimit()).isEqualTo(100);
  }

  @Test
  void loadResource_overridesSomeFields() {
    final Configuration configuration = loader.loadResource("emulator-test.json");

    assertThat(configuration.region()).isEqualTo("eu-west-1");
    assertThat(configuration.accountId()).isEqualTo("123456789012");
    assertThat(configuration.maxPageSizeBytes()).isEqualTo(2048);
    assertThat(configuration.maxItemSizeBytes()).isEqualTo(400 * 1024);
  }

  @Test
  void loadResource_missing_usesDefaults() {
    assertThat(loader.loadResource("does-not-exist.json")).isEqualTo(loader.defaults());
  }

  @Test
  void load_invalidJson() {
    assertThatThrownBy(() -> loader.load(new ByteArrayInputStream("{not json".getBytes(StandardCharsets.UTF_8))))
        .isInstanceOf(UncheckedIOException.class);
  }
}
