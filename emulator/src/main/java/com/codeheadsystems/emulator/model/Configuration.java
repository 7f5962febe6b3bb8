package com.codeheadsystems.emulator.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.immutables.value.Value;

/**
 * Emulator settings. Every field has a default.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableConfiguration.class)
@JsonDeserialize(builder = ImmutableConfiguration.Builder.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public interface Configuration {

  /**
   * Region used in table ARNs.
   *
   * @return the string
   */
  @JsonProperty("region")
  @Value.Default
  default String region() {
    return "us-east-1";
  }

  /**
   * Account id used in table ARNs.
   *
   * @return the string
   */
  @JsonProperty("accountId")
  @Value.Default
  default String accountId() {
    return "000000000000";
  }

  /**
   * Read capacity reported for tables created without one.
   *
   * @return the long
   */
  @JsonProperty("defaultReadCapacityUnits")
  @Value.Default
  default long defaultReadCapacityUnits() {
    return 5L;
  }

  /**
   * Write capacity reported for tables created without one.
   *
   * @return the long
   */
  @JsonProperty("defaultWriteCapacityUnits")
  @Value.Default
  default long defaultWriteCapacityUnits() {
    return 5L;
  }

  /**
   * Page size of list tables when no limit is given.
   *
   * @return the int
   */
  @JsonProperty("defaultPageLimit")
  @Value.Default
  default int defaultPageLimit() {
    return 100;
  }

  /**
   * Largest list tables limit accepted.
   *
   * @return the int
   */
  @JsonProperty("maxPageLimit")
  @Value.Default
  default int maxPageLimit() {
    return 100;
  }

  /**
   * Item bytes a query or scan page may examine.
   *
   * @return the int
   */
  @JsonProperty("maxPageSizeBytes")
  @Value.Default
  default int maxPageSizeBytes() {
    return 1024 * 1024;
  }

  /**
   * Largest item accepted.
   *
   * @return the int
   */
  @JsonProperty("maxItemSizeBytes")
  @Value.Default
  default int maxItemSizeBytes() {
    return 400 * 1024;
  }
}
