package com.codeheadsystems.emulator.model;

/**
 * What a query or scan returns.
 */
public enum Select {
  /**
   * Items, projected when a projection is given.
   */
  ALL_ATTRIBUTES,
  /**
   * Only the counts.
   */
  COUNT
}
