package com.codeheadsystems.emulator.model;

/**
 * Lifecycle status of a table.
 */
public enum TableStatus {
  CREATING, ACTIVE, DELETING
}
