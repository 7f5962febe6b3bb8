package com.codeheadsystems.emulator.model;

/**
 * Role of an attribute in the primary key.
 */
public enum KeyRole {
  HASH, RANGE
}
