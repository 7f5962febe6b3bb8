package com.codeheadsystems.emulator.model;

/**
 * The billing mode reported for a table.
 */
public enum BillingMode {
  PROVISIONED, PAY_PER_REQUEST
}
