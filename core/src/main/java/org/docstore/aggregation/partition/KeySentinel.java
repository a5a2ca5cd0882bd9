/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.docstore.aggregation.partition;

/** Boundary values that sort below or above every other key value. */
public enum KeySentinel {
  MIN_KEY,
  MAX_KEY;

  @Override
  public String toString() {
    return this == MIN_KEY ? "MinKey" : "MaxKey";
  }
}
