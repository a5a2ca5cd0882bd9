/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.docstore.aggregation.exception;

/** Base exception for failures raised while planning an aggregation. */
public class AggregationEngineException extends RuntimeException {

  public AggregationEngineException(String message) {
    super(message);
  }

  public AggregationEngineException(String message, Throwable cause) {
    super(message, cause);
  }
}
