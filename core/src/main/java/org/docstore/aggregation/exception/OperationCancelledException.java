/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.docstore.aggregation.exception;

/** Thrown when the operation that owns a planning call was killed. */
public class OperationCancelledException extends AggregationEngineException {

  public OperationCancelledException(String message) {
    super(message);
  }
}
