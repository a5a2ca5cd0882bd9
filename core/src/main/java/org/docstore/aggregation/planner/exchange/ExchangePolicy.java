/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.docstore.aggregation.planner.exchange;

/** How an exchange distributes documents among its consumers. */
public enum ExchangePolicy {
  /** Every document goes to every consumer. */
  BROADCAST,

  /** Documents are dealt to consumers in turn. */
  ROUND_ROBIN,

  /** Each document goes to the consumer owning the key range its key falls into. */
  RANGE
}
