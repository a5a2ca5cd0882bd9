/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.docstore.aggregation.planner.exchange;

import org.docstore.aggregation.partition.PartitionKeyPattern;

/**
 * Where the exchange goes and which fields it partitions on there.
 *
 * @param stageIndex index of the first stage that runs after the exchange; 0 for the front of the
 *     pipeline
 * @param keyPattern destination key fields under their names at this point, in destination key
 *     order, duplicates kept
 */
public record SplitPoint(int stageIndex, PartitionKeyPattern keyPattern) {}
