/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.docstore.aggregation.pipeline.stage;

/** A single stage of an aggregation pipeline. */
public interface Stage {

  StageKind getKind();
}
