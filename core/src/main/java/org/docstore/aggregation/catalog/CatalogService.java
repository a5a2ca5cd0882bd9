/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.docstore.aggregation.catalog;

import org.docstore.aggregation.catalog.model.CollectionRoutingInfo;
import org.docstore.aggregation.pipeline.Namespace;
import org.docstore.aggregation.planner.PlanningContext;

/** Resolves namespaces to their partitioning metadata. */
public interface CatalogService {

  /**
   * Looks up the routing information of a collection. The call may block on a remote metadata
   * service; the answer is a point-in-time snapshot.
   *
   * @param context planning context of the calling operation
   * @param namespace collection to resolve
   * @return routing information, never null
   */
  CollectionRoutingInfo getCollectionRoutingInfo(PlanningContext context, Namespace namespace);
}
