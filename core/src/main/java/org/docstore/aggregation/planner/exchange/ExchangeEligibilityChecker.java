/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.docstore.aggregation.planner.exchange;

import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.docstore.aggregation.catalog.CatalogService;
import org.docstore.aggregation.catalog.model.CollectionRoutingInfo;
import org.docstore.aggregation.common.setting.Settings;
import org.docstore.aggregation.exception.NamespaceNotFoundException;
import org.docstore.aggregation.pipeline.Pipeline;
import org.docstore.aggregation.pipeline.stage.Stage;
import org.docstore.aggregation.pipeline.stage.StageKind;
import org.docstore.aggregation.pipeline.stage.WriteMode;
import org.docstore.aggregation.pipeline.stage.WriteStage;
import org.docstore.aggregation.planner.PlanningContext;

/**
 * Decides whether a merge pipeline is worth tracing for an exchange. The checks run in order and
 * the first failing one ends the evaluation:
 *
 * <ol>
 *   <li>the exchange optimization is enabled
 *   <li>the pipeline ends with a write stage
 *   <li>the write inserts into the existing collection
 *   <li>the destination database exists (otherwise {@link NamespaceNotFoundException})
 *   <li>the destination collection exists and is partitioned
 *   <li>no limit or skip forces the merge onto a single node
 * </ol>
 */
@Log4j2
@RequiredArgsConstructor
public class ExchangeEligibilityChecker {

  private final CatalogService catalogService;

  /**
   * Evaluates the pipeline. Consults the catalog at most once.
   *
   * @param context planning context
   * @param pipeline merge pipeline
   * @return eligibility result
   * @throws NamespaceNotFoundException if the destination database does not exist
   */
  public EligibilityResult evaluate(PlanningContext context, Pipeline pipeline) {
    if (!isExchangeEnabled(context)) {
      return notEligible("exchange is disabled by " + Settings.Key.EXCHANGE_ENABLED.getKeyValue());
    }

    Optional<Stage> last = pipeline.getLastStage();
    if (last.isEmpty() || last.get().getKind() != StageKind.WRITE) {
      return notEligible("pipeline does not end with a write stage");
    }
    WriteStage write = (WriteStage) last.get();
    if (write.mode() != WriteMode.INSERT_DOCUMENTS) {
      return notEligible("write mode " + write.mode() + " recreates the destination unpartitioned");
    }

    context.checkForInterrupt();
    CollectionRoutingInfo routingInfo =
        catalogService.getCollectionRoutingInfo(context, write.target());
    context.checkForInterrupt();

    switch (routingInfo.getStatus()) {
      case DATABASE_NOT_FOUND:
        throw new NamespaceNotFoundException(write.target());
      case COLLECTION_NOT_FOUND:
        return notEligible("destination " + write.target() + " does not exist yet");
      case UNPARTITIONED:
        return notEligible("destination " + write.target() + " is not partitioned");
      default:
        break;
    }

    List<Stage> stagesBeforeWrite = pipeline.getStagesBeforeLast();
    for (Stage stage : stagesBeforeWrite) {
      if (forcesSingleNodeMerge(stage)) {
        return notEligible(stage + " requires a single merging node");
      }
    }
    return EligibilityResult.eligibleForTracing(
        write, stagesBeforeWrite, routingInfo.getPartitionMapOrThrow());
  }

  // Any limit or skip left in the merge half is treated as global.
  private static boolean forcesSingleNodeMerge(Stage stage) {
    return stage.getKind() == StageKind.LIMIT || stage.getKind() == StageKind.SKIP;
  }

  private static boolean isExchangeEnabled(PlanningContext context) {
    Boolean enabled = context.getSettings().getSettingValue(Settings.Key.EXCHANGE_ENABLED);
    return enabled == null || enabled;
  }

  private static EligibilityResult notEligible(String reason) {
    log.debug("Merge pipeline not eligible for exchange: {}", reason);
    return EligibilityResult.notEligible(reason);
  }
}
