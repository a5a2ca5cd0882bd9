/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.docstore.aggregation.planner.exchange;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.extern.log4j.Log4j2;
import org.docstore.aggregation.catalog.CatalogService;
import org.docstore.aggregation.common.setting.Settings;
import org.docstore.aggregation.exception.NamespaceNotFoundException;
import org.docstore.aggregation.partition.KeyRange;
import org.docstore.aggregation.partition.PartitionMap;
import org.docstore.aggregation.pipeline.Pipeline;
import org.docstore.aggregation.planner.PlanningContext;

/**
 * Entry point of exchange planning. Given the merge half of an aggregation that writes into a
 * partitioned collection, finds out whether the merge can be spread over the destination's shards
 * by routing every document straight to the shard that will store it.
 *
 * <p>Most pipelines are not eligible; that outcome is an empty result, not an error.
 */
@Log4j2
public class ExchangePlanner {

  private final ExchangeEligibilityChecker eligibilityChecker;
  private final ShardKeyTracer shardKeyTracer;
  private final PartitionBuilder partitionBuilder;

  public ExchangePlanner(CatalogService catalogService) {
    this(
        new ExchangeEligibilityChecker(catalogService),
        new ShardKeyTracer(),
        new PartitionBuilder());
  }

  public ExchangePlanner(
      ExchangeEligibilityChecker eligibilityChecker,
      ShardKeyTracer shardKeyTracer,
      PartitionBuilder partitionBuilder) {
    this.eligibilityChecker = eligibilityChecker;
    this.shardKeyTracer = shardKeyTracer;
    this.partitionBuilder = partitionBuilder;
  }

  /**
   * Plans an exchange for the merge pipeline.
   *
   * @param context planning context of the enclosing operation
   * @param mergePipeline stages run after combining the shards' partial results
   * @return the exchange to insert, or empty if none can be proven correct
   * @throws NamespaceNotFoundException if the destination database does not exist
   */
  public Optional<ExchangeSpec> checkIfEligibleForExchange(
      PlanningContext context, Pipeline mergePipeline) {
    EligibilityResult eligibility = eligibilityChecker.evaluate(context, mergePipeline);
    if (!eligibility.isEligible()) {
      return Optional.empty();
    }

    PartitionMap partitionMap = eligibility.getDestinationPartitionMap();
    Optional<SplitPoint> splitPoint =
        shardKeyTracer.trace(eligibility.getStagesBeforeWrite(), partitionMap.getKeyPattern());
    if (splitPoint.isEmpty()) {
      log.debug(
          "Key {} of {} cannot be traced through {}",
          partitionMap.getKeyPattern(),
          eligibility.getWriteStage().target(),
          mergePipeline);
      return Optional.empty();
    }

    Map<String, List<KeyRange>> partitions =
        partitionBuilder.build(splitPoint.get().keyPattern(), partitionMap);
    Integer bufferSize = context.getSettings().getSettingValue(Settings.Key.EXCHANGE_BUFFER_SIZE);
    ExchangeSpec spec =
        new ExchangeSpec(
            ExchangePolicy.RANGE,
            splitPoint.get().keyPattern(),
            partitions,
            splitPoint.get().stageIndex(),
            bufferSize == null
                ? (Integer) Settings.Key.EXCHANGE_BUFFER_SIZE.getDefaultValue()
                : bufferSize);
    log.debug(
        "Planned {} exchange over {} shards for {}",
        spec.getPolicy(),
        spec.getConsumerCount(),
        eligibility.getWriteStage().target());
    return Optional.of(spec);
  }
}
