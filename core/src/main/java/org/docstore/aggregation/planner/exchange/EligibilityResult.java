/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.docstore.aggregation.planner.exchange;

import com.google.common.base.Preconditions;
import java.util.List;
import lombok.Getter;
import lombok.ToString;
import org.docstore.aggregation.partition.PartitionMap;
import org.docstore.aggregation.pipeline.stage.Stage;
import org.docstore.aggregation.pipeline.stage.WriteStage;

/** Outcome of the structural and catalog checks that precede rename tracing. */
@Getter
@ToString
public class EligibilityResult {

  public enum Status {
    NOT_ELIGIBLE,
    ELIGIBLE_FOR_TRACING
  }

  private final Status status;

  /** Why the pipeline is not eligible; null when eligible. */
  private final String reason;

  private final WriteStage writeStage;

  /** Merge stages preceding the write. */
  private final List<Stage> stagesBeforeWrite;

  /** Destination routing table snapshot taken during the check. */
  private final PartitionMap destinationPartitionMap;

  private EligibilityResult(
      Status status,
      String reason,
      WriteStage writeStage,
      List<Stage> stagesBeforeWrite,
      PartitionMap destinationPartitionMap) {
    this.status = status;
    this.reason = reason;
    this.writeStage = writeStage;
    this.stagesBeforeWrite = stagesBeforeWrite;
    this.destinationPartitionMap = destinationPartitionMap;
  }

  public static EligibilityResult notEligible(String reason) {
    return new EligibilityResult(Status.NOT_ELIGIBLE, reason, null, List.of(), null);
  }

  /**
   * Result that hands the pipeline over to rename tracing.
   *
   * @param writeStage final write stage
   * @param stagesBeforeWrite stages preceding the write
   * @param destinationPartitionMap routing table of the destination
   * @return eligible result
   */
  public static EligibilityResult eligibleForTracing(
      WriteStage writeStage, List<Stage> stagesBeforeWrite, PartitionMap destinationPartitionMap) {
    Preconditions.checkNotNull(writeStage, "writeStage");
    Preconditions.checkNotNull(destinationPartitionMap, "destinationPartitionMap");
    return new EligibilityResult(
        Status.ELIGIBLE_FOR_TRACING,
        null,
        writeStage,
        List.copyOf(stagesBeforeWrite),
        destinationPartitionMap);
  }

  public boolean isEligible() {
    return status == Status.ELIGIBLE_FOR_TRACING;
  }
}
