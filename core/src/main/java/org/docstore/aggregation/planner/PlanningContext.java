/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.docstore.aggregation.planner;

import java.util.concurrent.atomic.AtomicBoolean;
import lombok.Getter;
import org.docstore.aggregation.common.setting.MapSettings;
import org.docstore.aggregation.common.setting.Settings;
import org.docstore.aggregation.exception.OperationCancelledException;

/**
 * Per-operation state visible to planning: the node settings and the kill flag of the enclosing
 * command. Killing the operation makes any later {@link #checkForInterrupt()} fail.
 */
public class PlanningContext {

  @Getter private final String operationId;

  @Getter private final Settings settings;

  private final AtomicBoolean killed = new AtomicBoolean(false);

  public PlanningContext(String operationId, Settings settings) {
    this.operationId = operationId;
    this.settings = settings;
  }

  /** Context with default settings, for callers that do not carry node configuration. */
  public static PlanningContext emptyPlanningContext() {
    return new PlanningContext("", new MapSettings());
  }

  public void kill() {
    killed.set(true);
  }

  public boolean isKilled() {
    return killed.get();
  }

  /**
   * Throws if the operation was killed.
   *
   * @throws OperationCancelledException if {@link #kill()} was called
   */
  public void checkForInterrupt() {
    if (killed.get()) {
      throw new OperationCancelledException("Operation " + operationId + " was killed");
    }
  }
}
