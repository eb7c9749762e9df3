package com.marketsync.scheduler.stage;

import com.marketsync.scheduler.StageContext;
import com.marketsync.scheduler.StageType;

/**
 * One step of a job run. Stages must be idempotent: a failed run repeats them on the next tick.
 */
public interface PipelineStage {

    StageType type();

    void execute(StageContext context);
}
