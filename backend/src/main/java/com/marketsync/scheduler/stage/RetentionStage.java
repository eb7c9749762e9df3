package com.marketsync.scheduler.stage;

import com.marketsync.retention.RetentionManager;
import com.marketsync.retention.RetentionPolicyRegistry;
import com.marketsync.retention.SweepResult;
import com.marketsync.scheduler.StageContext;
import com.marketsync.scheduler.StageType;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Sweeps each of the job's policies with the tick time as "now"; the deadline is checked between batches.
 */
@Component
@RequiredArgsConstructor
public class RetentionStage implements PipelineStage {

    private final RetentionManager retentionManager;
    private final RetentionPolicyRegistry retentionPolicyRegistry;

    @Override
    public StageType type() {
        return StageType.RETENTION;
    }

    @Override
    public void execute(StageContext context) {
        for (String policyId : context.getJob().retentionPolicyIds()) {
            SweepResult result = retentionManager.sweep(
                    retentionPolicyRegistry.get(policyId), context.getTickTime(), context::checkDeadline);
            context.getStats().setArchived(context.getStats().getArchived() + result.archived());
            context.getStats().setDeleted(context.getStats().getDeleted() + result.deleted());
        }
    }
}
