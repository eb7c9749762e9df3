package com.marketsync.scheduler.stage;

import com.marketsync.drift.DriftMonitor;
import com.marketsync.scheduler.StageContext;
import com.marketsync.scheduler.StageType;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class DriftCheckStage implements PipelineStage {

    private final DriftMonitor driftMonitor;

    @Override
    public StageType type() {
        return StageType.DRIFT_CHECK;
    }

    @Override
    public void execute(StageContext context) {
        for (String modelId : context.getJob().modelIds()) {
            context.checkDeadline();
            if (driftMonitor.check(modelId).isPresent()) {
                context.getStats().setRetrainRequests(context.getStats().getRetrainRequests() + 1);
            }
        }
    }
}
