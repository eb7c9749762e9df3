package com.marketsync.scheduler.stage;

import com.marketsync.domain.AggregateBucket;
import com.marketsync.domain.AggregateBucketRepository;
import com.marketsync.domain.BucketGranularity;
import com.marketsync.drift.ForecastResult;
import com.marketsync.drift.Forecaster;
import com.marketsync.drift.ModelMetricService;
import com.marketsync.drift.config.DriftProperties;
import com.marketsync.scheduler.StageContext;
import com.marketsync.scheduler.StageType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Runs the external forecaster per (model, entity) over recent daily buckets and stores one metric per model:
 * the mean accuracy and drift over the entities it could score.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ForecastStage implements PipelineStage {

    private final ObjectProvider<Forecaster> forecaster;
    private final AggregateBucketRepository aggregateBucketRepository;
    private final ModelMetricService modelMetricService;
    private final DriftProperties driftProperties;

    @Override
    public StageType type() {
        return StageType.FORECAST;
    }

    @Override
    public void execute(StageContext context) {
        Forecaster model = forecaster.getObject();
        for (String modelId : context.getJob().modelIds()) {
            double accuracy = 0.0;
            double drift = 0.0;
            int scored = 0;
            for (String entity : context.getJob().entities()) {
                context.checkDeadline();
                List<AggregateBucket> history = dailyHistory(entity, context);
                if (history.isEmpty()) {
                    continue;
                }
                ForecastResult result = model.forecast(modelId, entity, history);
                accuracy += result.accuracy();
                drift += result.driftScore();
                scored++;
            }
            if (scored == 0) {
                log.info("Model {}: no daily history for any entity, no metric recorded", modelId);
                continue;
            }
            modelMetricService.record(modelId, accuracy / scored, drift / scored, context.getTickTime());
            context.getStats().setMetricsRecorded(context.getStats().getMetricsRecorded() + 1);
        }
    }

    private List<AggregateBucket> dailyHistory(String entity, StageContext context) {
        List<AggregateBucket> newestFirst = aggregateBucketRepository
                .findByEntityAndGranularityAndBucketStartLessThanOrderByBucketStartDesc(
                        entity, BucketGranularity.DAILY, context.getTickTime(),
                        PageRequest.of(0, Math.max(1, driftProperties.getForecastHistoryBuckets())));
        List<AggregateBucket> oldestFirst = new ArrayList<>(newestFirst);
        Collections.reverse(oldestFirst);
        return oldestFirst;
    }
}
