package com.brush.matching.metrics;

import com.brush.matching.core.model.DelimiterClass;
import com.brush.matching.core.model.MatchType;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordMatchDuration(MatchType matchType, Duration duration) {
    }

    @Override
    public void incrementStrategyMatched(String strategyName) {
    }

    @Override
    public void incrementNoMatch() {
    }

    @Override
    public void incrementSplit(DelimiterClass delimiterClass) {
    }

    @Override
    public void recordBatchSize(long size) {
    }

    @Override
    public void recordCacheHit() {
    }

    @Override
    public void recordCacheMiss() {
    }
}
