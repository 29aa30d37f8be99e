package com.brush.matching.metrics;

import com.brush.matching.core.model.DelimiterClass;
import com.brush.matching.core.model.MatchType;

import java.time.Duration;

/**
 * Interface for recording brush matching metrics.
 * The default {@link NoOpMetricsService} does nothing, so the matcher works
 * without a metrics registry.
 */
public interface MetricsService {

    void recordMatchDuration(MatchType matchType, Duration duration);

    void incrementStrategyMatched(String strategyName);

    void incrementNoMatch();

    void incrementSplit(DelimiterClass delimiterClass);

    void recordBatchSize(long size);

    void recordCacheHit();

    void recordCacheMiss();
}
