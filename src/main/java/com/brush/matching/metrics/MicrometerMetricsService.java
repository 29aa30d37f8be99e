package com.brush.matching.metrics;

import com.brush.matching.core.model.DelimiterClass;
import com.brush.matching.core.model.MatchType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code brush.match.duration}: Timer (tag: matchType)</li>
 *   <li>{@code brush.strategy.matched}: Counter (tag: strategy)</li>
 *   <li>{@code brush.match.none}: Counter</li>
 *   <li>{@code brush.split}: Counter (tag: delimiterClass)</li>
 *   <li>{@code brush.batch.size}: DistributionSummary</li>
 *   <li>{@code brush.cache.hit}: Counter</li>
 *   <li>{@code brush.cache.miss}: Counter</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<MatchType, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Counter noMatchCounter;
    private final DistributionSummary batchSizeSummary;
    private final Counter cacheHitCounter;
    private final Counter cacheMissCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.noMatchCounter = Counter.builder("brush.match.none")
                .description("Number of inputs no strategy could match")
                .register(registry);
        this.batchSizeSummary = DistributionSummary.builder("brush.batch.size")
                .description("Number of records per batch")
                .register(registry);
        this.cacheHitCounter = Counter.builder("brush.cache.hit")
                .description("Number of match cache hits")
                .register(registry);
        this.cacheMissCounter = Counter.builder("brush.cache.miss")
                .description("Number of match cache misses")
                .register(registry);
    }

    @Override
    public void recordMatchDuration(MatchType matchType, Duration duration) {
        Timer timer = timerCache.computeIfAbsent(matchType, type ->
                Timer.builder("brush.match.duration")
                        .description("Duration of single brush matches")
                        .tag("matchType", type.name())
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void incrementStrategyMatched(String strategyName) {
        counterCache.computeIfAbsent("strategy:" + strategyName, k ->
                Counter.builder("brush.strategy.matched")
                        .description("Number of matches won by each strategy")
                        .tag("strategy", strategyName)
                        .register(registry))
                .increment();
    }

    @Override
    public void incrementNoMatch() {
        noMatchCounter.increment();
    }

    @Override
    public void incrementSplit(DelimiterClass delimiterClass) {
        counterCache.computeIfAbsent("split:" + delimiterClass.name(), k ->
                Counter.builder("brush.split")
                        .description("Number of handle/knot splits by delimiter class")
                        .tag("delimiterClass", delimiterClass.name())
                        .register(registry))
                .increment();
    }

    @Override
    public void recordBatchSize(long size) {
        batchSizeSummary.record(size);
    }

    @Override
    public void recordCacheHit() {
        cacheHitCounter.increment();
    }

    @Override
    public void recordCacheMiss() {
        cacheMissCounter.increment();
    }
}
