package com.chicu.papertradebot.risk;

import com.chicu.papertradebot.engine.SchedulerService;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;

import java.time.Clock;

/**
 * Всё, что нужно вотчеру снаружи. Кэш сюда не входит — вотчер создаёт свой.
 */
@Getter
@Builder
public class RiskWatcherDeps {

    public static final long DEFAULT_INTERVAL_MS = 750;
    public static final long DEFAULT_CACHE_TTL_MS = 1000;
    public static final long MIN_INTERVAL_MS = 100;

    @NonNull
    private final PositionFetcher fetchOpenPositions;

    @NonNull
    private final PriceLookup resolveLastPrice;

    @NonNull
    private final TriggerHandler onTrigger;

    /** нужен только для start() */
    private final SchedulerService scheduler;

    @Builder.Default
    private final long intervalMs = DEFAULT_INTERVAL_MS;

    @Builder.Default
    private final long cacheTtlMs = DEFAULT_CACHE_TTL_MS;

    @Builder.Default
    private final Clock clock = Clock.systemUTC();

    @Builder.Default
    private final RiskWatcherListener listener = new LoggingRiskWatcherListener();

    /** интервал с нижней границей 100 мс */
    public long effectiveIntervalMs() {
        return Math.max(intervalMs, MIN_INTERVAL_MS);
    }
}
