package com.chicu.papertradebot.risk;

import com.chicu.papertradebot.config.RiskWatcherProperties;
import com.chicu.papertradebot.engine.SchedulerService;
import com.chicu.papertradebot.market.MarketPriceService;
import com.chicu.papertradebot.trading.position.PositionStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.util.Optional;

/**
 * Поднимает вотчер приложения поверх paper-хранилища и in-memory цен.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RiskWatcherLauncher {

    private final RiskWatcherProperties properties;
    private final SchedulerService schedulerService;
    private final PositionStore positionStore;
    private final MarketPriceService marketPriceService;
    private final TriggerHandler triggerHandler;
    private final RiskWatcherListener listener;
    private final Clock clock;

    private volatile RiskWatcher watcher;

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        if (!properties.isEnabled()) {
            log.info("[RISK] watcher disabled (papertrade.risk.enabled=false)");
            return;
        }
        start();
    }

    public synchronized RiskWatcher start() {
        if (watcher != null && !watcher.isStopped()) {
            return watcher;
        }

        watcher = RiskWatcher.start(RiskWatcherDeps.builder()
                .fetchOpenPositions(positionStore::findOpen)
                .resolveLastPrice(marketPriceService::getLastPrice)
                .onTrigger(triggerHandler)
                .scheduler(schedulerService)
                .intervalMs(properties.getIntervalMs())
                .cacheTtlMs(properties.getCacheTtlMs())
                .clock(clock)
                .listener(listener)
                .build());

        return watcher;
    }

    @PreDestroy
    public synchronized void stop() {
        if (watcher != null) {
            watcher.stop();
        }
    }

    public Optional<RiskWatcher> current() {
        return Optional.ofNullable(watcher);
    }
}
