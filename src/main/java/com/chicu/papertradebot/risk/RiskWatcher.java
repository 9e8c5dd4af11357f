package com.chicu.papertradebot.risk;

import com.chicu.papertradebot.engine.SchedulerService;
import com.chicu.papertradebot.trading.position.Position;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Фоновый контроль TP/SL по открытым позициям.
 *
 * Каждый тик:
 * 1) если прошлый проход ещё идёт — тик пропускается (без очереди);
 * 2) позиции берутся из кэша или из хранилища, если кэш устарел;
 * 3) по каждой позиции: qty → цена → цели → правило срабатывания;
 * 4) при срабатывании вызывается обработчик закрытия, ровно один раз за проход на id.
 *
 * Ошибки загрузки прерывают только текущий проход, ошибки закрытия — только
 * текущую позицию. Наружу из таймера ничего не вылетает.
 */
@Slf4j
public class RiskWatcher implements RiskWatcherHandle {

    private static final AtomicInteger SEQ = new AtomicInteger();

    private final RiskWatcherDeps deps;
    private final PositionCache cache;
    private final String key;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);

    private volatile PassOutcome lastOutcome;
    private volatile Instant lastPassAt;

    RiskWatcher(RiskWatcherDeps deps) {
        this.deps = Objects.requireNonNull(deps, "deps");
        this.cache = new PositionCache(deps.getCacheTtlMs());
        this.key = "risk-watcher-" + SEQ.incrementAndGet();
    }

    // ==============================================================
    // ▶️ START
    // ==============================================================

    /**
     * Создаёт вотчер со своим кэшем и ставит его на таймер.
     * Первый проход выполняется сразу, не дожидаясь первого интервала.
     */
    public static RiskWatcher start(RiskWatcherDeps deps) {
        SchedulerService scheduler = deps.getScheduler();
        if (scheduler == null) {
            throw new IllegalArgumentException("scheduler is required to start a risk watcher");
        }

        RiskWatcher watcher = new RiskWatcher(deps);
        long interval = deps.effectiveIntervalMs();

        scheduler.scheduleAtFixedRate(watcher.key, watcher::evaluate, interval);

        log.info("[RISK] watcher '{}' started interval={}ms cacheTtl={}ms",
                watcher.key, interval, deps.getCacheTtlMs());
        return watcher;
    }

    // ==============================================================
    // ⏹ STOP
    // ==============================================================

    @Override
    public void stop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        if (deps.getScheduler() != null) {
            deps.getScheduler().cancel(key);
        }
        log.info("[RISK] watcher '{}' stopped", key);
    }

    public boolean isStopped() {
        return stopped.get();
    }

    public boolean isRunning() {
        return running.get();
    }

    public String getKey() {
        return key;
    }

    public Optional<PassOutcome> getLastOutcome() {
        return Optional.ofNullable(lastOutcome);
    }

    public Optional<Instant> getLastPassAt() {
        return Optional.ofNullable(lastPassAt);
    }

    public RiskWatcherDeps getDeps() {
        return deps;
    }

    int cachedPositionCount() {
        return cache.size();
    }

    // ==============================================================
    // 🔁 ONE PASS
    // ==============================================================

    /**
     * Один проход. Безопасно звать из любого потока: параллельный вызов
     * просто получит SKIPPED_BUSY.
     */
    public PassOutcome evaluate() {
        if (stopped.get()) {
            return PassOutcome.STOPPED;
        }
        if (!running.compareAndSet(false, true)) {
            log.debug("[RISK] previous pass still running, tick skipped");
            return PassOutcome.SKIPPED_BUSY;
        }

        PassOutcome outcome;
        try {
            outcome = runPass();
        } catch (Exception e) {
            outcome = PassOutcome.FAILED;
            notifySafely(() -> deps.getListener().onPassFailed(e));
        } finally {
            running.set(false);
        }

        lastOutcome = outcome;
        lastPassAt = Instant.now(deps.getClock());
        return outcome;
    }

    private PassOutcome runPass() throws Exception {
        List<Position> positions = cache.get(deps.getClock().millis(), deps.getFetchOpenPositions());
        if (positions.isEmpty()) {
            return PassOutcome.NO_POSITIONS;
        }

        Set<String> seen = new HashSet<>();

        for (Position position : positions) {
            // дубль id в выборке — первый выигрывает
            if (!seen.add(position.getId())) {
                continue;
            }

            if (position.getEffectiveQty().isEmpty()) {
                log.debug("[RISK] skip id={} {}: no usable qty", position.getId(), position.getSymbol());
                continue;
            }

            Optional<BigDecimal> lastPrice = deps.getResolveLastPrice().resolveLastPrice(position.getSymbol());
            if (lastPrice == null || lastPrice.isEmpty()) {
                continue;
            }

            if (!position.hasTargets()) {
                continue;
            }

            BigDecimal price = lastPrice.get();
            Optional<TriggerKind> trigger = TriggerRule.evaluate(
                    position.getSide(), price, position.getTpPrice(), position.getSlPrice());

            trigger.ifPresent(kind -> fire(new TriggerEvent(position, kind, price)));
        }

        return PassOutcome.COMPLETED;
    }

    private void fire(TriggerEvent event) {
        Position p = event.position();
        try {
            deps.getOnTrigger().onTrigger(p, event.kind(), event.price());
        } catch (Exception e) {
            // позиция остаётся в кэше, повтор на следующем тике
            notifySafely(() -> deps.getListener().onTriggerFailed(event, e));
            return;
        }

        cache.remove(p.getId());
        cache.invalidate();
        notifySafely(() -> deps.getListener().onTriggered(event));
    }

    private void notifySafely(Runnable r) {
        try {
            r.run();
        } catch (Exception e) {
            log.warn("[RISK] listener failed: {}", e.getMessage());
        }
    }
}
