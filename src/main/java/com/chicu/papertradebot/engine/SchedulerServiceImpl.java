package com.chicu.papertradebot.engine;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import jakarta.annotation.PreDestroy;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

@Slf4j
@Service
public class SchedulerServiceImpl implements SchedulerService {

    private static final AtomicInteger THREAD_SEQ = new AtomicInteger();

    /**
     * Пул потоков для фоновых задач.
     * daemon=true чтобы не блокировать завершение приложения.
     */
    private final ScheduledExecutorService executor;

    /** key → future задачи */
    private final Map<String, ScheduledFuture<?>> tasks = new ConcurrentHashMap<>();

    /** key → время старта */
    private final Map<String, Instant> startedAt = new ConcurrentHashMap<>();

    public SchedulerServiceImpl() {
        this(Math.max(2, Runtime.getRuntime().availableProcessors() / 2));
    }

    public SchedulerServiceImpl(int poolSize) {
        this.executor = Executors.newScheduledThreadPool(
                poolSize,
                r -> {
                    Thread t = new Thread(r);
                    t.setDaemon(true);
                    t.setName("RiskScheduler-" + THREAD_SEQ.incrementAndGet());
                    return t;
                }
        );
    }


    // ==============================================================
    // ▶️ START TASK
    // ==============================================================
    @Override
    public ScheduledFuture<?> scheduleAtFixedRate(String key, Runnable task, long intervalMs) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("key must not be blank");
        }
        if (task == null) {
            throw new IllegalArgumentException("task must not be null");
        }
        if (intervalMs <= 0) {
            throw new IllegalArgumentException("intervalMs must be > 0");
        }

        // если задача существует — отменяем перед созданием новой
        cancel(key);

        ScheduledFuture<?> future = executor.scheduleAtFixedRate(
                guarded(key, task),
                0,                   // старт немедленно
                intervalMs,
                TimeUnit.MILLISECONDS
        );

        tasks.put(key, future);
        startedAt.put(key, Instant.now());

        log.info("⏱ Scheduler: started '{}' (interval={}ms)", key, intervalMs);
        return future;
    }


    // ==============================================================
    // ⏹ CANCEL
    // ==============================================================
    @Override
    public void cancel(String key) {
        if (key == null) {
            return;
        }

        ScheduledFuture<?> future = tasks.remove(key);

        if (future != null) {
            future.cancel(false);
            log.info("🛑 Scheduler: cancelled task '{}'", key);
        }

        startedAt.remove(key);
    }


    // ==============================================================
    // ℹ STATUS
    // ==============================================================
    @Override
    public boolean isActive(String key) {
        ScheduledFuture<?> future = key != null ? tasks.get(key) : null;
        return future != null && !future.isCancelled() && !future.isDone();
    }

    @Override
    public Optional<Instant> getStartedAt(String key) {
        return key == null ? Optional.empty() : Optional.ofNullable(startedAt.get(key));
    }


    // ==============================================================
    // 🛡 GUARD
    // ==============================================================

    /**
     * ScheduledExecutorService молча глушит все следующие запуски,
     * если тик выбросил исключение. Поэтому ловим здесь.
     */
    private Runnable guarded(String key, Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (Exception e) {
                log.error("❌ Scheduler: task '{}' failed, next tick will run as usual", key, e);
            }
        };
    }


    // ==============================================================
    // 🛑 SHUTDOWN
    // ==============================================================
    @PreDestroy
    public void shutdown() {
        if (log.isInfoEnabled()) {
            log.info("💤 SchedulerServiceImpl shutting down…");
        }
        tasks.clear();
        startedAt.clear();
        executor.shutdownNow();
    }
}
