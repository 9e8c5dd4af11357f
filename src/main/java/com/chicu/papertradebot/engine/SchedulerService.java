package com.chicu.papertradebot.engine;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;

/**
 * Чистый планировщик задач по строковому ключу.
 *
 * Задача этого сервиса — только крутить Runnable по таймеру.
 * Он НЕ знает ни про позиции, ни про цены, ни про TP/SL.
 */
public interface SchedulerService {

    /**
     * Запускает периодическую задачу. Первый запуск — сразу, без задержки.
     *
     * @param key        уникальный ключ задачи (например: "risk-watcher-1")
     * @param task       логика, которую надо регулярно выполнять
     * @param intervalMs интервал между тиками, в миллисекундах
     */
    ScheduledFuture<?> scheduleAtFixedRate(String key, Runnable task, long intervalMs);

    /**
     * Остановка задачи по ключу. Выполняющийся тик не прерывается.
     * Повторный вызов — no-op.
     */
    void cancel(String key);

    /**
     * Активна ли задача по ключу.
     */
    boolean isActive(String key);

    /**
     * Время старта задачи по ключу.
     */
    Optional<Instant> getStartedAt(String key);
}
