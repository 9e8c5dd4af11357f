package com.chicu.papertradebot.risk;

@FunctionalInterface
public interface RiskWatcherHandle {

    /**
     * Отменяет таймер. Не ждёт и не прерывает текущий проход.
     * Повторный вызов — no-op.
     */
    void stop();
}
