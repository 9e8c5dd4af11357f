package com.chicu.papertradebot.risk;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

/**
 * Пишет в лог и считает срабатывания/ошибки в Micrometer,
 * чтобы можно было алертить на повторяющиеся неудачные закрытия.
 */
public class MeterRiskWatcherListener extends LoggingRiskWatcherListener {

    private final MeterRegistry meterRegistry;
    private final Counter passFailures;

    public MeterRiskWatcherListener(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.passFailures = Counter.builder("risk_watcher_passes_failed_total")
                .register(meterRegistry);
    }

    @Override
    public void onTriggered(TriggerEvent event) {
        super.onTriggered(event);
        Counter.builder("risk_watcher_triggers_total")
                .tag("kind", event.kind().name())
                .register(meterRegistry)
                .increment();
    }

    @Override
    public void onTriggerFailed(TriggerEvent event, Exception error) {
        super.onTriggerFailed(event, error);
        Counter.builder("risk_watcher_trigger_failures_total")
                .tag("kind", event.kind().name())
                .register(meterRegistry)
                .increment();
    }

    @Override
    public void onPassFailed(Exception error) {
        super.onPassFailed(error);
        passFailures.increment();
    }
}
