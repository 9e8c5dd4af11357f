package com.chicu.papertradebot.risk;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class RiskWatcherHealthIndicator implements HealthIndicator {

    private final RiskWatcherLauncher launcher;

    @Override
    public Health health() {
        RiskWatcher watcher = launcher.current().orElse(null);

        if (watcher == null) {
            return Health.unknown()
                    .withDetail("status", "Risk watcher not started")
                    .build();
        }

        Health.Builder builder = watcher.isStopped() ? Health.outOfService() : Health.up();

        builder.withDetail("key", watcher.getKey())
                .withDetail("interval_ms", watcher.getDeps().effectiveIntervalMs())
                .withDetail("cache_ttl_ms", watcher.getDeps().getCacheTtlMs());

        watcher.getLastOutcome().ifPresent(o -> builder.withDetail("last_outcome", o.name()));
        watcher.getLastPassAt().ifPresent(t -> builder.withDetail("last_pass_at", t.toString()));

        return builder.build();
    }
}
