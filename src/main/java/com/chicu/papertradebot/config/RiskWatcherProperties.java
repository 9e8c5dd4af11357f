package com.chicu.papertradebot.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "papertrade.risk")
public class RiskWatcherProperties {

    /**
     * Запускать ли вотчер при старте приложения.
     */
    private boolean enabled = true;

    /**
     * Период прохода. Меньше 100 мс не бывает — поднимется до 100.
     */
    private long intervalMs = 750;

    /**
     * Сколько живёт кэш списка позиций.
     */
    private long cacheTtlMs = 1000;
}
