package com.chicu.papertradebot.config;

import com.chicu.papertradebot.risk.MeterRiskWatcherListener;
import com.chicu.papertradebot.risk.RiskWatcherListener;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties({
        RiskWatcherProperties.class,
        SymbolFiltersProperties.class
})
public class RiskWatcherConfig {

    /**
     * Логи + счётчики Micrometer. Хост может подменить своим бином.
     */
    @Bean
    @ConditionalOnMissingBean
    public RiskWatcherListener riskWatcherListener(MeterRegistry meterRegistry) {
        return new MeterRiskWatcherListener(meterRegistry);
    }
}
