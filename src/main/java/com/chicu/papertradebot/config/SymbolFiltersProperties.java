package com.chicu.papertradebot.config;

import com.chicu.papertradebot.market.model.SymbolFilters;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Биржевые фильтры по символам, например:
 *
 * papertrade.symbols.BTCUSDT.step-size=0.00001
 * papertrade.symbols.BTCUSDT.min-notional=5
 */
@Data
@ConfigurationProperties(prefix = "papertrade")
public class SymbolFiltersProperties {

    private Map<String, Filter> symbols = new LinkedHashMap<>();

    @Data
    public static class Filter {
        private BigDecimal stepSize;
        private BigDecimal minQty;
        private BigDecimal minNotional;
    }

    /**
     * Фильтры символа; если не настроены — без ограничений.
     */
    public SymbolFilters filtersFor(String symbol) {
        if (symbol == null) {
            return SymbolFilters.none();
        }
        String key = symbol.trim();
        for (Map.Entry<String, Filter> e : symbols.entrySet()) {
            if (e.getKey().equalsIgnoreCase(key) && e.getValue() != null) {
                Filter f = e.getValue();
                return new SymbolFilters(f.getStepSize(), f.getMinQty(), f.getMinNotional());
            }
        }
        return SymbolFilters.none();
    }
}
