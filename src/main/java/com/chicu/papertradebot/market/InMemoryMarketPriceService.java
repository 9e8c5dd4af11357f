package com.chicu.papertradebot.market;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Хранит последние цены в памяти (BigDecimal).
 * Символы нормализуются: trim + upper case.
 */
@Slf4j
@Service
public class InMemoryMarketPriceService implements MarketPriceService {

    private final ConcurrentMap<String, BigDecimal> lastPrices = new ConcurrentHashMap<>();

    @Override
    public void updatePrice(String symbol, BigDecimal price) {
        if (symbol == null || symbol.isBlank() || price == null) {
            return;
        }
        if (price.signum() <= 0) {
            log.debug("price ignored symbol={} price={}", symbol, price);
            return;
        }
        lastPrices.put(normalize(symbol), price);
    }

    @Override
    public Optional<BigDecimal> getLastPrice(String symbol) {
        if (symbol == null || symbol.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(lastPrices.get(normalize(symbol)));
    }

    @Override
    public Map<String, BigDecimal> getAllLastPrices() {
        return new TreeMap<>(lastPrices);
    }

    @Override
    public void clear() {
        lastPrices.clear();
    }

    private String normalize(String s) {
        return s.trim().toUpperCase();
    }
}
