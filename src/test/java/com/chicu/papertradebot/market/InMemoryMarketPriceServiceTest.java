package com.chicu.papertradebot.market;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryMarketPriceServiceTest {

    private final InMemoryMarketPriceService prices = new InMemoryMarketPriceService();

    @Test
    void updatePrice_shouldNormalizeSymbol() {
        prices.updatePrice(" btcusdt ", new BigDecimal("65000"));

        assertEquals(new BigDecimal("65000"), prices.getLastPrice("BTCUSDT").orElseThrow());
        assertEquals(new BigDecimal("65000"), prices.getLastPrice("btcUSDT").orElseThrow());
    }

    @Test
    void nonPositiveOrNull_shouldBeIgnored() {
        prices.updatePrice("ETHUSDT", new BigDecimal("3000"));
        prices.updatePrice("ETHUSDT", BigDecimal.ZERO);
        prices.updatePrice("ETHUSDT", new BigDecimal("-1"));
        prices.updatePrice("ETHUSDT", null);
        prices.updatePrice(null, BigDecimal.ONE);

        assertEquals(new BigDecimal("3000"), prices.getLastPrice("ETHUSDT").orElseThrow());
    }

    @Test
    void unknownSymbol_shouldBeEmpty() {
        assertTrue(prices.getLastPrice("DOGEUSDT").isEmpty());
        assertTrue(prices.getLastPrice(null).isEmpty());
        assertTrue(prices.getLastPrice("  ").isEmpty());
    }

    @Test
    void snapshot_andClear() {
        prices.updatePrice("SOLUSDT", new BigDecimal("150"));
        prices.updatePrice("BTCUSDT", new BigDecimal("65000"));

        Map<String, BigDecimal> all = prices.getAllLastPrices();
        assertEquals(2, all.size());
        assertEquals(new BigDecimal("150"), all.get("SOLUSDT"));

        prices.clear();
        assertTrue(prices.getAllLastPrices().isEmpty());
    }
}
