package com.chicu.papertradebot.market;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Optional;

/**
 * MarketPriceService — единый источник "последней цены" по символу.
 *
 * Источник данных (поток котировок) вызывает updatePrice().
 * Потребители (риск-вотчер, открытие позиций) читают getLastPrice().
 * Чтение — из памяти, без I/O: можно звать прямо внутри прохода вотчера.
 */
public interface MarketPriceService {

    /**
     * Обновить последнюю цену по символу. Цена ≤ 0 игнорируется.
     */
    void updatePrice(String symbol, BigDecimal price);

    /**
     * Получить последнюю цену, если она есть.
     */
    Optional<BigDecimal> getLastPrice(String symbol);

    /**
     * Снимок всех известных цен.
     */
    Map<String, BigDecimal> getAllLastPrices();

    void clear();
}
