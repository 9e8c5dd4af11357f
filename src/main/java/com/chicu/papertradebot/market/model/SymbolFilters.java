package com.chicu.papertradebot.market.model;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Биржевые фильтры инструмента, которые влияют на размер ордера.
 *
 * Каждый фильтр опционален и проверяется независимо:
 * - stepSize    → qty должно быть кратно шагу
 * - minQty      → минимальное количество
 * - minNotional → минимальная сумма сделки (qty * price)
 *
 * ❗ Только данные (immutable)
 */
public record SymbolFilters(
        BigDecimal stepSize,
        BigDecimal minQty,
        BigDecimal minNotional
) {

    private static final SymbolFilters NONE = new SymbolFilters(null, null, null);

    public static SymbolFilters none() {
        return NONE;
    }

    public static SymbolFilters of(String stepSize, String minQty, String minNotional) {
        return new SymbolFilters(parse(stepSize), parse(minQty), parse(minNotional));
    }

    public Optional<BigDecimal> step() {
        return Optional.ofNullable(stepSize);
    }

    public Optional<BigDecimal> minimumQty() {
        return Optional.ofNullable(minQty);
    }

    public Optional<BigDecimal> minimumNotional() {
        return Optional.ofNullable(minNotional);
    }

    private static BigDecimal parse(String v) {
        return v == null || v.isBlank() ? null : new BigDecimal(v.trim());
    }
}
