package com.chicu.papertradebot.trade;

import lombok.Builder;

import java.math.BigDecimal;

/**
 * Запрос на открытие paper-позиции.
 */
@Builder
public record OpenPositionCommand(
        String symbol,
        String side,              // "LONG" / "SHORT" (по умолчанию LONG)
        TradeMode mode,           // по умолчанию QTY
        BigDecimal qty,
        BigDecimal usdtAmount,
        BigDecimal tpPrice,
        BigDecimal slPrice
) {
}
