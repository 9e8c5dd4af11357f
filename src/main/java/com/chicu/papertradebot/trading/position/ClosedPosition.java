package com.chicu.papertradebot.trading.position;

import lombok.Builder;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Результат закрытия позиции.
 */
@Builder
public record ClosedPosition(
        Position position,
        BigDecimal exitPrice,
        BigDecimal qty,
        BigDecimal pnl,
        String reason,          // "TP" / "SL" / "MANUAL"
        Instant closedAt
) {
}
