package com.chicu.papertradebot.risk;

import com.chicu.papertradebot.trading.position.Position;

import java.math.BigDecimal;

/**
 * Срабатывание TP/SL внутри одного прохода. Нигде не сохраняется.
 */
public record TriggerEvent(
        Position position,
        TriggerKind kind,
        BigDecimal price
) {
}
