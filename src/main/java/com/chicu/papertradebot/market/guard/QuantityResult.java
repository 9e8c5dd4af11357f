package com.chicu.papertradebot.market.guard;

import java.math.BigDecimal;

/**
 * Итог расчёта: qty в базовом активе и notional = qty * price.
 */
public record QuantityResult(
        BigDecimal quantity,
        BigDecimal notional
) {
}
