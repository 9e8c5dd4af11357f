package com.chicu.papertradebot.risk;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Последняя известная цена по символу. Только память, без сети.
 */
@FunctionalInterface
public interface PriceLookup {

    Optional<BigDecimal> resolveLastPrice(String symbol);
}
