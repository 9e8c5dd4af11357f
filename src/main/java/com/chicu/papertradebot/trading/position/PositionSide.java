package com.chicu.papertradebot.trading.position;

import java.util.Optional;

public enum PositionSide {
    LONG,
    SHORT;

    /**
     * Разбор стороны из внешних данных: LONG/SHORT, а также BUY/SELL.
     */
    public static Optional<PositionSide> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        return switch (raw.trim().toUpperCase()) {
            case "LONG", "BUY" -> Optional.of(LONG);
            case "SHORT", "SELL" -> Optional.of(SHORT);
            default -> Optional.empty();
        };
    }
}
