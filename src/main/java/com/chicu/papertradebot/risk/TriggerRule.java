package com.chicu.papertradebot.risk;

import com.chicu.papertradebot.trading.position.PositionSide;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Правило срабатывания. Границы включительно, TP проверяется раньше SL.
 *
 * LONG:  price ≥ TP → TP, иначе price ≤ SL → SL
 * SHORT: price ≤ TP → TP, иначе price ≥ SL → SL
 */
public final class TriggerRule {

    private TriggerRule() {
    }

    public static Optional<TriggerKind> evaluate(PositionSide side,
                                                 BigDecimal price,
                                                 Optional<BigDecimal> tp,
                                                 Optional<BigDecimal> sl) {
        if (side == null || price == null) {
            return Optional.empty();
        }

        return switch (side) {
            case LONG -> {
                if (tp.isPresent() && price.compareTo(tp.get()) >= 0) {
                    yield Optional.of(TriggerKind.TP);
                }
                if (sl.isPresent() && price.compareTo(sl.get()) <= 0) {
                    yield Optional.of(TriggerKind.SL);
                }
                yield Optional.empty();
            }
            case SHORT -> {
                if (tp.isPresent() && price.compareTo(tp.get()) <= 0) {
                    yield Optional.of(TriggerKind.TP);
                }
                if (sl.isPresent() && price.compareTo(sl.get()) >= 0) {
                    yield Optional.of(TriggerKind.SL);
                }
                yield Optional.empty();
            }
        };
    }
}
