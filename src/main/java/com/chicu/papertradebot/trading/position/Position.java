package com.chicu.papertradebot.trading.position;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Открытая позиция (read-only снимок).
 *
 * qty может отсутствовать в источнике — тогда рабочее количество
 * выводится из sizeUsd / entryPrice один раз при создании объекта.
 * Выведенное значение живёт только здесь и обратно в хранилище не пишется.
 */
@Getter
@ToString
@EqualsAndHashCode
public class Position {

    static final int QTY_SCALE = 8;

    private final String id;
    private final String symbol;
    private final PositionSide side;

    @Getter(lombok.AccessLevel.NONE)
    private final BigDecimal qty;
    @Getter(lombok.AccessLevel.NONE)
    private final BigDecimal sizeUsd;
    @Getter(lombok.AccessLevel.NONE)
    private final BigDecimal entryPrice;
    @Getter(lombok.AccessLevel.NONE)
    private final BigDecimal tpPrice;
    @Getter(lombok.AccessLevel.NONE)
    private final BigDecimal slPrice;

    private final Instant openedAt;

    @Getter(lombok.AccessLevel.NONE)
    @EqualsAndHashCode.Exclude
    private final BigDecimal effectiveQty;

    @Builder(toBuilder = true)
    public Position(String id,
                    String symbol,
                    PositionSide side,
                    BigDecimal qty,
                    BigDecimal sizeUsd,
                    BigDecimal entryPrice,
                    BigDecimal tpPrice,
                    BigDecimal slPrice,
                    Instant openedAt) {

        this.id = Objects.requireNonNull(id, "id");
        this.symbol = Objects.requireNonNull(symbol, "symbol");
        this.side = Objects.requireNonNull(side, "side");
        this.qty = qty;
        this.sizeUsd = sizeUsd;
        this.entryPrice = entryPrice;
        this.tpPrice = tpPrice;
        this.slPrice = slPrice;
        this.openedAt = openedAt;
        this.effectiveQty = resolveQty(qty, sizeUsd, entryPrice);
    }

    // =====================================================
    // OPTIONAL FIELDS
    // =====================================================

    /** qty как оно пришло из источника */
    public Optional<BigDecimal> getStoredQty() {
        return Optional.ofNullable(qty);
    }

    public Optional<BigDecimal> getSizeUsd() {
        return Optional.ofNullable(sizeUsd);
    }

    public Optional<BigDecimal> getEntryPrice() {
        return Optional.ofNullable(entryPrice);
    }

    /** TP ≤ 0 считается "не задан" */
    public Optional<BigDecimal> getTpPrice() {
        return positive(tpPrice);
    }

    /** SL ≤ 0 считается "не задан" */
    public Optional<BigDecimal> getSlPrice() {
        return positive(slPrice);
    }

    /**
     * Рабочее количество: сохранённый qty &gt; 0, иначе sizeUsd / entryPrice.
     * Пусто — позицию нельзя оценивать в этом проходе.
     */
    public Optional<BigDecimal> getEffectiveQty() {
        return Optional.ofNullable(effectiveQty);
    }

    public boolean hasTargets() {
        return getTpPrice().isPresent() || getSlPrice().isPresent();
    }

    // =====================================================
    // HELPERS
    // =====================================================

    private static BigDecimal resolveQty(BigDecimal qty, BigDecimal sizeUsd, BigDecimal entryPrice) {
        if (qty != null && qty.signum() > 0) {
            return qty;
        }
        if (sizeUsd != null && sizeUsd.signum() > 0 && entryPrice != null && entryPrice.signum() > 0) {
            BigDecimal derived = sizeUsd.divide(entryPrice, QTY_SCALE, RoundingMode.DOWN);
            return derived.signum() > 0 ? derived : null;
        }
        return null;
    }

    private static Optional<BigDecimal> positive(BigDecimal v) {
        return v != null && v.signum() > 0 ? Optional.of(v) : Optional.empty();
    }
}
