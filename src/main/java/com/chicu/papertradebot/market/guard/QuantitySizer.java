package com.chicu.papertradebot.market.guard;

import com.chicu.papertradebot.market.model.SymbolFilters;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.Optional;

/**
 * Перевод суммы в USD в количество, которое примет биржа.
 *
 * Логика:
 * - qty = amountUsd / price (без stepSize — как есть, без обрезки знаков)
 * - stepSize → округление ТОЛЬКО вниз (не покупаем больше, чем разрешил пользователь)
 * - minQty / minNotional → жёсткий отказ с причиной
 *
 * Без состояния, можно звать из любого потока.
 */
@Slf4j
@Service
public class QuantitySizer {

    /** точность qty, если stepSize не задан: значащие цифры, округление вниз */
    static final MathContext RAW_QTY_CONTEXT = new MathContext(34, RoundingMode.DOWN);

    /** лишние знаки при делении перед округлением под stepSize */
    static final int STEP_GUARD_DIGITS = 8;

    /** допуск при сравнении с минимальными фильтрами */
    static final BigDecimal EPSILON = new BigDecimal("1e-12");

    public QuantityResult calculateQuantity(double amountUsd, double price, SymbolFilters filters) {
        if (!Double.isFinite(amountUsd) || amountUsd <= 0) {
            throw new QuantityValidationException(
                    QuantityRejectReason.PRICE, "Trade amount must be greater than zero");
        }
        if (!Double.isFinite(price) || price <= 0) {
            throw new QuantityValidationException(
                    QuantityRejectReason.PRICE, "Unable to determine valid market price");
        }
        return calculateQuantity(BigDecimal.valueOf(amountUsd), BigDecimal.valueOf(price), filters);
    }

    public QuantityResult calculateQuantity(BigDecimal amountUsd, BigDecimal price, SymbolFilters filters) {

        // =====================================================
        // 1️⃣ SANITY
        // =====================================================
        if (amountUsd == null || amountUsd.signum() <= 0) {
            throw new QuantityValidationException(
                    QuantityRejectReason.PRICE, "Trade amount must be greater than zero");
        }
        if (price == null || price.signum() <= 0) {
            throw new QuantityValidationException(
                    QuantityRejectReason.PRICE, "Unable to determine valid market price");
        }

        SymbolFilters f = filters != null ? filters : SymbolFilters.none();

        // =====================================================
        // 2️⃣ STEP SIZE (QTY)
        // =====================================================
        BigDecimal quantity;
        Optional<BigDecimal> stepSize = f.step();

        if (stepSize.isPresent()) {
            BigDecimal step = stepSize.get();
            if (step.signum() <= 0) {
                throw new QuantityValidationException(
                        QuantityRejectReason.STEP, "Step size must be greater than zero");
            }
            int precision = precisionOf(step);
            // делим с запасом по точности, иначе 1/3 не поделится
            BigDecimal raw = amountUsd.divide(price, precision + STEP_GUARD_DIGITS, RoundingMode.DOWN);
            quantity = snapToStep(raw, step).setScale(precision, RoundingMode.DOWN);

            if (quantity.signum() <= 0) {
                throw new QuantityValidationException(
                        QuantityRejectReason.STEP, "Calculated quantity is zero after applying step size");
            }
        } else {
            // без шага qty не режем: только значащие цифры, вниз
            quantity = amountUsd.divide(price, RAW_QTY_CONTEXT);
        }

        // =====================================================
        // 3️⃣ MIN QTY
        // =====================================================
        Optional<BigDecimal> minQty = f.minimumQty();
        if (minQty.isPresent() && quantity.add(EPSILON).compareTo(minQty.get()) < 0) {
            throw new QuantityValidationException(
                    QuantityRejectReason.MIN_QTY, "Quantity must be at least " + strip(minQty.get()));
        }

        // =====================================================
        // 4️⃣ MIN NOTIONAL
        // =====================================================
        BigDecimal notional = quantity.multiply(price);

        Optional<BigDecimal> minNotional = f.minimumNotional();
        if (minNotional.isPresent() && notional.add(EPSILON).compareTo(minNotional.get()) < 0) {
            throw new QuantityValidationException(
                    QuantityRejectReason.MIN_NOTIONAL, "Notional must be at least " + strip(minNotional.get()));
        }

        if (log.isDebugEnabled()) {
            log.debug("🛡️ QTY-GUARD amountUsd={} price={} qty={} notional={}",
                    strip(amountUsd), strip(price), strip(quantity), strip(notional));
        }

        return new QuantityResult(quantity, notional);
    }

    // =====================================================
    // HELPERS
    // =====================================================

    /**
     * Сколько знаков после запятой у шага: 0.001 → 3, 1 → 0, 10 → 0.
     */
    static int precisionOf(BigDecimal step) {
        return Math.max(0, step.stripTrailingZeros().scale());
    }

    private static BigDecimal snapToStep(BigDecimal v, BigDecimal step) {
        return v.divide(step, 0, RoundingMode.DOWN).multiply(step);
    }

    private static String strip(BigDecimal v) {
        return v == null ? "null" : v.stripTrailingZeros().toPlainString();
    }
}
