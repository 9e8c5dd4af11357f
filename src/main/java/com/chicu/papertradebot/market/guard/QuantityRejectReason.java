package com.chicu.papertradebot.market.guard;

/**
 * Почему не удалось посчитать qty. Закрытый набор — вызывающий код
 * ветвится по причине, а не по тексту сообщения.
 */
public enum QuantityRejectReason {

    /** сумма или цена невалидны (null, NaN, ≤ 0) */
    PRICE,

    /** после округления под stepSize qty стало 0, либо stepSize ≤ 0 */
    STEP,

    MIN_QTY,

    MIN_NOTIONAL
}
