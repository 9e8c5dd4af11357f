package com.chicu.papertradebot.trade;

/** Как задан размер сделки */
public enum TradeMode {
    /** количество в базовом активе */
    QTY,
    /** сумма в USDT, qty считается через QuantitySizer */
    USDT
}
