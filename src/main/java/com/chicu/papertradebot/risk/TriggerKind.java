package com.chicu.papertradebot.risk;

public enum TriggerKind {
    /** Take Profit */
    TP,
    /** Stop Loss */
    SL
}
