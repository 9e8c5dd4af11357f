package com.chicu.papertradebot.risk;

/**
 * Чем закончился один проход вотчера.
 */
public enum PassOutcome {
    /** вотчер уже остановлен */
    STOPPED,
    /** предыдущий проход ещё идёт — тик пропущен целиком */
    SKIPPED_BUSY,
    NO_POSITIONS,
    COMPLETED,
    /** упала загрузка позиций или поиск цены */
    FAILED
}
