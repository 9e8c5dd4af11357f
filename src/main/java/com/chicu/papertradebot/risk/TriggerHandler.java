package com.chicu.papertradebot.risk;

import com.chicu.papertradebot.trading.position.Position;

import java.math.BigDecimal;

/**
 * Закрытие позиции при срабатывании TP/SL. Необратимый внешний эффект.
 * Исключение = закрыть не удалось, вотчер повторит на следующем тике.
 */
@FunctionalInterface
public interface TriggerHandler {

    void onTrigger(Position position, TriggerKind kind, BigDecimal price) throws Exception;
}
