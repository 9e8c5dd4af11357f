package com.chicu.papertradebot.trading.position;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * Хранилище позиций. Источник правды для списка открытых позиций.
 */
public interface PositionStore {

    List<Position> findOpen();

    Optional<Position> findOpenById(String id);

    Position open(Position position);

    /**
     * Закрыть позицию по цене выхода.
     *
     * @return пусто, если позиция уже не открыта
     */
    Optional<ClosedPosition> close(String id, BigDecimal exitPrice, String reason);

    List<ClosedPosition> findClosed();
}
