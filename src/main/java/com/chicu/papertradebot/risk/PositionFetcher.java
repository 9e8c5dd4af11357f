package com.chicu.papertradebot.risk;

import com.chicu.papertradebot.trading.position.Position;

import java.util.List;

/**
 * Загрузка актуального списка открытых позиций. Может делать I/O и падать.
 */
@FunctionalInterface
public interface PositionFetcher {

    List<Position> fetchOpenPositions() throws Exception;
}
