package com.chicu.papertradebot.risk;

import com.chicu.papertradebot.trading.position.Position;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Короткоживущий кэш списка открытых позиций.
 *
 * Принадлежит одному вотчеру и меняется только изнутри прохода (один писатель).
 * Это оптимизация, а не источник правды: после любого срабатывания кэш
 * помечается устаревшим и следующий тик читает хранилище заново.
 */
@Slf4j
class PositionCache {

    private final long ttlMs;

    private List<Position> positions = List.of();
    private long fetchedAt;
    private boolean stale = true;

    PositionCache(long ttlMs) {
        this.ttlMs = Math.max(0, ttlMs);
    }

    List<Position> get(long nowMs, PositionFetcher fetcher) throws Exception {
        if (isFresh(nowMs)) {
            return positions;
        }

        List<Position> fetched = fetcher.fetchOpenPositions();
        positions = fetched == null ? List.of() : List.copyOf(withoutNulls(fetched));
        fetchedAt = nowMs;
        stale = false;

        log.debug("[RISK] positions refreshed count={}", positions.size());
        return positions;
    }

    boolean isFresh(long nowMs) {
        return !stale && !positions.isEmpty() && nowMs - fetchedAt < ttlMs;
    }

    void remove(String id) {
        List<Position> left = new ArrayList<>(positions.size());
        for (Position p : positions) {
            if (!p.getId().equals(id)) {
                left.add(p);
            }
        }
        positions = List.copyOf(left);
    }

    void invalidate() {
        stale = true;
    }

    int size() {
        return positions.size();
    }

    private static List<Position> withoutNulls(List<Position> src) {
        List<Position> out = new ArrayList<>(src.size());
        for (Position p : src) {
            if (p != null) {
                out.add(p);
            }
        }
        return out;
    }
}
