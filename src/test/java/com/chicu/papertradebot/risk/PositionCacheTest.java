package com.chicu.papertradebot.risk;

import com.chicu.papertradebot.trading.position.Position;
import com.chicu.papertradebot.trading.position.PositionSide;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class PositionCacheTest {

    private final AtomicInteger fetches = new AtomicInteger();
    private List<Position> upstream = new ArrayList<>(List.of(pos("a"), pos("b")));

    private final PositionFetcher fetcher = () -> {
        fetches.incrementAndGet();
        return upstream;
    };

    @Test
    void withinTtl_shouldReuse() throws Exception {
        PositionCache cache = new PositionCache(1000);

        cache.get(0, fetcher);
        cache.get(999, fetcher);

        assertEquals(1, fetches.get());
    }

    @Test
    void afterTtl_shouldRefetch() throws Exception {
        PositionCache cache = new PositionCache(1000);

        cache.get(0, fetcher);
        cache.get(1000, fetcher);

        assertEquals(2, fetches.get());
    }

    @Test
    void emptyList_shouldAlwaysRefetch() throws Exception {
        upstream = List.of();
        PositionCache cache = new PositionCache(1000);

        cache.get(0, fetcher);
        cache.get(1, fetcher);

        assertEquals(2, fetches.get());
    }

    @Test
    void invalidate_shouldForceRefetchEvenWithinTtl() throws Exception {
        PositionCache cache = new PositionCache(1000);

        cache.get(0, fetcher);
        cache.remove("a");
        cache.invalidate();

        assertEquals(1, cache.size());
        cache.get(1, fetcher);
        assertEquals(2, fetches.get());
        assertEquals(2, cache.size());
    }

    @Test
    void nullsFromUpstream_shouldBeDropped() throws Exception {
        upstream = Arrays.asList(pos("a"), null, pos("b"));
        PositionCache cache = new PositionCache(1000);

        assertEquals(2, cache.get(0, fetcher).size());
    }

    @Test
    void nullListFromUpstream_shouldBeEmpty() throws Exception {
        PositionCache cache = new PositionCache(1000);

        assertTrue(cache.get(0, () -> null).isEmpty());
    }

    private static Position pos(String id) {
        return Position.builder()
                .id(id).symbol("BTCUSDT").side(PositionSide.LONG)
                .qty(BigDecimal.ONE).tpPrice(new BigDecimal("110"))
                .build();
    }
}
