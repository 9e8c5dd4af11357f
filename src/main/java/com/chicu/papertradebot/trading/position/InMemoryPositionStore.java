package com.chicu.papertradebot.trading.position;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Paper-хранилище: позиции живут в памяти, порядок открытия сохраняется.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class InMemoryPositionStore implements PositionStore {

    private final Clock clock;

    private final Map<String, Position> open = new LinkedHashMap<>();
    private final List<ClosedPosition> closed = new CopyOnWriteArrayList<>();

    @Override
    public synchronized List<Position> findOpen() {
        return new ArrayList<>(open.values());
    }

    @Override
    public synchronized Optional<Position> findOpenById(String id) {
        return Optional.ofNullable(id == null ? null : open.get(id));
    }

    @Override
    public synchronized Position open(Position position) {
        if (open.containsKey(position.getId())) {
            throw new IllegalStateException("Position already open: " + position.getId());
        }
        open.put(position.getId(), position);
        log.info("[POSITION] OPEN id={} {} {} qty={} entry={} tp={} sl={}",
                position.getId(), position.getSymbol(), position.getSide(),
                position.getEffectiveQty().orElse(null),
                position.getEntryPrice().orElse(null),
                position.getTpPrice().orElse(null),
                position.getSlPrice().orElse(null));
        return position;
    }

    @Override
    public synchronized Optional<ClosedPosition> close(String id, BigDecimal exitPrice, String reason) {
        if (exitPrice == null || exitPrice.signum() <= 0) {
            throw new IllegalArgumentException("exitPrice must be > 0");
        }

        Position p = id == null ? null : open.remove(id);
        if (p == null) {
            return Optional.empty();
        }

        BigDecimal qty = p.getEffectiveQty().orElse(BigDecimal.ZERO);
        BigDecimal pnl = p.getEntryPrice()
                .map(entry -> pnlOf(p.getSide(), entry, exitPrice, qty))
                .orElse(BigDecimal.ZERO);

        ClosedPosition result = ClosedPosition.builder()
                .position(p)
                .exitPrice(exitPrice)
                .qty(qty)
                .pnl(pnl)
                .reason(reason)
                .closedAt(Instant.now(clock))
                .build();

        closed.add(result);

        log.info("[POSITION] CLOSE id={} {} {} qty={} exit={} pnl={} reason={}",
                id, p.getSymbol(), p.getSide(), qty, exitPrice, pnl.toPlainString(), reason);

        return Optional.of(result);
    }

    @Override
    public List<ClosedPosition> findClosed() {
        return List.copyOf(closed);
    }

    static BigDecimal pnlOf(PositionSide side, BigDecimal entry, BigDecimal exit, BigDecimal qty) {
        BigDecimal diff = side == PositionSide.LONG
                ? exit.subtract(entry)
                : entry.subtract(exit);
        return diff.multiply(qty);
    }
}
