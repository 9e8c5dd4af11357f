package com.chicu.papertradebot.trade;

import com.chicu.papertradebot.risk.TriggerHandler;
import com.chicu.papertradebot.risk.TriggerKind;
import com.chicu.papertradebot.trading.position.ClosedPosition;
import com.chicu.papertradebot.trading.position.Position;
import com.chicu.papertradebot.trading.position.PositionStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Закрывает paper-позицию по цене срабатывания TP/SL.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PaperPositionCloser implements TriggerHandler {

    private final PositionStore positionStore;

    @Override
    public void onTrigger(Position position, TriggerKind kind, BigDecimal price) {
        ClosedPosition closed = positionStore.close(position.getId(), price, kind.name())
                .orElseThrow(() -> new IllegalStateException(
                        "Position is not open anymore: " + position.getId()));

        log.info("[TRADE] EXIT {} {} via {} price={} pnl={}",
                position.getSymbol(), position.getSide(), kind, price, closed.pnl().toPlainString());
    }
}
