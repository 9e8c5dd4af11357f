package com.chicu.papertradebot.risk;

import com.chicu.papertradebot.trading.position.Position;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class LoggingRiskWatcherListener implements RiskWatcherListener {

    @Override
    public void onTriggered(TriggerEvent event) {
        Position p = event.position();
        log.info("[RISK] {} hit id={} {} {} price={}",
                event.kind(), p.getId(), p.getSymbol(), p.getSide(), event.price().toPlainString());
    }

    @Override
    public void onTriggerFailed(TriggerEvent event, Exception error) {
        Position p = event.position();
        log.error("[RISK] failed to close {} {} via {} id={}: {}",
                p.getSymbol(), p.getSide(), event.kind(), p.getId(), error.getMessage(), error);
    }

    @Override
    public void onPassFailed(Exception error) {
        log.error("[RISK] evaluation failed: {}", error.getMessage(), error);
    }
}
