package com.chicu.papertradebot.trade;

import com.chicu.papertradebot.config.SymbolFiltersProperties;
import com.chicu.papertradebot.market.MarketPriceService;
import com.chicu.papertradebot.market.guard.QuantityResult;
import com.chicu.papertradebot.market.guard.QuantitySizer;
import com.chicu.papertradebot.trading.position.Position;
import com.chicu.papertradebot.trading.position.PositionSide;
import com.chicu.papertradebot.trading.position.PositionStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

/**
 * Открытие paper-позиций по текущей рыночной цене.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PaperTradeService {

    private static final int QTY_SCALE = 8;
    private static final int PRICE_SCALE = 8;

    private final MarketPriceService marketPriceService;
    private final QuantitySizer quantitySizer;
    private final SymbolFiltersProperties symbolFilters;
    private final PositionStore positionStore;
    private final Clock clock;

    public Position open(OpenPositionCommand cmd) {
        if (cmd == null) {
            throw new PaperTradeException(PaperTradeException.Code.BAD_REQUEST, "Request is required");
        }

        String symbol = cmd.symbol() == null ? "" : cmd.symbol().trim().toUpperCase();
        if (symbol.isEmpty()) {
            throw new PaperTradeException(PaperTradeException.Code.BAD_REQUEST, "Symbol is required");
        }

        // всё, что не SHORT — LONG
        PositionSide side = PositionSide.parse(cmd.side())
                .filter(s -> s == PositionSide.SHORT)
                .orElse(PositionSide.LONG);

        TradeMode mode = cmd.mode() != null ? cmd.mode() : TradeMode.QTY;

        BigDecimal entryPrice = marketPriceService.getLastPrice(symbol)
                .filter(p -> p.signum() > 0)
                .orElseThrow(() -> new PaperTradeException(
                        PaperTradeException.Code.NO_MARKET_PRICE,
                        "No market price available for the selected symbol"));

        BigDecimal qty;
        if (mode == TradeMode.USDT) {
            if (!isPositive(cmd.usdtAmount())) {
                throw new PaperTradeException(
                        PaperTradeException.Code.BAD_REQUEST, "USDT amount must be greater than zero");
            }
            // QuantityValidationException летит наверх как есть
            QuantityResult sized = quantitySizer.calculateQuantity(
                    cmd.usdtAmount(), entryPrice, symbolFilters.filtersFor(symbol));
            qty = sized.quantity();
        } else {
            if (!isPositive(cmd.qty())) {
                throw new PaperTradeException(
                        PaperTradeException.Code.BAD_REQUEST, "Quantity must be greater than zero");
            }
            qty = cmd.qty().setScale(QTY_SCALE, RoundingMode.DOWN);
            if (qty.signum() <= 0) {
                throw new PaperTradeException(
                        PaperTradeException.Code.BAD_REQUEST, "Quantity must be greater than zero");
            }
        }

        Position position = Position.builder()
                .id(UUID.randomUUID().toString())
                .symbol(symbol)
                .side(side)
                .qty(qty)
                .sizeUsd(qty.multiply(entryPrice).setScale(QTY_SCALE, RoundingMode.DOWN))
                .entryPrice(entryPrice)
                .tpPrice(positiveOrNull(cmd.tpPrice()))
                .slPrice(positiveOrNull(cmd.slPrice()))
                .openedAt(Instant.now(clock))
                .build();

        log.info("[TRADE] OPEN {} {} mode={} qty={} entry={}", symbol, side, mode, qty, entryPrice);
        return positionStore.open(position);
    }

    private static boolean isPositive(BigDecimal v) {
        return v != null && v.signum() > 0;
    }

    private static BigDecimal positiveOrNull(BigDecimal v) {
        return isPositive(v) ? v.setScale(PRICE_SCALE, RoundingMode.DOWN) : null;
    }
}
