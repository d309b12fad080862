package com.jay.cryptoagent.model;

import com.jay.cryptoagent.entity.Position;
import com.jay.cryptoagent.model.enums.PositionSide;

import java.time.LocalDateTime;

/**
 * Open position joined with its live price. Live fields are null when no price was available.
 */
public record PositionSummary(
    String id,
    String symbol,
    String side,
    double entryPrice,
    double amount,
    double costBasis,
    Double stopLoss,
    Double takeProfit,
    Double trailingStopPct,
    Double highWaterMark,
    String status,
    String entryTradeId,
    LocalDateTime createdAt,
    Double currentPrice,
    Double unrealizedPnl,
    Double unrealizedPnlPct,
    Double distanceToSlPct,
    Double distanceToTpPct
) {
    public static PositionSummary of(Position p, Double currentPrice) {
        Double pnl = null, pnlPct = null, toSl = null, toTp = null;
        if (currentPrice != null && currentPrice > 0) {
            pnl = p.getSide() == PositionSide.LONG
                ? (currentPrice - p.getEntryPrice()) * p.getAmount()
                : (p.getEntryPrice() - currentPrice) * p.getAmount();
            pnlPct = p.getCostBasis() > 0 ? pnl / p.getCostBasis() * 100 : null;
            if (p.getStopLoss() != null) toSl = (currentPrice - p.getStopLoss()) / currentPrice * 100;
            if (p.getTakeProfit() != null) toTp = (p.getTakeProfit() - currentPrice) / currentPrice * 100;
        }
        return new PositionSummary(p.getId(), p.getSymbol(), p.getSide().name().toLowerCase(),
            p.getEntryPrice(), p.getAmount(), p.getCostBasis(), p.getStopLoss(), p.getTakeProfit(),
            p.getTrailingStopPct(), p.getHighWaterMark(), p.getStatus().label(), p.getEntryTradeId(),
            p.getCreatedAt(), currentPrice, pnl, pnlPct, toSl, toTp);
    }
}
