package com.jay.cryptoagent.model;

/** Today's trade count and volume plus realised P&L and win/loss split of positions closed today. */
public record DailyTradeStats(int tradesCount, double volume, double realizedPnl, int winners, int losers) {

    public static DailyTradeStats empty() {
        return new DailyTradeStats(0, 0, 0, 0, 0);
    }
}
