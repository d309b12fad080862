package com.jay.cryptoagent.layer3_signal;

import com.jay.cryptoagent.entity.SentinelRun;
import com.jay.cryptoagent.entity.TradeLog;
import com.jay.cryptoagent.layer1_data.SentimentSources.CryptoNewsItem;
import com.jay.cryptoagent.layer1_data.SentimentSources.RedditPost;
import com.jay.cryptoagent.layer1_data.SentimentSources.WebSearchResult;
import com.jay.cryptoagent.model.BalanceEntry;
import com.jay.cryptoagent.model.DailyTradeStats;
import com.jay.cryptoagent.model.PositionSummary;
import com.jay.cryptoagent.model.TechnicalIndicators;

import java.util.List;
import java.util.Map;

/**
 * Everything the Sentinel (and the CEO briefing) knows at the start of a run. Every part is
 * fetched independently; a failed fetch leaves its part empty.
 */
public record SentinelContext(
    List<String> coins,
    List<BalanceEntry> portfolio,
    List<PositionSummary> positions,
    Map<String, TechnicalIndicators> indicators,
    List<TradeLog> recentTrades,
    List<SentinelRun> previousRuns,
    DailyTradeStats dailyStats,
    List<WebSearchResult> webResults,
    List<RedditPost> reddit,
    List<CryptoNewsItem> news
) {
    /** No holdings and no indicators: not enough to reason about. */
    public boolean isDegraded() {
        return portfolio.isEmpty() && indicators.isEmpty();
    }
}
