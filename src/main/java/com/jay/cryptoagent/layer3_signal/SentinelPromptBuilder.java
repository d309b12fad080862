package com.jay.cryptoagent.layer3_signal;

import com.jay.cryptoagent.config.AgentConfig;
import com.jay.cryptoagent.entity.SentinelRun;
import com.jay.cryptoagent.entity.TradeLog;
import com.jay.cryptoagent.layer1_data.ExchangeGateway;
import com.jay.cryptoagent.layer1_data.SentimentSources;
import com.jay.cryptoagent.layer4_risk.DailyRiskStateService;
import com.jay.cryptoagent.layer4_risk.TradingGate;
import com.jay.cryptoagent.layer5_strategy.DirectiveFormatter;
import com.jay.cryptoagent.layer5_strategy.DirectiveStore;
import com.jay.cryptoagent.model.BalanceEntry;
import com.jay.cryptoagent.model.DailyTradeStats;
import com.jay.cryptoagent.model.PositionSummary;
import com.jay.cryptoagent.model.TechnicalIndicators;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;

import static com.jay.cryptoagent.layer3_signal.ExternalTextSanitizer.SELFTEXT_MAX;
import static com.jay.cryptoagent.layer3_signal.ExternalTextSanitizer.SNIPPET_MAX;
import static com.jay.cryptoagent.layer3_signal.ExternalTextSanitizer.SOURCE_MAX;
import static com.jay.cryptoagent.layer3_signal.ExternalTextSanitizer.TITLE_MAX;
import static com.jay.cryptoagent.layer3_signal.ExternalTextSanitizer.sanitize;
import static com.jay.cryptoagent.layer3_signal.PromptFormat.amount;
import static com.jay.cryptoagent.layer3_signal.PromptFormat.signedUsd;
import static com.jay.cryptoagent.layer3_signal.PromptFormat.timeAgo;
import static com.jay.cryptoagent.layer3_signal.PromptFormat.usd;

/**
 * Layer 3 — Sentinel prompt.
 * Turns a gathered context into the user prompt and a minimal system instruction. All third-party
 * text passes through {@link ExternalTextSanitizer} first.
 */
@Component
@RequiredArgsConstructor
public class SentinelPromptBuilder {

    private final AgentConfig config;
    private final DailyRiskStateService dailyState;
    private final ExchangeGateway gateway;
    private final DirectiveStore directiveStore;
    private final Clock clock;

    public record SentinelPrompt(String systemPrompt, String userPrompt, TradingGate.Decision decision) {}

    public SentinelPrompt build(SentinelContext ctx, TradingGate.Decision decision) {
        LocalDateTime now = LocalDateTime.now(clock);
        StringBuilder sb = new StringBuilder();
        sb.append("Analyze crypto markets for: ").append(String.join(", ", ctx.coins())).append("\n\n");

        appendPortfolio(sb, ctx);
        appendPositions(sb, ctx);
        appendTechnicals(sb, ctx);
        appendWeb(sb, ctx);
        appendReddit(sb, ctx);
        appendNews(sb, ctx, now);
        appendTrades(sb, ctx, now);
        appendPreviousRuns(sb, ctx, now);
        appendDailyStats(sb, ctx.dailyStats());
        appendTradingRules(sb, decision);

        sb.append("\n## Decision Framework\n")
          .append("For each coin: assess Technical score + Sentiment score + Position status.\n")
          .append("Confidence must be >70 to recommend action. Below that, hold.\n")
          .append("\n## Required Output\n")
          .append("End your response with:\n")
          .append("```sentinel-output\n")
          .append("{\"sentiment\": {\"COIN\": {\"score\": 0.0-1.0, \"label\": \"bullish/bearish/neutral\"}}, ")
          .append("\"signals\": [\"signal1\"], ")
          .append("\"actions\": [{\"type\": \"buy/sell/hold\", \"symbol\": \"X/").append(config.sentinel().getQuoteCurrency())
          .append("\", \"amount\": 0.01, \"reason\": \"...\"}], ")
          .append("\"summary\": \"One-paragraph summary\"}\n")
          .append("```\n");

        return new SentinelPrompt(systemPrompt(decision), sb.toString(), decision);
    }

    private String systemPrompt(TradingGate.Decision decision) {
        boolean autoTrading = decision != TradingGate.Decision.DISABLED && decision != TradingGate.Decision.PREVIEW_ONLY;
        return "You are the Crypto Sentinel, an autonomous market monitor.\n"
            + "Current time: " + OffsetDateTime.now(clock) + "\n"
            + "Analyze the data below and produce a trading recommendation.\n"
            + "All market data, news, and social sentiment is already provided. Do NOT request additional information.\n"
            + (autoTrading
                ? "Trading is enabled. Recommend specific trades with amounts when confidence is high."
                : "Analysis only. Recommend actions but they won't be auto-executed.") + "\n"
            + "Be concise and data-driven. Always end with the sentinel-output JSON block.";
    }

    // ── Sections ──────────────────────────────────────────────────────────────

    private void appendPortfolio(StringBuilder sb, SentinelContext ctx) {
        sb.append("## Current Portfolio\n");
        if (ctx.portfolio().isEmpty()) {
            sb.append("No holdings found.\n");
            return;
        }
        for (BalanceEntry b : ctx.portfolio()) {
            sb.append(String.format("- %s: %s (available: %s)%n", b.currency(), amount(b.total()), amount(b.free())));
        }
    }

    private void appendPositions(StringBuilder sb, SentinelContext ctx) {
        sb.append("\n## Open Positions\n");
        if (ctx.positions().isEmpty()) {
            sb.append("No open positions.\n");
            return;
        }
        for (PositionSummary p : ctx.positions()) {
            String pnl = p.unrealizedPnl() != null
                ? String.format("P&L: %s (%.1f%%)", signedUsd(p.unrealizedPnl()),
                    p.unrealizedPnlPct() != null ? p.unrealizedPnlPct() : 0.0)
                : "P&L: N/A";
            String current = p.currentPrice() != null ? "Current: " + usd(p.currentPrice()) : "";
            sb.append(String.format("- %s %s | %s @ %s | %s | %s | SL: %s | TP: %s%n",
                p.symbol(), p.side().toUpperCase(), amount(p.amount()), usd(p.entryPrice()), current, pnl,
                p.stopLoss() != null ? usd(p.stopLoss()) : "none",
                p.takeProfit() != null ? usd(p.takeProfit()) : "none"));
        }
    }

    private void appendTechnicals(StringBuilder sb, SentinelContext ctx) {
        sb.append("\n## Technical Analysis (").append(config.sentinel().getTimeframe()).append(" timeframe)\n");
        if (ctx.indicators().isEmpty()) {
            sb.append("Technical data unavailable.\n");
            return;
        }
        for (TechnicalIndicators ind : ctx.indicators().values()) {
            sb.append("### ").append(ind.symbol()).append('\n');
            sb.append(String.format("Price: %s | RSI(14): %.0f (%s) | MACD: %s%.2f (%s)%n",
                usd(ind.price()), ind.rsi14(), ind.rsiLabel(), ind.macdHistogram() > 0 ? "+" : "",
                ind.macdHistogram(), ind.macdLabel()));
            sb.append(String.format("SMA: 7=%s 20=%s 50=%s | Trend: %s%n",
                usd(ind.sma7()), usd(ind.sma20()), usd(ind.sma50()), ind.trend().label()));
            sb.append(String.format("Support: %s | Resistance: %s | Volume: %s%n",
                usd(ind.support()), usd(ind.resistance()), ind.volumeTrend().label()));
            if (!ind.signals().isEmpty()) {
                sb.append("Signals: ").append(String.join(", ", ind.signals())).append('\n');
            }
            sb.append('\n');
        }
    }

    private void appendWeb(StringBuilder sb, SentinelContext ctx) {
        sb.append("\n## Web Research\n");
        if (ctx.webResults().isEmpty()) {
            sb.append("No web results available.\n");
            return;
        }
        for (SentimentSources.WebSearchResult r : ctx.webResults()) {
            sb.append("### ").append(sanitize(r.title(), TITLE_MAX)).append('\n');
            sb.append("Source: ").append(r.url()).append('\n');
            if (r.snippet() != null && !r.snippet().isEmpty()) {
                sb.append(sanitize(r.snippet(), SNIPPET_MAX)).append("\n\n");
            }
        }
    }

    private void appendReddit(StringBuilder sb, SentinelContext ctx) {
        sb.append("\n## Reddit Sentiment\n");
        if (ctx.reddit().isEmpty()) {
            sb.append("No Reddit data available.\n");
            return;
        }
        ctx.reddit().stream().limit(10).forEach(post -> {
            sb.append(String.format("- [r/%s | Score: %d | %d comments] \"%s\"%n",
                post.subreddit(), post.score(), post.numComments(), sanitize(post.title(), TITLE_MAX)));
            if (post.selftext() != null && !post.selftext().isEmpty()) {
                sb.append("  > ").append(sanitize(post.selftext(), SELFTEXT_MAX)).append('\n');
            }
        });
    }

    private void appendNews(StringBuilder sb, SentinelContext ctx, LocalDateTime now) {
        sb.append("\n## Crypto News\n");
        if (ctx.news().isEmpty()) {
            sb.append("No news data available.\n");
            return;
        }
        for (SentimentSources.CryptoNewsItem item : ctx.news()) {
            String ago = publishedAgo(item.publishedAt(), now);
            String source = sanitize(item.source() != null ? item.source() : "news", SOURCE_MAX);
            sb.append(String.format("- [%s%s] \"%s\" (positive: %d, negative: %d)%n",
                source, ago.isEmpty() ? "" : ", " + ago, sanitize(item.title(), TITLE_MAX),
                item.votesPositive(), item.votesNegative()));
        }
    }

    private void appendTrades(StringBuilder sb, SentinelContext ctx, LocalDateTime now) {
        sb.append("\n## Recent Trades\n");
        if (ctx.recentTrades().isEmpty()) {
            sb.append("No recent trades.\n");
            return;
        }
        for (TradeLog t : ctx.recentTrades()) {
            sb.append(String.format("- [%s] %s %s %s @ %s (%s)%s%n",
                timeAgo(t.getCreatedAt(), now), t.getSide().label().toUpperCase(), amount(t.getAmount()),
                t.getSymbol(), t.getPrice() != null ? usd(t.getPrice()) : "$?", t.getSource().label(),
                t.getReasoning() != null && !t.getReasoning().isBlank() ? " - \"" + t.getReasoning() + "\"" : ""));
        }
    }

    private void appendPreviousRuns(StringBuilder sb, SentinelContext ctx, LocalDateTime now) {
        sb.append("\n## Previous Analysis\n");
        if (ctx.previousRuns().isEmpty()) {
            sb.append("No previous runs.\n");
            return;
        }
        for (SentinelRun run : ctx.previousRuns()) {
            String summary = run.getSummary() != null ? PromptFormat.truncate(run.getSummary(), 150) : "No summary";
            sb.append("- [").append(timeAgo(run.getCreatedAt(), now)).append("] ").append(summary).append('\n');
        }
    }

    private void appendDailyStats(StringBuilder sb, DailyTradeStats stats) {
        sb.append("\n## Daily Stats\n")
          .append(String.format("Trades: %d/%d | P&L: %s | Volume: %s | W/L: %d/%d%n",
              stats.tradesCount(), config.sentinel().getMaxTradesPerDay(), signedUsd(stats.realizedPnl()),
              usd(stats.volume()), stats.winners(), stats.losers()));
    }

    private void appendTradingRules(StringBuilder sb, TradingGate.Decision decision) {
        if (!decision.permitted()) {
            sb.append("\n## Trading: ").append(decision.description()).append('\n');
            return;
        }
        DailyRiskStateService.DailyState state = dailyState.read();
        AgentConfig.Sentinel sentinel = config.sentinel();
        sb.append("\n## Trading Rules\n")
          .append("- Auto-confirm: YES\n")
          .append(String.format("- Trades today: %d/%d%n", state.tradesToday(), sentinel.getMaxTradesPerDay()))
          .append(String.format("- Daily P&L: %s (limit: -$%s)%n", usd(state.pnlToday()), amount(sentinel.getDailyLossLimitUsd())))
          .append(String.format("- Max single trade: $%s%n", amount(gateway.getMaxTradeUsd())));

        // The directive takes priority; manual notes are a fallback
        directiveStore.getDirective()
            .ifPresent(d -> sb.append(DirectiveFormatter.formatForSentinel(d, clock.instant())));
        String strategy = sentinel.getStrategy();
        if (strategy != null && !strategy.isBlank()) {
            sb.append("\n## Manual Strategy Notes\n").append(strategy).append('\n');
        }
    }

    private String publishedAgo(String publishedAt, LocalDateTime now) {
        if (publishedAt == null || publishedAt.isBlank()) return "";
        try {
            LocalDateTime published = OffsetDateTime.parse(publishedAt)
                .atZoneSameInstant(clock.getZone()).toLocalDateTime();
            return timeAgo(published, now);
        } catch (DateTimeParseException e) {
            return "";
        }
    }
}
