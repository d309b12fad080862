package com.jay.cryptoagent.layer5_strategy;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jay.cryptoagent.config.AgentConfig;
import com.jay.cryptoagent.entity.SentinelRun;
import com.jay.cryptoagent.layer1_data.ExchangeGateway;
import com.jay.cryptoagent.layer1_data.SentimentSources;
import com.jay.cryptoagent.layer3_signal.SentinelContext;
import com.jay.cryptoagent.layer4_risk.DailyRiskStateService;
import com.jay.cryptoagent.model.BalanceEntry;
import com.jay.cryptoagent.model.CeoDirective;
import com.jay.cryptoagent.model.DailyTradeStats;
import com.jay.cryptoagent.model.PositionSummary;
import com.jay.cryptoagent.model.TechnicalIndicators;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;

import static com.jay.cryptoagent.layer3_signal.PromptFormat.amount;

/**
 * Layer 5 — CEO prompt.
 * Compact markdown tables instead of the Sentinel's prose sections; headlines are titles only.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CeoPromptBuilder {

    private static final int MAX_HEADLINES = 12;

    private final AgentConfig config;
    private final DailyRiskStateService dailyState;
    private final ExchangeGateway gateway;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public record CeoPrompt(String systemPrompt, String userPrompt) {}

    public CeoPrompt build(CeoContext ctx) {
        SentinelContext base = ctx.base();
        StringBuilder sb = new StringBuilder();
        sb.append("Generate a strategic directive for the next 24 hours.\n")
          .append("Coins to cover: ").append(String.join(", ", base.coins())).append("\n\n");

        appendPortfolio(sb, base.portfolio());
        sb.append('\n');
        appendPositions(sb, base.positions());
        sb.append('\n');
        appendTechnicals(sb, base);
        sb.append('\n');
        appendHeadlines(sb, base);
        sb.append('\n');
        appendPerformance(sb, ctx.runsLast24h(), base.dailyStats());
        sb.append('\n');
        appendCurrentDirective(sb, ctx.currentDirective());
        sb.append('\n');
        appendCompliance(sb, ctx);
        sb.append('\n');
        appendRiskLimits(sb);
        sb.append('\n');
        appendOutputFormat(sb);

        return new CeoPrompt(systemPrompt(), sb.toString());
    }

    private String systemPrompt() {
        return "You are the Chief Investment Officer for an autonomous crypto trading system.\n"
            + "Current time: " + OffsetDateTime.now(clock) + "\n\n"
            + "Your employee is the \"Sentinel\", a tactical model that runs every 30 minutes to make trading decisions. "
            + "It is good at following instructions but cannot reason strategically. Your job:\n"
            + "1. Review the market data, technical indicators, and sentiment\n"
            + "2. Assess the Sentinel's recent performance\n"
            + "3. Issue a structured directive that guides the next 24 hours of trading\n\n"
            + "Be specific. Use exact price levels. The Sentinel will follow your guidance literally.\n"
            + "Your directive replaces the previous one entirely.\n\n"
            + "CRITICAL: End your response with a ```ceo-directive JSON block. Without it, the directive cannot be parsed.";
    }

    // ── Sections ──────────────────────────────────────────────────────────────

    private void appendPortfolio(StringBuilder sb, List<BalanceEntry> portfolio) {
        sb.append("## Portfolio\n");
        if (portfolio.isEmpty()) {
            sb.append("No holdings.\n");
            return;
        }
        sb.append("| Asset | Amount | Free |\n|---|---|---|\n");
        for (BalanceEntry b : portfolio) {
            sb.append(String.format("| %s | %s | %s |%n", b.currency(), amount(b.total()), amount(b.free())));
        }
    }

    private void appendPositions(StringBuilder sb, List<PositionSummary> positions) {
        sb.append("## Open Positions\n");
        if (positions.isEmpty()) {
            sb.append("None.\n");
            return;
        }
        sb.append("| Symbol | Side | Entry | Current | P&L | SL | TP |\n|---|---|---|---|---|---|---|\n");
        for (PositionSummary p : positions) {
            String pnl = p.unrealizedPnl() != null
                ? String.format("%s$%.2f", p.unrealizedPnl() >= 0 ? "+" : "-", Math.abs(p.unrealizedPnl()))
                : "n/a";
            sb.append(String.format("| %s | %s | $%s | $%s | %s | $%s | $%s |%n",
                p.symbol(), p.side(), amount(p.entryPrice()),
                p.currentPrice() != null ? amount(p.currentPrice()) : "?", pnl,
                p.stopLoss() != null ? amount(p.stopLoss()) : "none",
                p.takeProfit() != null ? amount(p.takeProfit()) : "none"));
        }
    }

    private void appendTechnicals(StringBuilder sb, SentinelContext base) {
        sb.append("## Technical Summary\n");
        if (base.indicators().isEmpty()) {
            sb.append("No TA data available.\n");
            return;
        }
        sb.append("| Coin | Price | RSI | MACD Hist | Trend | Support | Resistance |\n|---|---|---|---|---|---|---|\n");
        for (TechnicalIndicators ta : base.indicators().values()) {
            sb.append(String.format("| %s | $%.2f | %.1f | %.2f | %s | $%.0f | $%.0f |%n",
                ta.coin(), ta.price(), ta.rsi14(), ta.macdHistogram(), ta.trend().label(), ta.support(), ta.resistance()));
        }
        for (TechnicalIndicators ta : base.indicators().values()) {
            if (!ta.signals().isEmpty()) {
                sb.append(ta.coin()).append(" signals: ").append(String.join(", ", ta.signals())).append('\n');
            }
        }
    }

    private void appendHeadlines(StringBuilder sb, SentinelContext base) {
        sb.append("## Market Headlines\n");
        List<String> headlines = new ArrayList<>();
        base.webResults().stream().limit(5)
            .filter(w -> w.title() != null && !w.title().isBlank())
            .forEach(w -> headlines.add("[web] " + w.title()));
        for (SentimentSources.RedditPost r : base.reddit().stream().limit(5).toList()) {
            headlines.add(String.format("[r/%s] %s (score: %d)", r.subreddit(), r.title(), r.score()));
        }
        for (SentimentSources.CryptoNewsItem n : base.news().stream().limit(5).toList()) {
            headlines.add(String.format("[%s] %s +%d/-%d", n.source() != null ? n.source() : "news", n.title(),
                n.votesPositive(), n.votesNegative()));
        }
        if (headlines.isEmpty()) {
            sb.append("No headlines available.\n");
        } else {
            sb.append(String.join("\n", headlines.stream().limit(MAX_HEADLINES).toList())).append('\n');
        }
    }

    private void appendPerformance(StringBuilder sb, List<SentinelRun> runs, DailyTradeStats stats) {
        sb.append("## Sentinel Performance (24h)\n");
        List<String> actionsTaken = new ArrayList<>();
        for (SentinelRun run : runs.stream().limit(5).toList()) {
            if (run.getActionsJson() == null) continue;
            try {
                for (JsonNode action : objectMapper.readTree(run.getActionsJson())) {
                    String type = action.path("type").asText("hold");
                    if (!"hold".equalsIgnoreCase(type)) {
                        actionsTaken.add(type + " " + action.path("symbol").asText("?"));
                    }
                }
            } catch (JsonProcessingException e) {
                log.debug("Skipping unreadable actions of run {}: {}", run.getId(), e.getOriginalMessage());
            }
        }
        sb.append(String.format("Runs: %d | Trades today: %d | P&L: $%.2f | W/L: %d/%d%n",
            runs.size(), stats.tradesCount(), stats.realizedPnl(), stats.winners(), stats.losers()));
        if (!actionsTaken.isEmpty()) {
            sb.append("Recent actions: ").append(String.join(", ", actionsTaken.stream().limit(8).toList())).append('\n');
        }
        if (!runs.isEmpty() && runs.get(0).getSummary() != null) {
            String summary = runs.get(0).getSummary();
            sb.append("Last analysis: \"")
              .append(summary.length() > 200 ? summary.substring(0, 200) + "..." : summary)
              .append("\"\n");
        }
    }

    private void appendCurrentDirective(StringBuilder sb, CeoDirective d) {
        sb.append("## Current Directive\n");
        if (d == null) {
            sb.append("None (first briefing).\n");
            return;
        }
        if (d.isExpired(clock.instant())) sb.append("(EXPIRED)\n");
        sb.append(String.format("Regime: %s | Bias: %s | Risk: %d/10%n",
            d.getMarketRegime().label(), d.getOverallBias(), d.getRiskLevel()));
        sb.append("Set: ").append(d.getGeneratedAt()).append('\n');
        sb.append("Summary: ").append(d.getSummary()).append('\n');
    }

    private void appendCompliance(StringBuilder sb, CeoContext ctx) {
        sb.append("## Directive Compliance\n");
        if (ctx.currentDirective() == null || ctx.performance() == null) {
            sb.append("No prior directive to evaluate.\n");
            return;
        }
        sb.append(String.format("Trades since directive: %d | P&L: $%.2f%n",
            ctx.performance().tradesSince(), ctx.performance().pnlSince()));
    }

    private void appendRiskLimits(StringBuilder sb) {
        DailyRiskStateService.DailyState state = dailyState.read();
        AgentConfig.Sentinel sentinel = config.sentinel();
        sb.append("## Risk Limits\n")
          .append(String.format("Max trade: $%s | Daily loss limit: $%s | Trades today: %d/%d | P&L today: $%.2f%n",
              amount(gateway.getMaxTradeUsd()), amount(sentinel.getDailyLossLimitUsd()),
              state.tradesToday(), sentinel.getMaxTradesPerDay(), state.pnlToday()));
    }

    private void appendOutputFormat(StringBuilder sb) {
        sb.append("## Required Output\n")
          .append("End your response with a ```ceo-directive JSON block containing:\n")
          .append("{\n")
          .append("  \"marketRegime\": \"risk-on\" | \"risk-off\" | \"neutral\" | \"volatile\",\n")
          .append("  \"overallBias\": \"bullish\" | \"bearish\" | \"neutral\",\n")
          .append("  \"riskLevel\": 1-10,\n")
          .append("  \"coins\": { \"BTC\": { \"bias\": \"bullish\", \"action\": \"accumulate below $X\", \"maxPositionPct\": 40, \"notes\": \"...\" }, ... },\n")
          .append("  \"keyLevels\": { \"BTC/USD\": { \"buyZone\": [low, high], \"sellZone\": [low, high] }, ... },\n")
          .append("  \"riskGuidelines\": \"free-text risk rules for the Sentinel to follow\",\n")
          .append("  \"avoid\": [\"DOGE\", ...],\n")
          .append("  \"escalationTriggers\": [\"BTC drops below $X\", ...],\n")
          .append("  \"summary\": \"One-paragraph strategic summary\"\n")
          .append("}\n");
    }
}
