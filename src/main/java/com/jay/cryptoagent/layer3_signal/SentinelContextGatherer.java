package com.jay.cryptoagent.layer3_signal;

import com.jay.cryptoagent.config.AgentConfig;
import com.jay.cryptoagent.entity.SentinelRun;
import com.jay.cryptoagent.entity.TradeLog;
import com.jay.cryptoagent.layer1_data.ExchangeGateway;
import com.jay.cryptoagent.layer1_data.SentimentSources;
import com.jay.cryptoagent.layer2_analysis.TechnicalAnalysisModule;
import com.jay.cryptoagent.layer6_execution.PositionLedger;
import com.jay.cryptoagent.layer6_execution.TradeLogService;
import com.jay.cryptoagent.model.BalanceEntry;
import com.jay.cryptoagent.model.DailyTradeStats;
import com.jay.cryptoagent.model.PositionSummary;
import com.jay.cryptoagent.model.TechnicalIndicators;
import com.jay.cryptoagent.repository.SentinelRunRepository;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Layer 3 — Context Gatherer.
 * Fetches portfolio, positions, indicators, trade history, previous runs and the three sentiment
 * sources in parallel. Each part is independent: a failure or timeout yields an empty part and a
 * warning, never an exception.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SentinelContextGatherer {

    private static final long FETCH_TIMEOUT_SECONDS = 60;

    private final ExchangeGateway gateway;
    private final TechnicalAnalysisModule technicalModule;
    private final SentimentSources sources;
    private final PositionLedger ledger;
    private final TradeLogService tradeLog;
    private final SentinelRunRepository runRepository;
    private final AgentConfig config;

    private final ExecutorService executor = Executors.newFixedThreadPool(8);

    public SentinelContext gather() {
        List<String> symbols = config.trackedSymbols();
        List<String> coins = symbols.stream().map(s -> s.substring(0, s.indexOf('/'))).toList();
        AgentConfig.Sentinel sentinel = config.sentinel();

        CompletableFuture<List<BalanceEntry>> portfolio = async(this::fetchPortfolio);
        CompletableFuture<List<PositionSummary>> positions = async(ledger::getOpenPositionSummaries);
        CompletableFuture<Map<String, TechnicalIndicators>> indicators =
            async(() -> technicalModule.computeAllIndicators(symbols, sentinel.getTimeframe()));
        CompletableFuture<List<TradeLog>> trades = async(() -> tradeLog.getRecentTrades(sentinel.getRecentTrades()));
        CompletableFuture<DailyTradeStats> stats = async(tradeLog::getDailyTradeStats);
        CompletableFuture<List<SentinelRun>> runs = async(() -> runRepository
            .findAllByOrderByCreatedAtDesc(PageRequest.of(0, sentinel.getPreviousRuns())));
        CompletableFuture<List<SentimentSources.WebSearchResult>> web = async(() -> sources.searchCoins(coins));
        CompletableFuture<List<SentimentSources.RedditPost>> reddit = async(() -> sources.fetchRedditSentiment(coins));
        CompletableFuture<List<SentimentSources.CryptoNewsItem>> news = async(() -> sources.fetchCryptoNews(coins));

        return new SentinelContext(
            coins,
            await(portfolio, List.of(), "portfolio"),
            await(positions, List.of(), "positions"),
            await(indicators, Map.of(), "indicators"),
            await(trades, List.of(), "recent trades"),
            await(runs, List.of(), "previous runs"),
            await(stats, DailyTradeStats.empty(), "daily stats"),
            await(web, List.of(), "web search"),
            await(reddit, List.of(), "reddit"),
            await(news, List.of(), "news"));
    }

    /** Non-zero balances only. */
    private List<BalanceEntry> fetchPortfolio() {
        return gateway.fetchBalance().values().stream()
            .filter(b -> b.total() > 0)
            .toList();
    }

    private <T> CompletableFuture<T> async(Supplier<T> supplier) {
        return CompletableFuture.supplyAsync(supplier, executor);
    }

    private <T> T await(CompletableFuture<T> future, T fallback, String label) {
        try {
            T value = future.get(FETCH_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            return value != null ? value : fallback;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Context fetch interrupted: {}", label);
            return fallback;
        } catch (Exception e) {
            future.cancel(true);
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("Context fetch failed for {}: {}", label, cause.getMessage());
            return fallback;
        }
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdown();
    }
}
