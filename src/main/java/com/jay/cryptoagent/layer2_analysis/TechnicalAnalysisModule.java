package com.jay.cryptoagent.layer2_analysis;

import com.jay.cryptoagent.config.AgentConfig;
import com.jay.cryptoagent.layer1_data.ExchangeGateway;
import com.jay.cryptoagent.model.OHLCVBar;
import com.jay.cryptoagent.model.TechnicalIndicators;
import com.jay.cryptoagent.model.enums.Trend;
import com.jay.cryptoagent.model.enums.VolumeTrend;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.ta4j.core.BarSeries;
import org.ta4j.core.BaseBarSeries;
import org.ta4j.core.indicators.SMAIndicator;
import org.ta4j.core.indicators.helpers.ClosePriceIndicator;
import org.ta4j.core.indicators.helpers.HighPriceIndicator;
import org.ta4j.core.indicators.helpers.HighestValueIndicator;
import org.ta4j.core.indicators.helpers.LowPriceIndicator;
import org.ta4j.core.indicators.helpers.LowestValueIndicator;
import org.ta4j.core.indicators.helpers.VolumeIndicator;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Layer 2 — Technical Analysis Module.
 * Computes SMA/EMA/RSI/MACD, swing support/resistance, volume trend and an overall trend vote
 * from an OHLCV series. The resulting human-readable signals are fed straight into the
 * reasoning prompts.
 *
 * Moving averages and rolling extremes come from ta4j; EMA, Wilder RSI and MACD are computed in
 * {@link IndicatorMath} because their seeding must match the simple-average convention.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TechnicalAnalysisModule {

    public static final int MIN_CANDLES = 10;
    private static final int SWING_WINDOW = 5;
    private static final int FALLBACK_LOOKBACK = 20;
    private static final double PROXIMITY_PCT = 2.0;

    private final ExchangeGateway gateway;
    private final AgentConfig config;
    private final ExecutorService executor = Executors.newFixedThreadPool(4);

    // ── Exchange-backed Entry Points ───────────────────────────────────────────

    /** Fetches candles for the symbol and analyses them. */
    public TechnicalIndicators computeIndicators(String symbol, String timeframe) {
        List<OHLCVBar> bars = gateway.fetchOhlcv(symbol, timeframe, config.sentinel().getCandleLimit());
        return analyse(symbol, timeframe, bars);
    }

    /**
     * Computes indicators for every symbol in parallel. Symbols that fail (no data, exchange
     * error, timeout) are logged and left out.
     */
    public Map<String, TechnicalIndicators> computeAllIndicators(List<String> symbols, String timeframe) {
        Map<String, CompletableFuture<TechnicalIndicators>> futures = new LinkedHashMap<>();
        for (String symbol : symbols) {
            futures.put(symbol, CompletableFuture.supplyAsync(() -> computeIndicators(symbol, timeframe), executor));
        }

        Map<String, TechnicalIndicators> results = new LinkedHashMap<>();
        futures.forEach((symbol, future) -> {
            try {
                results.put(symbol, future.get(30, TimeUnit.SECONDS));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Indicator computation interrupted for {}", symbol);
            } catch (Exception e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                log.error("Failed to compute indicators for {}: {}", symbol, cause.getMessage());
            }
        });
        return results;
    }

    // ── Pure Analysis ──────────────────────────────────────────────────────────

    public TechnicalIndicators analyse(String symbol, String timeframe, List<OHLCVBar> bars) {
        if (bars == null || bars.size() < MIN_CANDLES) {
            throw new InsufficientDataException(String.format("Not enough candle data for %s (got %d, need %d)",
                symbol, bars == null ? 0 : bars.size(), MIN_CANDLES));
        }

        BarSeries series = buildSeries(symbol, bars);
        int last = series.getEndIndex();
        int n = bars.size();

        double[] closes = new double[n];
        double[] highs = new double[n];
        double[] lows = new double[n];
        for (int i = 0; i < n; i++) {
            closes[i] = bars.get(i).getClose();
            highs[i] = bars.get(i).getHigh();
            lows[i] = bars.get(i).getLow();
        }
        double price = closes[n - 1];

        // ── Moving Averages ────────────────────────────────────────────────────
        ClosePriceIndicator close = new ClosePriceIndicator(series);
        double sma7 = sma(close, 7, last, price);
        double sma20 = sma(close, 20, last, price);
        double sma50 = sma(close, 50, last, price);
        double ema12 = IndicatorMath.ema(closes, 12);
        double ema26 = IndicatorMath.ema(closes, 26);

        // ── Momentum ───────────────────────────────────────────────────────────
        double rsi = IndicatorMath.rsi(closes, 14);
        IndicatorMath.Macd macd = IndicatorMath.macd(closes);

        // ── Support / Resistance ───────────────────────────────────────────────
        IndicatorMath.SwingLevels swings = IndicatorMath.swingLevels(highs, lows, SWING_WINDOW);
        double support = swings.swingLows().stream()
            .filter(l -> l < price)
            .mapToDouble(Double::doubleValue)
            .max()
            .orElseGet(() -> new LowestValueIndicator(new LowPriceIndicator(series), FALLBACK_LOOKBACK)
                .getValue(last).doubleValue());
        double resistance = swings.swingHighs().stream()
            .filter(h -> h > price)
            .mapToDouble(Double::doubleValue)
            .min()
            .orElseGet(() -> new HighestValueIndicator(new HighPriceIndicator(series), FALLBACK_LOOKBACK)
                .getValue(last).doubleValue());

        // ── Volume ─────────────────────────────────────────────────────────────
        VolumeTrend volumeTrend = classifyVolume(series);

        // ── Trend Vote ─────────────────────────────────────────────────────────
        Trend trend = classifyTrend(price, sma7, sma20, sma50, rsi, macd.histogram());

        // ── Signals ────────────────────────────────────────────────────────────
        List<String> signals = new ArrayList<>();
        if (rsi < 30) signals.add(String.format("RSI oversold (%.0f)", rsi));
        else if (rsi > 70) signals.add(String.format("RSI overbought (%.0f)", rsi));

        if (macd.histogram() > 0 && macd.macd() > macd.signal()) signals.add("MACD bullish crossover");
        else if (macd.histogram() < 0 && macd.macd() < macd.signal()) signals.add("MACD bearish crossover");

        if (sma7 > sma20 && sma20 > sma50) signals.add("Golden alignment SMA7>20>50");
        else if (sma7 < sma20 && sma20 < sma50) signals.add("Death alignment SMA7<20<50");

        if (price > sma7 && price > sma20) signals.add("Price above all short MAs");
        else if (price < sma7 && price < sma20) signals.add("Price below all short MAs");

        if (volumeTrend == VolumeTrend.INCREASING) signals.add("Volume increasing");
        else if (volumeTrend == VolumeTrend.DECREASING) signals.add("Volume decreasing");

        double distToSupport = (price - support) / price * 100;
        double distToResistance = (resistance - price) / price * 100;
        if (distToSupport < PROXIMITY_PCT) signals.add(String.format("Near support ($%.0f)", support));
        if (distToResistance < PROXIMITY_PCT) signals.add(String.format("Near resistance ($%.0f)", resistance));

        return new TechnicalIndicators(symbol, timeframe, price, sma7, sma20, sma50, ema12, ema26, rsi,
            macd.macd(), macd.signal(), macd.histogram(), support, resistance, volumeTrend, trend,
            List.copyOf(signals));
    }

    /**
     * Five votes: price above SMA7, SMA20, SMA50, RSI above 50, MACD histogram above zero.
     * RSI at exactly 50 or a flat histogram votes neither way.
     */
    static Trend classifyTrend(double price, double sma7, double sma20, double sma50, double rsi, double histogram) {
        int bullish = 0;
        int bearish = 0;
        if (price > sma7) bullish++; else bearish++;
        if (price > sma20) bullish++; else bearish++;
        if (price > sma50) bullish++; else bearish++;
        if (rsi > 50) bullish++; else if (rsi < 50) bearish++;
        if (histogram > 0) bullish++; else if (histogram < 0) bearish++;

        if (bullish >= 4) return Trend.BULLISH;
        if (bearish >= 4) return Trend.BEARISH;
        return Trend.NEUTRAL;
    }

    /** Mean of the last 5 volumes against the 5 before them. */
    private VolumeTrend classifyVolume(BarSeries series) {
        int last = series.getEndIndex();
        if (series.getBarCount() < 10) return VolumeTrend.STABLE;
        SMAIndicator avgVolume = new SMAIndicator(new VolumeIndicator(series), 5);
        double recent = avgVolume.getValue(last).doubleValue();
        double prior = avgVolume.getValue(last - 5).doubleValue();
        double ratio = recent / (prior == 0 ? 1 : prior);
        if (ratio > 1.2) return VolumeTrend.INCREASING;
        if (ratio < 0.8) return VolumeTrend.DECREASING;
        return VolumeTrend.STABLE;
    }

    /** SMA over the last {@code period} closes, or the last close when the series is shorter. */
    private double sma(ClosePriceIndicator close, int period, int last, double fallback) {
        if (last + 1 < period) return fallback;
        return new SMAIndicator(close, period).getValue(last).doubleValue();
    }

    private BarSeries buildSeries(String symbol, List<OHLCVBar> bars) {
        BarSeries series = new BaseBarSeries(symbol);
        ZonedDateTime previous = null;
        for (OHLCVBar bar : bars) {
            Instant ts = bar.getTimestamp() != null ? bar.getTimestamp() : Instant.EPOCH;
            ZonedDateTime end = ts.atZone(ZoneOffset.UTC);
            // ta4j requires strictly increasing bar end times
            if (previous != null && !end.isAfter(previous)) {
                end = previous.plus(Duration.ofMinutes(1));
            }
            series.addBar(end, bar.getOpen(), bar.getHigh(), bar.getLow(), bar.getClose(), bar.getVolume());
            previous = end;
        }
        return series;
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdown();
    }
}
