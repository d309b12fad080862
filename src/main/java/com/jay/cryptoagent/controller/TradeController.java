package com.jay.cryptoagent.controller;

import com.jay.cryptoagent.layer6_execution.ManualTradeService;
import com.jay.cryptoagent.layer6_execution.TradeExecutor;
import com.jay.cryptoagent.model.BalanceEntry;
import com.jay.cryptoagent.model.MarketInfo;
import com.jay.cryptoagent.model.OHLCVBar;
import com.jay.cryptoagent.model.OrderResult;
import com.jay.cryptoagent.model.PositionSummary;
import com.jay.cryptoagent.model.Ticker;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST API — Manual trading.
 *
 * Endpoints:
 *   GET    /api/trade/price?symbol=BTC/USD         — Ticker
 *   GET    /api/trade/portfolio                    — Non-zero balances
 *   POST   /api/trade/preview                      — Validate and price an order
 *   POST   /api/trade/confirm                      — Place a previewed order
 *   GET    /api/trade/orders/{id}?symbol=          — Order status
 *   DELETE /api/trade/orders/{id}?symbol=          — Cancel order
 *   GET    /api/trade/history?symbol=&timeframe=&limit=  — Candles
 *   GET    /api/trade/market?symbol=               — Market limits
 *   GET    /api/trade/positions                    — Open positions
 */
@RestController
@RequestMapping("/api/trade")
@RequiredArgsConstructor
public class TradeController {

    private final ManualTradeService trades;

    @GetMapping("/price")
    public ResponseEntity<Ticker> price(@RequestParam String symbol) {
        return ResponseEntity.ok(trades.getPrice(symbol));
    }

    @GetMapping("/portfolio")
    public ResponseEntity<List<BalanceEntry>> portfolio() {
        return ResponseEntity.ok(trades.getPortfolio());
    }

    @PostMapping("/preview")
    public ResponseEntity<ManualTradeService.OrderPreview> preview(@RequestBody ManualTradeService.OrderRequest request) {
        return ResponseEntity.ok(trades.preview(request));
    }

    @PostMapping("/confirm")
    public ResponseEntity<TradeExecutor.Execution> confirm(@RequestBody ManualTradeService.OrderRequest request) {
        return ResponseEntity.ok(trades.confirm(request));
    }

    @GetMapping("/orders/{orderId}")
    public ResponseEntity<OrderResult> orderStatus(@PathVariable String orderId, @RequestParam String symbol) {
        return ResponseEntity.ok(trades.getOrderStatus(orderId, symbol));
    }

    @DeleteMapping("/orders/{orderId}")
    public ResponseEntity<OrderResult> cancel(@PathVariable String orderId, @RequestParam String symbol) {
        return ResponseEntity.ok(trades.cancelOrder(orderId, symbol));
    }

    @GetMapping("/history")
    public ResponseEntity<List<OHLCVBar>> history(
            @RequestParam String symbol,
            @RequestParam(required = false) String timeframe,
            @RequestParam(required = false) Integer limit) {
        return ResponseEntity.ok(trades.getPriceHistory(symbol, timeframe, limit));
    }

    @GetMapping("/market")
    public ResponseEntity<MarketInfo> market(@RequestParam String symbol) {
        return trades.getMarketInfo(symbol)
            .map(ResponseEntity::ok)
            .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/positions")
    public ResponseEntity<List<PositionSummary>> positions() {
        return ResponseEntity.ok(trades.getPositions());
    }
}
