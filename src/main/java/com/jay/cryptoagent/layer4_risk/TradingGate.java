package com.jay.cryptoagent.layer4_risk;

import com.jay.cryptoagent.config.AgentConfig;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Layer 4 — Trading gate.
 * Decides whether an automated or manual trade may be placed right now. Checks run in a fixed
 * order and the first failing one wins.
 */
@Component
@RequiredArgsConstructor
public class TradingGate {

    private final AgentConfig config;
    private final DailyRiskStateService dailyState;

    public enum Decision {
        DISABLED("DISABLED. Analysis only."),
        PREVIEW_ONLY("PREVIEW ONLY. Recommend trades but do not confirm."),
        TRADE_LIMIT("DAILY LIMIT REACHED. No more trades today."),
        LOSS_LIMIT("LOSS LIMIT REACHED. No more trades today."),
        PERMITTED("Trading permitted.");

        private final String description;

        Decision(String description) {
            this.description = description;
        }

        public String description() {
            return description;
        }

        public boolean permitted() {
            return this == PERMITTED;
        }
    }

    /** Sentinel gate: trading enabled, auto-confirm on, trade-count limit, loss limit. */
    public Decision evaluateAutomated() {
        if (!config.trading().isEnabled()) return Decision.DISABLED;
        if (!config.sentinel().isAutoConfirm()) return Decision.PREVIEW_ONLY;
        return evaluateLimits();
    }

    /** Manual trades are confirmed by the caller, so auto-confirm does not apply. */
    public Decision evaluateManual() {
        if (!config.trading().isEnabled()) return Decision.DISABLED;
        return evaluateLimits();
    }

    private Decision evaluateLimits() {
        DailyRiskStateService.DailyState state = dailyState.read();
        if (state.tradesToday() >= config.sentinel().getMaxTradesPerDay()) return Decision.TRADE_LIMIT;
        if (state.pnlToday() <= -config.sentinel().getDailyLossLimitUsd()) return Decision.LOSS_LIMIT;
        return Decision.PERMITTED;
    }
}
