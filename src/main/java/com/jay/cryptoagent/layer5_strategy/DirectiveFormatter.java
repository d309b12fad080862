package com.jay.cryptoagent.layer5_strategy;

import com.jay.cryptoagent.model.CeoDirective;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Renders the current directive as the section injected into every Sentinel prompt.
 */
public final class DirectiveFormatter {

    private DirectiveFormatter() {}

    public static String formatForSentinel(CeoDirective directive, Instant now) {
        boolean expired = directive.isExpired(now);
        long ageHours = directive.getGeneratedAt() != null
            ? Duration.between(directive.getGeneratedAt(), now).toHours() : 0;
        String age = ageHours < 1 ? "less than 1 hour ago"
            : ageHours == 1 ? "1 hour ago"
            : ageHours + " hours ago";

        StringBuilder sb = new StringBuilder();
        sb.append("\n## CEO Strategic Directive").append(expired ? " (EXPIRED - use extra caution)" : "").append('\n');
        sb.append(String.format("Market Regime: %s | Bias: %s | Risk: %d/10%n",
            directive.getMarketRegime().label().toUpperCase(), upper(directive.getOverallBias()), directive.getRiskLevel()));
        sb.append("Issued: ").append(age).append('\n');

        if (directive.getCoins() != null && !directive.getCoins().isEmpty()) {
            sb.append("\n### Coin Guidance\n");
            for (Map.Entry<String, CeoDirective.CoinGuidance> e : directive.getCoins().entrySet()) {
                CeoDirective.CoinGuidance g = e.getValue();
                sb.append(String.format("- **%s**: %s - %s (max %s%% portfolio)%n",
                    e.getKey(), upper(g.getBias()), g.getAction(), trimNumber(g.getMaxPositionPct())));
                if (g.getNotes() != null && !g.getNotes().isBlank()) {
                    sb.append("  ").append(g.getNotes()).append('\n');
                }
            }
        }

        if (directive.getKeyLevels() != null && !directive.getKeyLevels().isEmpty()) {
            sb.append("\n### Key Levels\n");
            for (Map.Entry<String, CeoDirective.KeyLevels> e : directive.getKeyLevels().entrySet()) {
                CeoDirective.KeyLevels levels = e.getValue();
                sb.append(String.format("- %s: Buy zone %s, Sell zone %s%n",
                    e.getKey(), zone(levels.getBuyZone()), zone(levels.getSellZone())));
            }
        }

        if (directive.getRiskGuidelines() != null && !directive.getRiskGuidelines().isBlank()) {
            sb.append("\n### Risk Rules\n").append(directive.getRiskGuidelines()).append('\n');
        }
        if (directive.getAvoid() != null && !directive.getAvoid().isEmpty()) {
            sb.append("Avoid: ").append(String.join(", ", directive.getAvoid())).append('\n');
        }

        sb.append("\n### CEO Summary\n").append(directive.getSummary()).append('\n');

        sb.append("\n**IMPORTANT**: Follow the CEO directive for strategic decisions. You may deviate ONLY if:\n")
          .append("1. A coin has moved >5% against the directive since it was issued\n")
          .append("2. Breaking news fundamentally changes the outlook\n")
          .append("If you deviate, explain why in your summary.\n");
        return sb.toString();
    }

    private static String zone(List<Double> bounds) {
        if (bounds == null || bounds.size() < 2) return "n/a";
        return "$" + trimNumber(bounds.get(0)) + "-$" + trimNumber(bounds.get(1));
    }

    private static String trimNumber(double value) {
        return value == Math.rint(value) ? String.format("%,.0f", value) : String.format("%,.2f", value);
    }

    private static String upper(String value) {
        return value == null ? "" : value.toUpperCase();
    }
}
