package com.jay.cryptoagent.layer5_strategy;

import com.jay.cryptoagent.model.CeoDirective;
import com.jay.cryptoagent.model.enums.MarketRegime;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DirectiveFormatterTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    @Test
    void format_rendersAllSections() {
        String text = DirectiveFormatter.formatForSentinel(directive(NOW.minus(Duration.ofHours(3))), NOW);

        assertTrue(text.startsWith("\n## CEO Strategic Directive\n"));
        assertTrue(text.contains("Market Regime: RISK-ON | Bias: BULLISH | Risk: 6/10"));
        assertTrue(text.contains("Issued: 3 hours ago"));
        assertTrue(text.contains("- **SOL**: BULLISH - buy dips (max 20% portfolio)"));
        assertTrue(text.contains("  Watch ETF news"));
        assertTrue(text.contains("- SOL/USD: Buy zone $140-$150, Sell zone $180-$190.50"));
        assertTrue(text.contains("### Risk Rules\nNo leverage"));
        assertTrue(text.contains("Avoid: memecoins, new listings"));
        assertTrue(text.contains("### CEO Summary\nLean long SOL."));
        assertTrue(text.contains("**IMPORTANT**"));
    }

    @Test
    void format_expiredDirectiveIsFlagged() {
        CeoDirective d = directive(NOW.minus(Duration.ofHours(30)));
        d.setValidUntil(NOW.minus(Duration.ofHours(6)));

        String text = DirectiveFormatter.formatForSentinel(d, NOW);

        assertTrue(text.contains("## CEO Strategic Directive (EXPIRED - use extra caution)"));
        assertTrue(text.contains("Issued: 30 hours ago"));
    }

    @Test
    void format_minimalDirectiveSkipsEmptySections() {
        CeoDirective d = CeoDirective.builder()
            .generatedAt(NOW.minusSeconds(600))
            .validUntil(NOW.plus(Duration.ofHours(23)))
            .build();

        String text = DirectiveFormatter.formatForSentinel(d, NOW);

        assertTrue(text.contains("Issued: less than 1 hour ago"));
        assertFalse(text.contains("### Coin Guidance"));
        assertFalse(text.contains("### Key Levels"));
        assertFalse(text.contains("Avoid:"));
    }

    private static CeoDirective directive(Instant generatedAt) {
        Map<String, CeoDirective.CoinGuidance> coins = new LinkedHashMap<>();
        coins.put("SOL", new CeoDirective.CoinGuidance("bullish", "buy dips", 20, "Watch ETF news"));
        Map<String, CeoDirective.KeyLevels> levels = new LinkedHashMap<>();
        levels.put("SOL/USD", new CeoDirective.KeyLevels(List.of(140.0, 150.0), List.of(180.0, 190.5)));
        return CeoDirective.builder()
            .generatedAt(generatedAt)
            .validUntil(generatedAt.plus(Duration.ofHours(24)))
            .marketRegime(MarketRegime.RISK_ON)
            .overallBias("bullish")
            .riskLevel(6)
            .coins(coins)
            .keyLevels(levels)
            .riskGuidelines("No leverage")
            .avoid(List.of("memecoins", "new listings"))
            .summary("Lean long SOL.")
            .build();
    }
}
