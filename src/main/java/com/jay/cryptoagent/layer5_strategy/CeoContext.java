package com.jay.cryptoagent.layer5_strategy;

import com.jay.cryptoagent.entity.SentinelRun;
import com.jay.cryptoagent.layer3_signal.SentinelContext;
import com.jay.cryptoagent.layer6_execution.TradeLogService;
import com.jay.cryptoagent.model.CeoDirective;

import java.util.List;

/**
 * Sentinel context enriched for the strategic briefing. {@code currentDirective} and
 * {@code performance} are null before the first briefing.
 */
public record CeoContext(
    SentinelContext base,
    List<SentinelRun> runsLast24h,
    CeoDirective currentDirective,
    TradeLogService.Performance performance
) {}
