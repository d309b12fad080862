package com.jay.cryptoagent;

import com.jay.cryptoagent.config.AgentConfig;
import com.jay.cryptoagent.layer4_risk.TradingGate;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class CryptoAgentApplicationTests {

    @Autowired
    private AgentConfig config;

    @Autowired
    private TradingGate gate;

    @Test
    void contextLoadsWithTestConfig() {
        assertEquals("test-key", config.exchange().getApiKey());
        assertEquals(TradingGate.Decision.PERMITTED, gate.evaluateManual());
    }
}
