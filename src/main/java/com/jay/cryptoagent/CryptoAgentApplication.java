package com.jay.cryptoagent;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class CryptoAgentApplication {
    public static void main(String[] args) {
        SpringApplication.run(CryptoAgentApplication.class, args);
    }
}
