package com.jay.cryptoagent.layer1_data;

/**
 * Misconfiguration that makes the exchange unusable: missing credentials, an unsupported
 * exchange id, or a sandbox mode that could not be activated. Never retried silently.
 */
public class ExchangeConfigurationException extends ExchangeException {

    public ExchangeConfigurationException(String message) {
        super(message);
    }

    public ExchangeConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
