package com.jay.cryptoagent.layer1_data;

/**
 * Any failure talking to the exchange: network, authentication, validation or a rejected order.
 */
public class ExchangeException extends RuntimeException {

    public ExchangeException(String message) {
        super(message);
    }

    public ExchangeException(String message, Throwable cause) {
        super(message, cause);
    }
}
