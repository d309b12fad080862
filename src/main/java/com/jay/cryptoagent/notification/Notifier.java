package com.jay.cryptoagent.notification;

/**
 * Outbound user notifications. Delivery is best-effort: implementations log failures and never
 * throw back into the trading loops.
 */
public interface Notifier {

    void send(String message);
}
