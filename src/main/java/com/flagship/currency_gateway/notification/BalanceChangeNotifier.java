package com.flagship.currency_gateway.notification;

/**
 * Best-effort signal to downstream consumers that a balance changed.
 *
 * Implementations must not throw and must not hold the caller for longer than
 * it takes to hand the message off. Failures are logged and counted, never retried.
 */
public interface BalanceChangeNotifier {

    void notifyBalanceChanged(BalanceChangeNotification notification);
}
