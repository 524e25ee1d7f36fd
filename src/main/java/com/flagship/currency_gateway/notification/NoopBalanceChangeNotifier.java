package com.flagship.currency_gateway.notification;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "gateway.notification.transport", havingValue = "none")
@Slf4j
public class NoopBalanceChangeNotifier implements BalanceChangeNotifier {

    @Override
    public void notifyBalanceChanged(BalanceChangeNotification notification) {
        log.debug("Notifications disabled, skipping: userId={}", notification.getUserId());
    }
}
