package com.tutorflow.tutorbackend.subscription;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@Slf4j
public class SubscriptionCleanupTask {

    private final SubscriptionService subscriptionService;

    @Scheduled(cron = "${app.subscriptions.reaper-cron:0 0 3 * * *}") // every day at 3 AM by default
    public void expireCanceledSubscriptions() {
        int ended = subscriptionService.expireCanceledAtPeriodEnd();
        if (ended > 0) {
            log.info("Ended {} subscription(s) scheduled for cancellation", ended);
        }
    }
}
