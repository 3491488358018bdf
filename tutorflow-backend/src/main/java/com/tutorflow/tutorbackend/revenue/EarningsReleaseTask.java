package com.tutorflow.tutorbackend.revenue;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@Slf4j
public class EarningsReleaseTask {

    private final RevenueService revenueService;

    @Scheduled(cron = "${app.revenue.release-cron:0 30 2 * * *}")
    public void releaseMaturedEarnings() {
        int released = revenueService.releaseMaturedEarnings();
        log.debug("Earnings release run finished, {} released", released);
    }
}
