package com.tutorflow.tutorbackend.refund;

import com.tutorflow.tutorbackend.error.BillingException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Pushes APPROVED refunds to the provider. Each refund runs in its own transaction so one
 * provider failure does not hold back the rest.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RefundSettlementTask {

    private final RefundService refundService;

    @Scheduled(cron = "${app.refunds.settlement-cron:0 */15 * * * *}")
    public void settleApprovedRefunds() {
        List<Long> ids = refundService.findApprovedRefundIds();
        int processed = 0;
        for (Long id : ids) {
            try {
                refundService.process(id);
                processed++;
            } catch (BillingException e) {
                log.warn("Refund {} not settled this run: {}", id, e.getMessage());
            } catch (RuntimeException e) {
                log.error("Refund {} failed unexpectedly, continuing with the rest", id, e);
            }
        }
        if (!ids.isEmpty()) {
            log.info("Refund settlement run: {}/{} processed", processed, ids.size());
        }
    }
}
