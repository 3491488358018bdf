package com.tutorflow.tutorbackend.revenue;

import com.tutorflow.tutorbackend.revenue.dto.PayoutDecisionRequest;
import com.tutorflow.tutorbackend.revenue.dto.PayoutDto;
import com.tutorflow.tutorbackend.shared.PaginatedResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/admin/payouts")
@RequiredArgsConstructor
public class AdminPayoutController {

    private final RevenueService revenueService;

    @GetMapping
    public PaginatedResponse<PayoutDto> list(@RequestParam(defaultValue = "PENDING") PayoutStatus status,
                                             @RequestParam(defaultValue = "0") int page,
                                             @RequestParam(defaultValue = "20") int size) {
        return PaginatedResponse.of(revenueService.getPayoutsByStatus(status, page, size));
    }

    @PostMapping("/{id}/confirm")
    public PayoutDto confirm(@PathVariable Long id, @RequestBody(required = false) PayoutDecisionRequest body) {
        return revenueService.confirmPayout(id, body == null ? null : body.transactionId());
    }

    @PostMapping("/{id}/fail")
    public PayoutDto fail(@PathVariable Long id, @RequestBody(required = false) PayoutDecisionRequest body) {
        return revenueService.failPayout(id, body == null ? null : body.reason());
    }
}
