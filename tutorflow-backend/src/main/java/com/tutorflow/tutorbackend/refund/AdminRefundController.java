package com.tutorflow.tutorbackend.refund;

import com.tutorflow.tutorbackend.refund.dto.RefundDecisionRequest;
import com.tutorflow.tutorbackend.refund.dto.RefundDto;
import com.tutorflow.tutorbackend.shared.PaginatedResponse;
import com.tutorflow.tutorbackend.user.CurrentUserService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/admin/refunds")
@RequiredArgsConstructor
public class AdminRefundController {

    private final RefundService refundService;
    private final CurrentUserService currentUserService;

    @GetMapping
    public PaginatedResponse<RefundDto> list(@RequestParam(defaultValue = "PENDING") RefundStatus status,
                                             @RequestParam(defaultValue = "0") int page,
                                             @RequestParam(defaultValue = "20") int size) {
        return PaginatedResponse.of(refundService.getRefundsByStatus(status, page, size));
    }

    @PostMapping("/{id}/approve")
    public RefundDto approve(@PathVariable Long id, @RequestBody(required = false) RefundDecisionRequest body) {
        return refundService.approve(id, currentUserService.getCurrentUserOrThrow(), body == null ? null : body.notes());
    }

    @PostMapping("/{id}/reject")
    public RefundDto reject(@PathVariable Long id, @RequestBody(required = false) RefundDecisionRequest body) {
        return refundService.reject(id, currentUserService.getCurrentUserOrThrow(), body == null ? null : body.notes());
    }

    @PostMapping("/{id}/process")
    public RefundDto process(@PathVariable Long id) {
        return refundService.process(id);
    }
}
