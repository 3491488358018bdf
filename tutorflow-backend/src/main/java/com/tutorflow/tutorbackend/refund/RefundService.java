package com.tutorflow.tutorbackend.refund;

import com.fasterxml.jackson.databind.JsonNode;
import com.tutorflow.tutorbackend.enrollment.Enrollment;
import com.tutorflow.tutorbackend.enrollment.EnrollmentService;
import com.tutorflow.tutorbackend.error.BillingError;
import com.tutorflow.tutorbackend.error.BillingException;
import com.tutorflow.tutorbackend.notification.NotificationService;
import com.tutorflow.tutorbackend.notification.NotificationType;
import com.tutorflow.tutorbackend.notification.RelatedType;
import com.tutorflow.tutorbackend.order.Order;
import com.tutorflow.tutorbackend.order.OrderRepository;
import com.tutorflow.tutorbackend.order.OrderStatus;
import com.tutorflow.tutorbackend.payment.PaymentEventHandler;
import com.tutorflow.tutorbackend.payment.PaymentGateway;
import com.tutorflow.tutorbackend.payment.PaymentGatewayException;
import com.tutorflow.tutorbackend.payment.ProviderEvent;
import com.tutorflow.tutorbackend.payment.ProviderRefund;
import com.tutorflow.tutorbackend.payment.RefundCommand;
import com.tutorflow.tutorbackend.pricing.PricingEngine;
import com.tutorflow.tutorbackend.refund.dto.RefundDto;
import com.tutorflow.tutorbackend.revenue.RevenueService;
import com.tutorflow.tutorbackend.user.User;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Refund workflow: PENDING → APPROVED | REJECTED, then APPROVED → PROCESSED once the provider
 * has moved the money.
 *
 * Approval is where access ends: the order is marked REFUNDED, its enrollments revoked and its
 * unpaid instructor earnings reversed, all in one transaction with the order row locked.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class RefundService implements PaymentEventHandler {

    static final String CHARGE_REFUNDED = "charge.refunded";

    private final RefundRepository refundRepository;
    private final OrderRepository orderRepository;
    private final EnrollmentService enrollmentService;
    private final RevenueService revenueService;
    private final PaymentGateway paymentGateway;
    private final NotificationService notificationService;
    private final RefundPolicy policy;
    private final Clock clock;

    @Transactional
    public RefundDto requestRefund(User user, String orderNumber, RefundReason reason, String description) {
        Order order = orderRepository.findByOrderNumberForUpdate(orderNumber)
                .orElseThrow(() -> BillingException.notFound("Order"));

        if (refundRepository.existsByOrder_Id(order.getId())) {
            throw new BillingException(BillingError.DUPLICATE_REFUND, "A refund was already requested for this order");
        }
        if (!order.getUser().getId().equals(user.getId())) {
            throw BillingException.forbidden("Only the buyer can request a refund");
        }

        Instant now = Instant.now(clock);
        Instant purchasedAt = order.getPaidAt() != null ? order.getPaidAt() : order.getCreatedAt();
        long days = Duration.between(purchasedAt, now).toDays();
        if (days > policy.maxDaysAfterPurchase()) {
            throw new BillingException(BillingError.OUT_OF_WINDOW,
                    "Refunds are only possible within " + policy.maxDaysAfterPurchase() + " days of purchase");
        }
        if (order.getStatus() == OrderStatus.REFUNDED) {
            throw new BillingException(BillingError.ALREADY_REFUNDED, "Order is already refunded");
        }
        if (order.getStatus() != OrderStatus.COMPLETED) {
            throw new BillingException(BillingError.ORDER_NOT_SETTLED, "Only paid orders can be refunded");
        }
        for (Enrollment e : enrollmentService.findByOrder(order)) {
            if (e.getProgressPercent() > policy.maxProgressPercent()) {
                throw new BillingException(BillingError.EXCESSIVE_PROGRESS,
                        "'" + e.getCourse().getTitle() + "' is " + e.getProgressPercent() + "% complete");
            }
        }

        Refund refund = new Refund();
        refund.setOrder(order);
        refund.setUser(user);
        refund.setAmount(PricingEngine.refundableAmount(order));
        refund.setReason(reason);
        refund.setDescription(description);
        refund.setStatus(RefundStatus.PENDING);
        refund.setCreatedAt(now);
        try {
            refund = refundRepository.saveAndFlush(refund);
        } catch (DataIntegrityViolationException e) {
            throw new BillingException(BillingError.DUPLICATE_REFUND, "A refund was already requested for this order", e);
        }

        if (policy.autoApproves(refund.getAmount())) {
            refund.setStatus(RefundStatus.APPROVED);
            refund.setProcessedAt(now);
            refund.setAdminNotes("auto-approved");
            applyApproval(order, now);
            log.info("Refund {} for order {} auto-approved ({})", refund.getId(), orderNumber, refund.getAmount());
        } else {
            log.info("Refund {} for order {} awaiting review ({})", refund.getId(), orderNumber, refund.getAmount());
        }
        return RefundDto.from(refund);
    }

    @Transactional
    public RefundDto approve(Long refundId, User admin, String notes) {
        Refund refund = requirePending(refundId);
        Instant now = Instant.now(clock);
        refund.setStatus(RefundStatus.APPROVED);
        refund.setAdminNotes(notes);
        refund.setProcessedBy(admin);
        refund.setProcessedAt(now);

        Order order = orderRepository.findByIdForUpdate(refund.getOrder().getId())
                .orElseThrow(() -> BillingException.notFound("Order"));
        applyApproval(order, now);

        log.info("Refund {} approved by admin {}", refundId, admin.getId());
        notificationService.notify(refund.getUser(), NotificationType.REFUND, RelatedType.REFUND, refund.getId(),
                "Refund approved",
                "Your refund of " + refund.getAmount() + " for order " + order.getOrderNumber() + " was approved");
        return RefundDto.from(refund);
    }

    @Transactional
    public RefundDto reject(Long refundId, User admin, String notes) {
        Refund refund = requirePending(refundId);
        refund.setStatus(RefundStatus.REJECTED);
        refund.setAdminNotes(notes);
        refund.setProcessedBy(admin);
        refund.setProcessedAt(Instant.now(clock));

        log.info("Refund {} rejected by admin {}", refundId, admin.getId());
        notificationService.notify(refund.getUser(), NotificationType.REFUND, RelatedType.REFUND, refund.getId(),
                "Refund rejected",
                notes == null || notes.isBlank() ? "Your refund request was rejected" : "Your refund request was rejected: " + notes);
        return RefundDto.from(refund);
    }

    /**
     * Sends an approved refund to the provider. Already processed refunds are returned unchanged.
     * A provider failure leaves the refund APPROVED for the next settlement run.
     */
    @Transactional
    public RefundDto process(Long refundId) {
        Refund refund = refundRepository.findByIdForUpdate(refundId)
                .orElseThrow(() -> BillingException.notFound("Refund"));
        if (refund.getStatus() == RefundStatus.PROCESSED) {
            return RefundDto.from(refund);
        }
        if (refund.getStatus() != RefundStatus.APPROVED) {
            throw new BillingException(BillingError.NOT_PROCESSABLE, "Refund is " + refund.getStatus());
        }

        Order order = refund.getOrder();
        if (order.isFree() || order.getPaymentReference() == null) {
            // nothing was charged
            markProcessed(refund, null);
            return RefundDto.from(refund);
        }

        ProviderRefund providerRefund;
        try {
            providerRefund = paymentGateway.refund(new RefundCommand(
                    order.getPaymentReference(),
                    PricingEngine.toMinorUnits(refund.getAmount()),
                    order.getCurrency(),
                    Map.of("refund_id", String.valueOf(refund.getId()), "order_number", order.getOrderNumber()),
                    "refund-" + refund.getId()
            ));
        } catch (PaymentGatewayException e) {
            log.error("Provider refund for refund {} (order {}) failed: {}", refundId, order.getOrderNumber(), e.getMessage());
            throw new BillingException(BillingError.PAYMENT_PROVIDER_FAILURE, "Payment provider refused the refund, it will be retried", e);
        }
        markProcessed(refund, providerRefund.refundId());
        return RefundDto.from(refund);
    }

    public List<Long> findApprovedRefundIds() {
        return refundRepository.findIdsByStatus(RefundStatus.APPROVED);
    }

    @Transactional(readOnly = true)
    public List<RefundDto> getMyRefunds(User user) {
        return refundRepository.findByUserOrderByCreatedAtDesc(user).stream().map(RefundDto::from).toList();
    }

    @Transactional(readOnly = true)
    public Page<RefundDto> getRefundsByStatus(RefundStatus status, int page, int size) {
        return refundRepository.findByStatusOrderByCreatedAtAsc(status, PageRequest.of(page, size)).map(RefundDto::from);
    }

    // --- Provider events ---

    @Override
    public boolean supports(String eventType) {
        return CHARGE_REFUNDED.equals(eventType);
    }

    @Override
    @Transactional
    public void handle(ProviderEvent event) {
        String refundId = event.metadata("refund_id");
        if (refundId == null) {
            refundId = firstRefundField(event, "metadata", "refund_id");
        }
        if (refundId == null) {
            log.info("charge.refunded {} carries no refund_id, refund made outside the platform", event.id());
            return;
        }
        Refund refund;
        try {
            refund = refundRepository.findByIdForUpdate(Long.parseLong(refundId)).orElse(null);
        } catch (NumberFormatException e) {
            log.warn("charge.refunded {} has malformed refund_id '{}'", event.id(), refundId);
            return;
        }
        if (refund == null) {
            log.warn("charge.refunded {} references unknown refund {}", event.id(), refundId);
            return;
        }
        switch (refund.getStatus()) {
            case APPROVED -> markProcessed(refund, firstRefundField(event, "id"));
            case PROCESSED -> log.debug("Refund {} already processed", refund.getId());
            default -> log.warn("charge.refunded for refund {} in state {} ignored", refund.getId(), refund.getStatus());
        }
    }

    // charge objects list their refunds under refunds.data
    private static String firstRefundField(ProviderEvent event, String... path) {
        JsonNode n = event.path("refunds", "data").path(0);
        for (String p : path) {
            n = n.path(p);
        }
        return n.isTextual() && !n.asText().isBlank() ? n.asText() : null;
    }

    private Refund requirePending(Long refundId) {
        Refund refund = refundRepository.findByIdForUpdate(refundId)
                .orElseThrow(() -> BillingException.notFound("Refund"));
        if (refund.getStatus() != RefundStatus.PENDING) {
            throw new BillingException(BillingError.NOT_PROCESSABLE, "Refund is " + refund.getStatus());
        }
        return refund;
    }

    private void applyApproval(Order order, Instant now) {
        order.setStatus(OrderStatus.REFUNDED);
        order.setRefundedAt(now);
        int revoked = enrollmentService.revokeForOrder(order);
        int reversed = revenueService.reverseEarningsForOrder(order);
        log.info("Order {} refunded: {} enrollment(s) revoked, {} earning(s) reversed", order.getOrderNumber(), revoked, reversed);
    }

    private void markProcessed(Refund refund, String providerRefundId) {
        refund.setStatus(RefundStatus.PROCESSED);
        if (providerRefundId != null) {
            refund.setProviderRefundId(providerRefundId);
        }
        refund.setSettledAt(Instant.now(clock));
        log.info("Refund {} processed (provider ref {})", refund.getId(), refund.getProviderRefundId());
        notificationService.notify(refund.getUser(), NotificationType.REFUND, RelatedType.REFUND, refund.getId(),
                "Refund sent",
                "Your refund of " + refund.getAmount() + " " + refund.getOrder().getCurrency().toUpperCase() + " is on its way");
    }
}
