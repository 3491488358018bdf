package com.tutorflow.tutorbackend.checkout;

import com.tutorflow.tutorbackend.bundle.Bundle;
import com.tutorflow.tutorbackend.bundle.BundlePurchase;
import com.tutorflow.tutorbackend.bundle.BundlePurchaseRepository;
import com.tutorflow.tutorbackend.bundle.BundleRepository;
import com.tutorflow.tutorbackend.cart.CartService;
import com.tutorflow.tutorbackend.enrollment.EnrollmentService;
import com.tutorflow.tutorbackend.error.BillingException;
import com.tutorflow.tutorbackend.notification.NotificationService;
import com.tutorflow.tutorbackend.notification.NotificationType;
import com.tutorflow.tutorbackend.notification.RelatedType;
import com.tutorflow.tutorbackend.order.Order;
import com.tutorflow.tutorbackend.order.OrderItem;
import com.tutorflow.tutorbackend.order.OrderRepository;
import com.tutorflow.tutorbackend.order.OrderStatus;
import com.tutorflow.tutorbackend.payment.PaymentEventHandler;
import com.tutorflow.tutorbackend.payment.ProviderEvent;
import com.tutorflow.tutorbackend.revenue.RevenueService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * Turns a paid order into access: enrollments, instructor earnings, bundle bookkeeping.
 *
 * Every entry point locks the order row first, so concurrent deliveries of the same payment
 * serialize and only the first one sees a PENDING order.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OrderSettlementService implements PaymentEventHandler {

    static final String SESSION_COMPLETED = "checkout.session.completed";
    static final String INTENT_SUCCEEDED = "payment_intent.succeeded";
    static final String INTENT_FAILED = "payment_intent.payment_failed";

    private static final Set<String> EVENT_TYPES = Set.of(SESSION_COMPLETED, INTENT_SUCCEEDED, INTENT_FAILED);

    private final OrderRepository orderRepository;
    private final EnrollmentService enrollmentService;
    private final RevenueService revenueService;
    private final CartService cartService;
    private final BundleRepository bundleRepository;
    private final BundlePurchaseRepository bundlePurchaseRepository;
    private final NotificationService notificationService;
    private final Clock clock;

    /**
     * @return true if this call settled the order, false if it was already settled
     */
    @Transactional
    public boolean onPaymentConfirmed(String orderNumber, String paymentReference) {
        Order order = orderRepository.findByOrderNumberForUpdate(orderNumber)
                .orElseThrow(() -> BillingException.notFound("Order"));

        if (order.getStatus() == OrderStatus.COMPLETED) {
            log.info("Order {} already settled, ignoring repeated confirmation", orderNumber);
            return false;
        }
        if (order.getStatus() == OrderStatus.REFUNDED) {
            log.warn("Payment confirmation for refunded order {} ignored", orderNumber);
            return false;
        }

        // FAILED orders can still be paid: the provider may confirm after a failed first attempt
        Instant now = Instant.now(clock);
        order.setStatus(OrderStatus.COMPLETED);
        order.setPaidAt(now);
        if (paymentReference != null) {
            order.setPaymentReference(paymentReference);
        }

        List<Long> courseIds = order.getItems().stream().map(i -> i.getCourse().getId()).toList();
        for (OrderItem item : order.getItems()) {
            enrollmentService.enroll(order.getUser(), item.getCourse(), order);
        }
        revenueService.createEarningsForOrder(order);
        if (order.getBundle() != null) {
            recordBundlePurchase(order, now);
        }
        cartService.removePurchased(order.getUser(), courseIds);

        log.info("Order {} settled: {} course(s) for user {}", orderNumber, courseIds.size(), order.getUser().getId());
        notificationService.notify(order.getUser(), NotificationType.PURCHASE, RelatedType.ORDER, order.getId(),
                "Purchase complete",
                "Order " + orderNumber + " is paid. You now have access to " + courseIds.size() + " course(s).");
        return true;
    }

    @Transactional
    public boolean onPaymentFailed(String orderNumber, String reason) {
        Order order = orderRepository.findByOrderNumberForUpdate(orderNumber)
                .orElseThrow(() -> BillingException.notFound("Order"));
        if (order.getStatus() != OrderStatus.PENDING) {
            log.info("Payment failure for order {} ignored, order is {}", orderNumber, order.getStatus());
            return false;
        }
        order.setStatus(OrderStatus.FAILED);
        log.warn("Payment for order {} failed: {}", orderNumber, reason);
        return true;
    }

    @Override
    public boolean supports(String eventType) {
        return EVENT_TYPES.contains(eventType);
    }

    @Override
    @Transactional
    public void handle(ProviderEvent event) {
        String orderNumber = event.metadata("order_number");
        if (orderNumber == null) {
            // subscription checkouts and foreign payments carry no order number
            log.debug("Event {} ({}) has no order_number, not an order payment", event.id(), event.type());
            return;
        }
        switch (event.type()) {
            case SESSION_COMPLETED -> {
                if ("unpaid".equals(event.text("payment_status"))) {
                    log.info("Session {} completed without payment yet, waiting for payment_intent events", event.objectId());
                    return;
                }
                onPaymentConfirmed(orderNumber, event.text("payment_intent"));
            }
            case INTENT_SUCCEEDED -> onPaymentConfirmed(orderNumber, event.objectId());
            case INTENT_FAILED -> onPaymentFailed(orderNumber, event.text("last_payment_error", "message"));
            default -> log.debug("Unexpected event type {}", event.type());
        }
    }

    private void recordBundlePurchase(Order order, Instant now) {
        if (bundlePurchaseRepository.existsByOrder_Id(order.getId())) {
            return;
        }
        Bundle bundle = bundleRepository.findByIdForUpdate(order.getBundle().getId())
                .orElseThrow(() -> BillingException.notFound("Bundle"));
        bundle.setPurchaseCount(bundle.getPurchaseCount() + 1);

        BundlePurchase purchase = new BundlePurchase();
        purchase.setBundle(bundle);
        purchase.setUser(order.getUser());
        purchase.setOrder(order);
        purchase.setPricePaid(order.getTotal());
        purchase.setCreatedAt(now);
        bundlePurchaseRepository.save(purchase);
        log.info("Bundle {} purchased via order {} ({} sold)", bundle.getSlug(), order.getOrderNumber(), bundle.getPurchaseCount());
    }
}
