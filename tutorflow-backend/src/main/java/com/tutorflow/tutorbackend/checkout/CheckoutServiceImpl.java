package com.tutorflow.tutorbackend.checkout;

import com.tutorflow.tutorbackend.cart.Cart;
import com.tutorflow.tutorbackend.cart.CartItem;
import com.tutorflow.tutorbackend.cart.CartService;
import com.tutorflow.tutorbackend.checkout.dto.CheckoutResult;
import com.tutorflow.tutorbackend.checkout.dto.CheckoutSession;
import com.tutorflow.tutorbackend.course.Course;
import com.tutorflow.tutorbackend.enrollment.EnrollmentService;
import com.tutorflow.tutorbackend.error.BillingError;
import com.tutorflow.tutorbackend.error.BillingException;
import com.tutorflow.tutorbackend.order.Order;
import com.tutorflow.tutorbackend.order.OrderService;
import com.tutorflow.tutorbackend.order.OrderStatus;
import com.tutorflow.tutorbackend.order.PricedLine;
import com.tutorflow.tutorbackend.payment.PaymentGateway;
import com.tutorflow.tutorbackend.pricing.PricingEngine;
import com.tutorflow.tutorbackend.user.User;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class CheckoutServiceImpl implements CheckoutService {

    private final CartService cartService;
    private final EnrollmentService enrollmentService;
    private final OrderService orderService;
    private final OrderSettlementService settlementService;
    private final PaymentSessionService paymentSessionService;
    private final PaymentGateway paymentGateway;
    private final TransactionTemplate transactionTemplate;

    /**
     * Converts the user's cart into a PENDING order priced at the current effective prices.
     * The order commits before the provider is called; free orders settle immediately.
     */
    @Override
    public CheckoutSession checkout(User user) {
        Order order = transactionTemplate.execute(status -> {
            Cart cart = cartService.getOrCreate(user, null);
            if (cart.getItems().isEmpty()) {
                throw BillingException.invalid("Your cart is empty");
            }

            // --- Validate and price every line ---
            List<PricedLine> lines = new ArrayList<>();
            BigDecimal subtotal = BigDecimal.ZERO;
            for (CartItem item : cart.getItems()) {
                Course course = item.getCourse();
                if (!course.isPublished()) {
                    throw new BillingException(BillingError.COURSE_NOT_PUBLISHED,
                            "'" + course.getTitle() + "' is no longer available");
                }
                if (enrollmentService.isEnrolled(user.getId(), course.getId())) {
                    throw new BillingException(BillingError.ALREADY_ENROLLED,
                            "You are already enrolled in '" + course.getTitle() + "'");
                }
                BigDecimal effective = PricingEngine.effectivePrice(course);
                BigDecimal markdown = PricingEngine.money(course.getPrice()).subtract(effective).max(BigDecimal.ZERO);
                lines.add(new PricedLine(course, effective, markdown));
                subtotal = subtotal.add(effective);
            }

            Order created = orderService.createPending(user, lines, subtotal, BigDecimal.ZERO, null);
            if (created.isFree()) {
                settlementService.onPaymentConfirmed(created.getOrderNumber(), null);
            }
            return created;
        });

        if (order.getStatus() == OrderStatus.COMPLETED) {
            log.info("Free order {} settled without payment", order.getOrderNumber());
            return paymentSessionService.settledWithoutPayment(order);
        }
        return paymentSessionService.open(order.getId());
    }

    @Override
    public CheckoutSession retryPayment(User user, String orderNumber) {
        Long orderId = transactionTemplate.execute(status -> {
            Order order = orderService.requireOwned(user, orderNumber);
            switch (order.getStatus()) {
                case PENDING -> { }
                case FAILED -> {
                    order.setStatus(OrderStatus.PENDING);
                    log.info("Order {} reopened for another payment attempt", orderNumber);
                }
                default -> throw new BillingException(BillingError.CONFLICT,
                        "Order " + orderNumber + " is " + order.getStatus() + " and cannot be paid again");
            }
            return order.getId();
        });
        return paymentSessionService.open(orderId);
    }

    /**
     * Development flow for the local {@code test} provider: the buyer confirms the payment
     * themselves. Goes through the same settlement path as a provider webhook.
     */
    @Override
    public CheckoutResult confirmLocalPayment(User user, String orderNumber) {
        if (!paymentGateway.isLocal()) {
            throw BillingException.invalid("Local confirmation is only available with the test payment provider");
        }
        return transactionTemplate.execute(status -> {
            Order order = orderService.requireOwned(user, orderNumber);
            if (order.getStatus() == OrderStatus.REFUNDED) {
                throw new BillingException(BillingError.CONFLICT, "Order " + orderNumber + " was refunded");
            }
            boolean settledNow = settlementService.onPaymentConfirmed(orderNumber, order.getPaymentReference());
            List<Long> courseIds = order.getItems().stream().map(i -> i.getCourse().getId()).toList();
            return CheckoutResult.builder()
                    .success(true)
                    .message(settledNow ? "Payment confirmed" : "Order was already paid")
                    .orderNumber(orderNumber)
                    .status(OrderStatus.COMPLETED.name())
                    .enrolledCourseIds(courseIds)
                    .build();
        });
    }
}
