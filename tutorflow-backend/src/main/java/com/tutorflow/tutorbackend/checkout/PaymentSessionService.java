package com.tutorflow.tutorbackend.checkout;

import com.tutorflow.tutorbackend.checkout.dto.CheckoutSession;
import com.tutorflow.tutorbackend.error.BillingError;
import com.tutorflow.tutorbackend.error.BillingException;
import com.tutorflow.tutorbackend.order.Order;
import com.tutorflow.tutorbackend.order.OrderItem;
import com.tutorflow.tutorbackend.order.OrderRepository;
import com.tutorflow.tutorbackend.order.OrderStatus;
import com.tutorflow.tutorbackend.payment.PaymentGateway;
import com.tutorflow.tutorbackend.payment.PaymentGatewayException;
import com.tutorflow.tutorbackend.payment.PaymentSession;
import com.tutorflow.tutorbackend.payment.PaymentSessionRequest;
import com.tutorflow.tutorbackend.pricing.PricingEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Opens a provider checkout session for an already committed PENDING order.
 *
 * The provider call runs outside any transaction. If it fails the order stays PENDING and can be
 * retried; nothing is written.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PaymentSessionService {

    static final String FREE_PROVIDER = "free";

    private final OrderRepository orderRepository;
    private final PaymentGateway paymentGateway;
    private final TransactionTemplate transactionTemplate;

    public CheckoutSession open(Long orderId) {
        // --- Build the request from a consistent snapshot of the order ---
        PreparedSession prepared = transactionTemplate.execute(status -> {
            Order order = orderRepository.findById(orderId)
                    .orElseThrow(() -> BillingException.notFound("Order"));
            if (order.getStatus() != OrderStatus.PENDING) {
                throw new BillingException(BillingError.CONFLICT, "Order " + order.getOrderNumber() + " is " + order.getStatus());
            }
            return new PreparedSession(order.getOrderNumber(), order.getTotal(), order.getCurrency(), buildRequest(order));
        });

        // --- Call the provider ---
        PaymentSession session;
        try {
            session = paymentGateway.createCheckoutSession(prepared.request());
        } catch (PaymentGatewayException e) {
            log.error("Could not open {} session for order {}: {}", paymentGateway.name(), prepared.orderNumber(), e.getMessage());
            throw new BillingException(BillingError.PAYMENT_PROVIDER_FAILURE,
                    "Payment provider is unavailable, please retry", e);
        }

        // --- Remember the session on the order ---
        transactionTemplate.executeWithoutResult(status -> orderRepository.findById(orderId).ifPresent(order -> {
            order.setPaymentProvider(session.provider());
            order.setPaymentReference(session.sessionId());
        }));

        log.info("Opened {} session {} for order {}", session.provider(), session.sessionId(), prepared.orderNumber());
        return new CheckoutSession(
                prepared.orderNumber(),
                session.provider(),
                session.sessionId(),
                session.paymentUrl(),
                session.requiresRedirect(),
                prepared.total(),
                prepared.currency(),
                OrderStatus.PENDING.name()
        );
    }

    /** Handle for an order that settled at checkout because nothing was owed. */
    public CheckoutSession settledWithoutPayment(Order order) {
        return new CheckoutSession(
                order.getOrderNumber(),
                FREE_PROVIDER,
                null,
                null,
                false,
                order.getTotal(),
                order.getCurrency(),
                order.getStatus().name()
        );
    }

    private PaymentSessionRequest buildRequest(Order order) {
        List<PaymentSessionRequest.LineItem> lines = new ArrayList<>();
        if (order.getBundle() != null) {
            lines.add(new PaymentSessionRequest.LineItem(order.getBundle().getTitle(),
                    PricingEngine.toMinorUnits(order.getTotal()), 1));
        } else {
            for (OrderItem item : order.getItems()) {
                lines.add(new PaymentSessionRequest.LineItem(item.getCourse().getTitle(),
                        PricingEngine.toMinorUnits(item.getPrice()), 1));
            }
        }
        return new PaymentSessionRequest(
                PricingEngine.toMinorUnits(order.getTotal()),
                order.getCurrency(),
                lines,
                order.getUser().getEmail(),
                Map.of("order_number", order.getOrderNumber(), "order_id", String.valueOf(order.getId())),
                null
        );
    }

    private record PreparedSession(String orderNumber, BigDecimal total, String currency,
                                   PaymentSessionRequest request) {}
}
