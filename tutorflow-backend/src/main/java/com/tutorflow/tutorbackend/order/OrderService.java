package com.tutorflow.tutorbackend.order;

import com.tutorflow.tutorbackend.bundle.Bundle;
import com.tutorflow.tutorbackend.error.BillingException;
import com.tutorflow.tutorbackend.order.dto.OrderDto;
import com.tutorflow.tutorbackend.payment.PaymentProperties;
import com.tutorflow.tutorbackend.pricing.PricingEngine;
import com.tutorflow.tutorbackend.revenue.RevenueProperties;
import com.tutorflow.tutorbackend.user.User;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

@Service
@Slf4j
@RequiredArgsConstructor
public class OrderService {

    private static final DateTimeFormatter ORDER_DATE = DateTimeFormatter.ofPattern("yyyyMMdd").withZone(ZoneOffset.UTC);

    private final OrderRepository orderRepository;
    private final PaymentProperties paymentProperties;
    private final RevenueProperties revenueProperties;
    private final Clock clock;

    /**
     * Persists a PENDING order with one item per line. Each item carries its fee split so the
     * earnings ledger can be built from the order alone once payment lands.
     */
    @Transactional
    public Order createPending(User user, List<PricedLine> lines, BigDecimal subtotal, BigDecimal discount, Bundle bundle) {
        if (lines == null || lines.isEmpty()) {
            throw BillingException.invalid("An order needs at least one item");
        }
        BigDecimal total = PricingEngine.money(subtotal).subtract(PricingEngine.money(discount));
        if (total.signum() < 0) {
            throw BillingException.invalid("Order total cannot be negative");
        }

        Order order = new Order();
        order.setOrderNumber(nextOrderNumber());
        order.setUser(user);
        order.setSubtotal(PricingEngine.money(subtotal));
        order.setDiscount(PricingEngine.money(discount));
        order.setTotal(total);
        order.setCurrency(paymentProperties.currency());
        order.setStatus(OrderStatus.PENDING);
        order.setBundle(bundle);
        order.setCreatedAt(Instant.now(clock));

        BigDecimal feePercent = revenueProperties.platformFeePercent();
        for (PricedLine line : lines) {
            OrderItem item = new OrderItem();
            item.setCourse(line.course());
            item.setPrice(PricingEngine.money(line.price()));
            item.setDiscount(PricingEngine.money(line.discount()));
            item.setPlatformFee(PricingEngine.platformFee(line.price(), feePercent));
            item.setInstructorShare(PricingEngine.instructorShare(line.price(), feePercent));
            order.addItem(item);
        }

        Order saved = orderRepository.save(order);
        log.info("Created order {} for user={} total={} {}", saved.getOrderNumber(), user.getId(),
                saved.getTotal(), saved.getCurrency());
        return saved;
    }

    public String nextOrderNumber() {
        String date = ORDER_DATE.format(Instant.now(clock));
        String candidate;
        do {
            candidate = "ORD-" + date + "-" + UUID.randomUUID().toString().substring(0, 8).toUpperCase(Locale.ROOT);
        } while (orderRepository.existsByOrderNumber(candidate));
        return candidate;
    }

    @Transactional(readOnly = true)
    public Page<OrderDto> getMyOrders(User user, int page, int size) {
        return orderRepository.findByUserOrderByCreatedAtDesc(user, PageRequest.of(page, size))
                .map(OrderDto::from);
    }

    @Transactional(readOnly = true)
    public OrderDto getOrder(User user, String orderNumber) {
        Order order = requireOwned(user, orderNumber);
        return OrderDto.from(order);
    }

    // Unpaid bundle orders still hold a place under the bundle's purchase cap
    public long countPendingForBundle(Long bundleId) {
        return orderRepository.countByBundle_IdAndStatus(bundleId, OrderStatus.PENDING);
    }

    public Order requireOwned(User user, String orderNumber) {
        Order order = orderRepository.findByOrderNumber(orderNumber)
                .orElseThrow(() -> BillingException.notFound("Order"));
        if (!order.getUser().getId().equals(user.getId()) && !user.isAdmin()) {
            throw BillingException.forbidden("Order belongs to another user");
        }
        return order;
    }
}
