package com.tutorflow.tutorbackend.order.dto;

import com.tutorflow.tutorbackend.order.Order;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

public record OrderDto(
        Long id,
        String orderNumber,
        String status,
        BigDecimal subtotal,
        BigDecimal discount,
        BigDecimal total,
        String currency,
        String paymentProvider,
        Long bundleId,
        List<OrderItemDto> items,
        Instant createdAt,
        Instant paidAt,
        Instant refundedAt
) {
    public static OrderDto from(Order o) {
        return new OrderDto(
                o.getId(),
                o.getOrderNumber(),
                o.getStatus().name(),
                o.getSubtotal(),
                o.getDiscount(),
                o.getTotal(),
                o.getCurrency(),
                o.getPaymentProvider(),
                o.getBundle() != null ? o.getBundle().getId() : null,
                o.getItems().stream().map(OrderItemDto::from).toList(),
                o.getCreatedAt(),
                o.getPaidAt(),
                o.getRefundedAt()
        );
    }
}
