package com.tutorflow.tutorbackend.order.dto;

import com.tutorflow.tutorbackend.order.OrderItem;

import java.math.BigDecimal;

public record OrderItemDto(
        Long id,
        Long courseId,
        String courseTitle,
        BigDecimal price,
        BigDecimal discount
) {
    public static OrderItemDto from(OrderItem item) {
        return new OrderItemDto(
                item.getId(),
                item.getCourse().getId(),
                item.getCourse().getTitle(),
                item.getPrice(),
                item.getDiscount()
        );
    }
}
