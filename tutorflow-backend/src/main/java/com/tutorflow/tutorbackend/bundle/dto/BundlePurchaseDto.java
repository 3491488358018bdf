package com.tutorflow.tutorbackend.bundle.dto;

import com.tutorflow.tutorbackend.bundle.BundlePurchase;

import java.math.BigDecimal;
import java.time.Instant;

public record BundlePurchaseDto(
        Long id,
        Long bundleId,
        String bundleSlug,
        String bundleTitle,
        String orderNumber,
        BigDecimal pricePaid,
        Instant purchasedAt
) {
    public static BundlePurchaseDto from(BundlePurchase p) {
        return new BundlePurchaseDto(
                p.getId(),
                p.getBundle().getId(),
                p.getBundle().getSlug(),
                p.getBundle().getTitle(),
                p.getOrder().getOrderNumber(),
                p.getPricePaid(),
                p.getCreatedAt()
        );
    }
}
