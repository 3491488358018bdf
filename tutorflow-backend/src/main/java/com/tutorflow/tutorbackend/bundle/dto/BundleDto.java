package com.tutorflow.tutorbackend.bundle.dto;

import com.tutorflow.tutorbackend.bundle.Bundle;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

public record BundleDto(
        Long id,
        String slug,
        String title,
        String description,
        BigDecimal originalPrice,
        BigDecimal bundlePrice,
        BigDecimal discountPercent,
        BigDecimal savings,
        boolean active,
        boolean available,
        Instant startDate,
        Instant endDate,
        Integer maxPurchases,
        int purchaseCount,
        List<BundleCourseDto> courses
) {
    public static BundleDto from(Bundle b, Instant now) {
        return new BundleDto(
                b.getId(),
                b.getSlug(),
                b.getTitle(),
                b.getDescription(),
                b.getOriginalPrice(),
                b.getBundlePrice(),
                b.getDiscountPercent(),
                b.getSavings(),
                b.isActive(),
                b.isAvailable(now) && !b.getCourses().isEmpty(),
                b.getStartDate(),
                b.getEndDate(),
                b.getMaxPurchases(),
                b.getPurchaseCount(),
                b.getCourses().stream().map(BundleCourseDto::from).toList()
        );
    }
}
