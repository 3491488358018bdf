package com.tutorflow.tutorbackend.bundle.dto;

import com.tutorflow.tutorbackend.bundle.BundleCourse;
import com.tutorflow.tutorbackend.pricing.PricingEngine;

import java.math.BigDecimal;

public record BundleCourseDto(
        Long courseId,
        String title,
        String slug,
        int position,
        BigDecimal effectivePrice
) {
    public static BundleCourseDto from(BundleCourse bc) {
        return new BundleCourseDto(
                bc.getCourse().getId(),
                bc.getCourse().getTitle(),
                bc.getCourse().getSlug(),
                bc.getPosition(),
                PricingEngine.effectivePrice(bc.getCourse())
        );
    }
}
