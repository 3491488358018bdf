package com.tutorflow.tutorbackend.subscription.dto;

import com.tutorflow.tutorbackend.subscription.SubscriptionPlan;

import java.math.BigDecimal;
import java.util.List;

public record PlanDto(
        Long id,
        String slug,
        String name,
        String description,
        BigDecimal monthlyPrice,
        BigDecimal yearlyPrice,
        List<String> features,
        Integer maxCourses,
        Integer trialDays,
        int priority,
        boolean active
) {
    public static PlanDto from(SubscriptionPlan p) {
        return new PlanDto(
                p.getId(),
                p.getSlug(),
                p.getName(),
                p.getDescription(),
                p.getMonthlyPrice(),
                p.getYearlyPrice(),
                List.copyOf(p.getFeatures()),
                p.getMaxCourses(),
                p.getTrialDays(),
                p.getPriority(),
                p.isActive()
        );
    }
}
