package com.tutorflow.tutorbackend.subscription;

import com.tutorflow.tutorbackend.error.BillingException;
import com.tutorflow.tutorbackend.pricing.PricingEngine;
import com.tutorflow.tutorbackend.shared.SlugUtil;
import com.tutorflow.tutorbackend.subscription.dto.PlanDto;
import com.tutorflow.tutorbackend.subscription.dto.PlanRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Service
@Slf4j
@RequiredArgsConstructor
public class SubscriptionPlanService {

    private final SubscriptionPlanRepository planRepository;
    private final Clock clock;

    @Transactional
    public PlanDto createPlan(PlanRequest req) {
        SubscriptionPlan plan = new SubscriptionPlan();
        plan.setSlug(SlugUtil.uniqueSlug(req.name(), planRepository::existsBySlug));
        plan.setCreatedAt(Instant.now(clock));
        apply(plan, req);
        plan = planRepository.save(plan);
        log.info("Created plan {} ({}/month, {}/year)", plan.getSlug(), plan.getMonthlyPrice(), plan.getYearlyPrice());
        return PlanDto.from(plan);
    }

    /**
     * Existing subscriptions keep the price they were sold at; only new subscriptions and plan
     * changes see the new prices.
     */
    @Transactional
    public PlanDto updatePlan(String slug, PlanRequest req) {
        SubscriptionPlan plan = requirePlan(slug);
        apply(plan, req);
        log.info("Updated plan {}", slug);
        return PlanDto.from(plan);
    }

    @Transactional(readOnly = true)
    public List<PlanDto> getActivePlans() {
        return planRepository.findByActiveTrueOrderByPriorityAscMonthlyPriceAsc().stream().map(PlanDto::from).toList();
    }

    @Transactional(readOnly = true)
    public List<PlanDto> getAllPlans() {
        return planRepository.findAllByOrderByPriorityAscIdAsc().stream().map(PlanDto::from).toList();
    }

    @Transactional(readOnly = true)
    public PlanDto getPlanBySlug(String slug) {
        return PlanDto.from(requirePlan(slug));
    }

    public SubscriptionPlan requirePlan(String slug) {
        return planRepository.findBySlug(slug).orElseThrow(() -> BillingException.notFound("Plan"));
    }

    private void apply(SubscriptionPlan plan, PlanRequest req) {
        plan.setName(req.name().trim());
        plan.setDescription(req.description());
        if (req.monthlyPrice() != null) plan.setMonthlyPrice(PricingEngine.money(req.monthlyPrice()));
        if (req.yearlyPrice() != null) plan.setYearlyPrice(PricingEngine.money(req.yearlyPrice()));
        if (plan.getMonthlyPrice().signum() < 0 || plan.getYearlyPrice().signum() < 0) {
            throw BillingException.invalid("Plan prices cannot be negative");
        }
        if (req.features() != null) plan.setFeatures(new ArrayList<>(req.features()));
        plan.setMaxCourses(req.maxCourses());
        plan.setTrialDays(req.trialDays());
        if (req.priority() != null) plan.setPriority(req.priority());
        if (req.active() != null) plan.setActive(req.active());
    }
}
