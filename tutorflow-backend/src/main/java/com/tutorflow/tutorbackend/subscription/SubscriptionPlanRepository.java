package com.tutorflow.tutorbackend.subscription;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface SubscriptionPlanRepository extends JpaRepository<SubscriptionPlan, Long> {

    Optional<SubscriptionPlan> findBySlug(String slug);

    boolean existsBySlug(String slug);

    List<SubscriptionPlan> findByActiveTrueOrderByPriorityAscMonthlyPriceAsc();

    List<SubscriptionPlan> findAllByOrderByPriorityAscIdAsc();
}
