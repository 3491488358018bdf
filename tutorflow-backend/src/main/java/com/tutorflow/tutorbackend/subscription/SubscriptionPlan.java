package com.tutorflow.tutorbackend.subscription;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "subscription_plans")
@Getter
@Setter
@NoArgsConstructor
public class SubscriptionPlan {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 120)
    private String name;

    @Column(nullable = false, unique = true, length = 140)
    private String slug;

    @Column(length = 2000)
    private String description;

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal monthlyPrice = BigDecimal.ZERO;

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal yearlyPrice = BigDecimal.ZERO;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "subscription_plan_features", joinColumns = @JoinColumn(name = "plan_id"))
    @OrderColumn(name = "feature_order")
    @Column(name = "feature", length = 255)
    private List<String> features = new ArrayList<>();

    private Integer maxCourses; // null = unlimited

    private Integer trialDays;

    // lower sorts first in the catalog
    private int priority = 0;

    private boolean active = true;

    @Column(nullable = false)
    private Instant createdAt;

    public boolean hasTrial() {
        return trialDays != null && trialDays > 0;
    }
}
