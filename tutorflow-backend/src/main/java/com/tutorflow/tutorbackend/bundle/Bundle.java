package com.tutorflow.tutorbackend.bundle;

import com.tutorflow.tutorbackend.pricing.PricingEngine;
import com.tutorflow.tutorbackend.user.User;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Fixed set of courses sold together at a discount. {@code originalPrice} is the sum of the
 * courses' effective prices and {@code bundlePrice} is always derived from it.
 */
@Entity
@Getter
@Setter
@NoArgsConstructor
public class Bundle {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String title;

    @Column(nullable = false, unique = true)
    private String slug;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal originalPrice = BigDecimal.ZERO;

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal bundlePrice = BigDecimal.ZERO;

    @Column(nullable = false, precision = 5, scale = 2)
    private BigDecimal discountPercent = BigDecimal.ZERO;

    @Column(nullable = false)
    private boolean active = true;

    private Instant startDate;
    private Instant endDate;

    // null = unlimited
    private Integer maxPurchases;

    @Column(nullable = false)
    private int purchaseCount = 0;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "created_by")
    private User createdBy;

    @OneToMany(mappedBy = "bundle", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("position ASC")
    private List<BundleCourse> courses = new ArrayList<>();

    @CreationTimestamp
    @Column(updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    private Instant updatedAt;

    public boolean isAvailable(Instant now) {
        if (!active) return false;
        if (maxPurchases != null && purchaseCount >= maxPurchases) return false;
        if (startDate != null && now.isBefore(startDate)) return false;
        if (endDate != null && now.isAfter(endDate)) return false;
        return true;
    }

    public BigDecimal getSavings() {
        return PricingEngine.savings(this);
    }

    public void recomputeBundlePrice() {
        this.bundlePrice = PricingEngine.applyDiscount(originalPrice, discountPercent);
    }

    public boolean containsCourse(Long courseId) {
        return courses.stream().anyMatch(bc -> bc.getCourse().getId().equals(courseId));
    }

    public int nextPosition() {
        return courses.stream().mapToInt(BundleCourse::getPosition).max().orElse(0) + 1;
    }
}
