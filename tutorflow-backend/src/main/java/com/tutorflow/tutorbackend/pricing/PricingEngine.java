package com.tutorflow.tutorbackend.pricing;

import com.tutorflow.tutorbackend.bundle.Bundle;
import com.tutorflow.tutorbackend.course.Course;
import com.tutorflow.tutorbackend.error.BillingException;
import com.tutorflow.tutorbackend.order.Order;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

/**
 * Price arithmetic shared by cart, checkout, bundles and the earnings ledger.
 * All amounts are currency units at scale 2, rounded half-up. No I/O.
 */
public final class PricingEngine {

    public static final int SCALE = 2;
    private static final BigDecimal HUNDRED = new BigDecimal("100");

    private PricingEngine() {}

    public static BigDecimal money(BigDecimal amount) {
        return (amount == null ? BigDecimal.ZERO : amount).setScale(SCALE, RoundingMode.HALF_UP);
    }

    /** Discount price when set and positive, list price otherwise. */
    public static BigDecimal effectivePrice(Course course) {
        BigDecimal discount = course.getDiscountPrice();
        if (discount != null && discount.signum() > 0) {
            return money(discount);
        }
        return money(course.getPrice());
    }

    public static BundlePrice bundlePrice(List<Course> courses, BigDecimal discountPercent) {
        if (courses == null || courses.isEmpty()) {
            throw BillingException.invalid("A bundle needs at least one course");
        }
        BigDecimal original = BigDecimal.ZERO;
        for (Course c : courses) {
            original = original.add(effectivePrice(c));
        }
        original = money(original);
        return new BundlePrice(original, applyDiscount(original, discountPercent));
    }

    /** original x (1 - discountPercent/100) */
    public static BigDecimal applyDiscount(BigDecimal original, BigDecimal discountPercent) {
        validateDiscount(discountPercent);
        BigDecimal factor = BigDecimal.ONE.subtract(discountPercent.divide(HUNDRED, 6, RoundingMode.HALF_UP));
        return money(money(original).multiply(factor));
    }

    public static void validateDiscount(BigDecimal discountPercent) {
        if (discountPercent == null
                || discountPercent.signum() < 0
                || discountPercent.compareTo(HUNDRED) > 0) {
            throw BillingException.invalid("Discount percent must be between 0 and 100");
        }
    }

    public static BigDecimal savings(Bundle bundle) {
        return money(bundle.getOriginalPrice()).subtract(money(bundle.getBundlePrice()));
    }

    public static BigDecimal platformFee(BigDecimal price, BigDecimal feePercent) {
        return money(money(price).multiply(feePercent).divide(HUNDRED, 6, RoundingMode.HALF_UP));
    }

    public static BigDecimal instructorShare(BigDecimal price, BigDecimal feePercent) {
        return money(price).subtract(platformFee(price, feePercent));
    }

    /** Amount in the provider's minor currency unit (cents). */
    public static long toMinorUnits(BigDecimal amount) {
        return money(amount).movePointRight(SCALE).longValueExact();
    }

    public static BigDecimal refundableAmount(Order order) {
        return money(order.getTotal());
    }

    /**
     * Splits {@code total} across {@code weights} proportionally. Shares are truncated to cents
     * and the last share absorbs the remainder, so the result always sums to {@code total}
     * and no share is negative.
     * Zero total weight splits evenly.
     */
    public static List<BigDecimal> allocate(List<BigDecimal> weights, BigDecimal total) {
        if (weights == null || weights.isEmpty()) {
            throw BillingException.invalid("Nothing to allocate across");
        }
        BigDecimal target = money(total);
        BigDecimal weightSum = BigDecimal.ZERO;
        for (BigDecimal w : weights) {
            weightSum = weightSum.add(money(w));
        }

        List<BigDecimal> shares = new ArrayList<>(weights.size());
        BigDecimal allocated = BigDecimal.ZERO;
        for (int i = 0; i < weights.size(); i++) {
            BigDecimal share;
            if (i == weights.size() - 1) {
                share = target.subtract(allocated);
            } else if (weightSum.signum() == 0) {
                share = target.divide(BigDecimal.valueOf(weights.size()), SCALE, RoundingMode.DOWN);
            } else {
                share = target.multiply(money(weights.get(i)))
                        .divide(weightSum, SCALE, RoundingMode.DOWN);
            }
            shares.add(share);
            allocated = allocated.add(share);
        }
        return shares;
    }
}
