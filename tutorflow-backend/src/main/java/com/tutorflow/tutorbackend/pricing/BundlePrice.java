package com.tutorflow.tutorbackend.pricing;

import java.math.BigDecimal;

public record BundlePrice(BigDecimal originalPrice, BigDecimal bundlePrice) {

    public BigDecimal savings() {
        return originalPrice.subtract(bundlePrice);
    }
}
