package com.tutorflow.tutorbackend.bundle.dto;

import lombok.Data;

import java.math.BigDecimal;
import java.time.Instant;

// null fields are left unchanged
@Data
public class BundleUpdateRequest {
    private String title;
    private String description;
    private BigDecimal discountPercent;
    private Boolean active;
    private Instant startDate;
    private Instant endDate;
    private Integer maxPurchases;
}
