package com.tutorflow.tutorbackend.checkout.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CheckoutResult {
    private boolean success;
    private String message;

    private String orderNumber;
    private String status;
    private List<Long> enrolledCourseIds;
}
