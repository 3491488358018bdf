package com.tutorflow.tutorbackend.revenue.dto;

public record PayoutDecisionRequest(String transactionId, String reason) {}
