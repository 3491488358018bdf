package com.tutorflow.tutorbackend.payment;

public record ProviderRefund(String refundId, String status) {}
