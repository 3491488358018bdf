package com.tutorflow.tutorbackend.cart.dto;

import jakarta.validation.constraints.NotNull;

public record AddToCartRequest(@NotNull Long courseId) {}
