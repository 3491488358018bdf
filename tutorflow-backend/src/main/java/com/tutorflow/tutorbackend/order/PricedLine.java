package com.tutorflow.tutorbackend.order;

import com.tutorflow.tutorbackend.course.Course;

import java.math.BigDecimal;

/**
 * One course on a new order with the amount charged for it and the discount already applied.
 */
public record PricedLine(Course course, BigDecimal price, BigDecimal discount) {}
