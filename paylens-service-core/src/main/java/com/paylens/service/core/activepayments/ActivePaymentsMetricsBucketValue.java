package com.paylens.service.core.activepayments;

public record ActivePaymentsMetricsBucketValue(Long activePayments) {}
