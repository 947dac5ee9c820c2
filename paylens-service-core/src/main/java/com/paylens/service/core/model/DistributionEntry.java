package com.paylens.service.core.model;

/** One slice of a distribution bucket. {@code percentage} is relative to the bucket total. */
public record DistributionEntry(String label, long count, double percentage) {}
