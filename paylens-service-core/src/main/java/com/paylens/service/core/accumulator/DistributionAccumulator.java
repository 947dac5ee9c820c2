package com.paylens.service.core.accumulator;

import com.paylens.service.core.model.DistributionEntry;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/** Counts per label within one bucket, reported as the top entries with their share of the bucket. */
public final class DistributionAccumulator
        implements MetricAccumulator<DistributionAccumulator.Entry, List<DistributionEntry>> {

    private static final Comparator<Map.Entry<String, Long>> BY_COUNT_DESC =
            Comparator.comparing((Map.Entry<String, Long> e) -> e.getValue(), Comparator.reverseOrder())
                    .thenComparing(e -> e.getKey(), Comparator.nullsLast(Comparator.<String>naturalOrder()));

    private final int limit;
    private final Map<String, Long> counts = new HashMap<>();

    public DistributionAccumulator(int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive");
        }
        this.limit = limit;
    }

    @Override
    public void add(Entry entry) {
        if (entry == null || entry.count() == null) {
            return;
        }
        counts.merge(entry.label(), entry.count(), Math::addExact);
    }

    public void merge(DistributionAccumulator other) {
        other.counts.forEach((label, count) -> counts.merge(label, count, Math::addExact));
    }

    @Override
    public List<DistributionEntry> collect() {
        if (counts.isEmpty()) {
            return null;
        }
        long total = counts.values().stream().mapToLong(Long::longValue).sum();
        List<Map.Entry<String, Long>> sorted = new ArrayList<>(counts.entrySet());
        sorted.sort(BY_COUNT_DESC);
        List<DistributionEntry> out = new ArrayList<>(Math.min(limit, sorted.size()));
        for (Map.Entry<String, Long> e : sorted.subList(0, Math.min(limit, sorted.size()))) {
            double percentage = total == 0L ? 0.0d : e.getValue() * 100.0d / total;
            out.add(new DistributionEntry(e.getKey(), e.getValue(), percentage));
        }
        return List.copyOf(out);
    }

    public record Entry(String label, Long count) {}
}
