package com.paylens.service.core.metrics;

import java.util.List;
import java.util.Map;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import java.util.function.Function;

public final class BucketMerge {

    private BucketMerge() {}

    /** Step folding each row into the accumulator of its bucket, creating accumulators on first sight. */
    public static <B, R, A> Consumer<Map<B, A>> into(
            List<MetricBucket<B, R>> buckets, Function<B, A> newAccumulator, BiConsumer<A, R> add) {
        return target -> {
            for (MetricBucket<B, R> bucket : buckets) {
                add.accept(target.computeIfAbsent(bucket.bucket(), newAccumulator), bucket.row());
            }
        };
    }
}
