package com.flighttracker.tracker.domain.sampling;

import com.flighttracker.tracker.domain.tracker.DateRange;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Picks which travel dates to query in a cycle.
 *
 * <p>The open part of the range ({@code [max(start, today), end)}) is split into
 * {@code budget} contiguous buckets and one date is taken per bucket. The pick inside
 * a bucket rotates with the cycle number, so a fixed window of {@code n} dates is fully
 * covered after {@code ceil(n / budget)} cycles.
 */
@Component
public class DateSampler {

    public List<LocalDate> sample(DateRange range, LocalDate today, int budget, long cycle) {
        if (budget < 1) {
            throw new IllegalArgumentException("Sampling budget must be positive: " + budget);
        }
        if (range.isExhausted(today)) {
            return List.of();
        }

        var first = range.start().isBefore(today) ? today : range.start();
        int open = (int) new DateRange(first, range.end()).length();

        var dates = new ArrayList<LocalDate>(Math.min(open, budget));
        if (open <= budget) {
            for (int i = 0; i < open; i++) {
                dates.add(first.plusDays(i));
            }
            return dates;
        }

        for (int bucket = 0; bucket < budget; bucket++) {
            int bucketStart = bucketBoundary(bucket, open, budget);
            int bucketSize = bucketBoundary(bucket + 1, open, budget) - bucketStart;
            int offset = (int) Math.floorMod(cycle, (long) bucketSize);
            dates.add(first.plusDays(bucketStart + offset));
        }
        return dates;
    }

    private static int bucketBoundary(int bucket, int open, int budget) {
        return (int) ((long) bucket * open / budget);
    }
}
