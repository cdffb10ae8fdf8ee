package com.example.pulsemonitor.storage;

import java.time.Instant;

/**
 * One reduced time bucket: bucket start, reduced value and number of samples.
 */
public record AggregatedPoint(Instant bucketStart, double value, int count) {

    public enum Aggregation {
        AVG, MIN, MAX, SUM
    }
}
