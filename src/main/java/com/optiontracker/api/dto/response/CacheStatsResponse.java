package com.optiontracker.api.dto.response;

import lombok.Builder;
import lombok.Value;

/** Snapshot of the option chain cache counters. */
@Value
@Builder
public class CacheStatsResponse {

    long size;
    long hitCount;
    long missCount;
    double hitRate;
    long loadSuccessCount;
    long loadFailureCount;
    long evictionCount;
}
