package com.elssolution.unlockwatch.service;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;

/** Counters of one finished sweep, kept as "last sweep" for /status and health. */
@Value @Builder
public class SweepReport {
    Instant startedAt;
    Instant finishedAt;
    boolean endpointConfigured;
    int subscribers;
    int probes;
    int notifications;
    int failures;

    public long durationMs() {
        return Duration.between(startedAt, finishedAt).toMillis();
    }
}
