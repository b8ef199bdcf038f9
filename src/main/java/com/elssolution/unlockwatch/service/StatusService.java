package com.elssolution.unlockwatch.service;

import com.elssolution.unlockwatch.store.StoreState;
import com.elssolution.unlockwatch.store.SubscriptionStore;
import lombok.*;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Status aggregation for /status, the health indicator and the periodic summary log.
 * Never exposes the bearer token.
 */
@Slf4j
@Component
public class StatusService {

    private final SubscriptionStore store;
    private final SweepService sweeps;
    private final Clock clock;

    public StatusService(SubscriptionStore store, SweepService sweeps, Clock clock) {
        this.store = store;
        this.sweeps = sweeps;
        this.clock = clock;
    }

    public StatusView buildStatusView() {
        StoreState state = store.load();
        Instant now = clock.instant();
        SweepReport last = sweeps.lastReport().orElse(null);
        long lastSweepAgeMs = last == null ? -1 : Duration.between(last.getFinishedAt(), now).toMillis();

        return StatusView.builder()
                .endpointConfigured(state.getEndpoint().isConfigured())
                .endpointUrl(state.getEndpoint().getUrl())
                .tokenSet(!state.getEndpoint().getToken().isBlank())
                .includeRaw(state.isIncludeRaw())
                .subscribers(state.getSubscribers().size())
                .trackedAccounts((int) state.getSubscribers().values().stream()
                        .flatMap(s -> s.getAccounts().stream()).distinct().count())
                .unlockedAccounts((int) state.getAccountState().values().stream()
                        .filter(Boolean.TRUE::equals).count())
                .sweepRunning(sweeps.isRunning())
                .sweepPeriodSeconds(sweeps.periodSeconds())
                .lastSweepAgeMs(lastSweepAgeMs)
                .lastSweepAgeHuman(humanAge(lastSweepAgeMs))
                .lastSweep(last)
                .build();
    }

    @Scheduled(fixedDelayString = "${watch.status.summaryEveryMs:600000}",
               initialDelayString = "${watch.status.summaryEveryMs:600000}")
    void logSummary() {
        try {
            StatusView v = buildStatusView();
            log.info("Status: endpointConfigured={} chats={} accounts={} unlocked={} lastSweep={} ({})",
                    v.endpointConfigured, v.subscribers, v.trackedAccounts, v.unlockedAccounts,
                    v.lastSweepAgeHuman,
                    v.lastSweep == null ? "-" : v.lastSweep.getNotifications() + " notified, "
                            + v.lastSweep.getFailures() + " failures");
        } catch (Exception e) {
            log.warn("status_summary_failed: {}", e.getMessage());
        }
    }

    static String humanAge(long ageMs) {
        if (ageMs < 0) return "-";
        if (ageMs < 1000) return ageMs + " ms";
        long s = ageMs / 1000;
        if (s < 60) return s + " s";
        long m = s / 60;
        long remS = s % 60;
        return m + " min " + remS + " s";
    }

    @Builder @Getter @ToString @EqualsAndHashCode @AllArgsConstructor
    public static class StatusView {
        boolean endpointConfigured;
        String  endpointUrl;
        boolean tokenSet;
        boolean includeRaw;

        int subscribers;
        int trackedAccounts;
        int unlockedAccounts;

        boolean sweepRunning;
        long    sweepPeriodSeconds;
        long    lastSweepAgeMs;
        String  lastSweepAgeHuman;
        SweepReport lastSweep;
    }
}
