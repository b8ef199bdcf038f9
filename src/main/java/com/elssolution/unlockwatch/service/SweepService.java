package com.elssolution.unlockwatch.service;

import com.elssolution.unlockwatch.alerts.AlertService;
import com.elssolution.unlockwatch.domain.NotificationDecision;
import com.elssolution.unlockwatch.domain.TransitionDetector;
import com.elssolution.unlockwatch.integration.status.ProbeResult;
import com.elssolution.unlockwatch.integration.status.StatusProbeClient;
import com.elssolution.unlockwatch.notify.DeliveryResult;
import com.elssolution.unlockwatch.notify.Notifier;
import com.elssolution.unlockwatch.store.StoreState;
import com.elssolution.unlockwatch.store.StoreWriteException;
import com.elssolution.unlockwatch.store.SubscriptionStore;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * The periodic driver: every tick it walks all chats and their accounts,
 * probes, decides, notifies and marks the account once delivery succeeded.
 *
 * Rules:
 * - one sweep at a time; a tick arriving while a sweep runs is skipped;
 * - endpoint not configured => the sweep does nothing;
 * - chats in insertion order, accounts in insertion order;
 * - a failing account is logged + alerted, the sweep goes on with the next one;
 * - each distinct account is probed once per sweep (in parallel on the probe pool),
 *   results are applied one by one in order.
 */
@Slf4j
@Component
public class SweepService {

    private final SubscriptionStore store;
    private final StatusProbeClient prober;
    private final TransitionDetector detector;
    private final Notifier notifier;
    private final AlertService alerts;
    private final ScheduledExecutorService scheduler;
    private final ExecutorService probeExecutor;
    private final Clock clock;

    private final long periodSeconds;
    private final long initialDelaySeconds;
    private final boolean honorSubscriberInterval;

    private final AtomicBoolean running = new AtomicBoolean(false);
    /** chat id -> earliest time it is due again (only with honorSubscriberInterval) */
    private final Map<String, Instant> nextDue = new ConcurrentHashMap<>();
    private volatile SweepReport lastReport;

    public SweepService(SubscriptionStore store,
                        StatusProbeClient prober,
                        TransitionDetector detector,
                        Notifier notifier,
                        AlertService alerts,
                        ScheduledExecutorService scheduler,
                        @Qualifier("probeExecutor") ExecutorService probeExecutor,
                        Clock clock,
                        @Value("${watch.sweep.periodSeconds:60}") long periodSeconds,
                        @Value("${watch.sweep.initialDelaySeconds:10}") long initialDelaySeconds,
                        @Value("${watch.sweep.honorSubscriberInterval:false}") boolean honorSubscriberInterval) {
        this.store = store;
        this.prober = prober;
        this.detector = detector;
        this.notifier = notifier;
        this.alerts = alerts;
        this.scheduler = scheduler;
        this.probeExecutor = probeExecutor;
        this.clock = clock;
        this.periodSeconds = Math.max(1, periodSeconds);
        this.initialDelaySeconds = Math.max(0, initialDelaySeconds);
        this.honorSubscriberInterval = honorSubscriberInterval;
    }

    @PostConstruct
    void startSweeping() {
        scheduler.scheduleWithFixedDelay(this::tickSafe, initialDelaySeconds, periodSeconds, TimeUnit.SECONDS);
        log.info("Sweep scheduled: every={}s, firstIn={}s, honorSubscriberInterval={}",
                periodSeconds, initialDelaySeconds, honorSubscriberInterval);
    }

    public long periodSeconds() { return periodSeconds; }

    public boolean isRunning() { return running.get(); }

    public Optional<SweepReport> lastReport() { return Optional.ofNullable(lastReport); }

    private void tickSafe() {
        try {
            sweepOnce();
        } catch (Exception e) {
            // keep the periodic task alive whatever happens
            log.error("Sweep failed: {}", e.toString(), e);
            alerts.raise(AlertService.SWEEP_STEP, "Sweep failed: " + e, AlertService.Severity.ERROR);
        }
    }

    /** Runs one sweep now. Empty when another sweep is still in progress. */
    public Optional<SweepReport> sweepOnce() {
        if (!running.compareAndSet(false, true)) {
            log.info("Sweep still running, tick skipped");
            return Optional.empty();
        }
        try {
            SweepReport report = sweep();
            lastReport = report;
            return Optional.of(report);
        } finally {
            running.set(false);
        }
    }

    // ---------------------- one sweep ----------------------

    private SweepReport sweep() {
        Instant started = clock.instant();
        StoreState state = store.load();
        StoreState.EndpointConfig endpoint = state.getEndpoint();
        if (!endpoint.isConfigured()) {
            log.debug("Endpoint not configured, sweep skipped");
            return SweepReport.builder().startedAt(started).finishedAt(clock.instant())
                    .endpointConfigured(false).build();
        }

        List<Map.Entry<String, StoreState.Subscriber>> due = dueSubscribers(state, started);

        // probe every distinct account once, in parallel
        Map<String, Future<ProbeResult>> probes = new LinkedHashMap<>();
        for (Map.Entry<String, StoreState.Subscriber> e : due) {
            for (String account : e.getValue().getAccounts()) {
                probes.computeIfAbsent(account, a -> probeExecutor.submit(() -> prober.probe(endpoint, a)));
            }
        }

        Map<String, Boolean> cache = new HashMap<>(state.getAccountState());
        Set<String> firedThisSweep = new HashSet<>();
        Set<String> handledPairs = new HashSet<>();   // chatId + NUL + account
        Set<String> probeFailures = new HashSet<>();
        int notifications = 0;
        int failures = 0;
        int deliveryFailures = 0;

        chats:
        for (Map.Entry<String, StoreState.Subscriber> e : due) {
            String chatId = e.getKey();
            for (String account : e.getValue().getAccounts()) {
                if (!handledPairs.add(chatId + '\u0000' + account)) {
                    log.debug("{}/{}: listed twice, already handled", chatId, account);
                    continue;
                }
                try {
                    ProbeResult result = await(probes.get(account));
                    if (!result.ok() && probeFailures.add(account)) {
                        failures++;
                        log.warn("Probe {} failed: status={} {}", account, result.status(), shorten(result.raw()));
                        alerts.raise(AlertService.PROBE_ERROR,
                                account + ": status=" + result.status() + " " + shorten(result.raw()),
                                AlertService.Severity.WARN);
                    }

                    NotificationDecision decision = detector.detectAndConsume(cache, account, result);
                    // the same account fired for another chat earlier in this sweep: tell this chat too
                    boolean fire = decision.fire() || (result.unlocked() && firedThisSweep.contains(account));
                    if (!fire) {
                        log.debug("{}/{}: {}", chatId, account, decision.reason());
                        continue;
                    }
                    firedThisSweep.add(account);

                    String raw = state.isIncludeRaw() ? result.raw() : null;
                    String message = notifier.render(account, true, clock.instant(), raw);
                    DeliveryResult delivery = notifier.deliver(chatId, message);
                    if (!delivery.ok()) {
                        failures++;
                        deliveryFailures++;
                        log.warn("Notification {} -> chat {} not delivered: {}", account, chatId, delivery.error());
                        alerts.raise(AlertService.DELIVERY_FAILED,
                                "chat " + chatId + " / " + account + ": " + delivery.error(),
                                AlertService.Severity.WARN);
                        continue;
                    }

                    notifications++;
                    log.info("Unlock of {} notified to chat {}", account, chatId);
                    if (!Boolean.TRUE.equals(cache.get(account))) {
                        store.markUnlocked(account);   // write-after-notify
                        cache.put(account, Boolean.TRUE);
                        alerts.resolve(AlertService.STORE_WRITE);
                    }
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    log.warn("Sweep interrupted at {}/{}, stopping", chatId, account);
                    probes.values().forEach(f -> f.cancel(true));
                    break chats;
                } catch (StoreWriteException ex) {
                    failures++;
                    log.warn("Could not persist unlock of {}: {}", account, ex.toString());
                    alerts.raise(AlertService.STORE_WRITE, ex.getMessage(), AlertService.Severity.ERROR);
                } catch (Exception ex) {
                    failures++;
                    log.warn("Sweep step {}/{} failed: {}", chatId, account, ex.toString());
                    alerts.raise(AlertService.SWEEP_STEP,
                            chatId + "/" + account + ": " + ex, AlertService.Severity.WARN);
                }
            }
        }

        alerts.settleSweep(probes.size(), probeFailures.size(), notifications, deliveryFailures);

        SweepReport report = SweepReport.builder()
                .startedAt(started)
                .finishedAt(clock.instant())
                .endpointConfigured(true)
                .subscribers(due.size())
                .probes(probes.size())
                .notifications(notifications)
                .failures(failures)
                .build();
        log.info("Sweep done: chats={} probes={} notified={} failures={} in {} ms",
                report.getSubscribers(), report.getProbes(), report.getNotifications(),
                report.getFailures(), report.durationMs());
        return report;
    }

    /** All chats, or only those whose own interval elapsed when per-chat cadence is on. */
    private List<Map.Entry<String, StoreState.Subscriber>> dueSubscribers(StoreState state, Instant now) {
        List<Map.Entry<String, StoreState.Subscriber>> due = new ArrayList<>();
        for (Map.Entry<String, StoreState.Subscriber> e : state.getSubscribers().entrySet()) {
            if (honorSubscriberInterval) {
                Instant next = nextDue.get(e.getKey());
                if (next != null && now.isBefore(next)) continue;
                nextDue.put(e.getKey(), now.plus(Duration.ofMinutes(e.getValue().getIntervalMinutes())));
            }
            due.add(e);
        }
        nextDue.keySet().retainAll(state.getSubscribers().keySet());
        return due;
    }

    private static ProbeResult await(Future<ProbeResult> f) throws InterruptedException {
        try {
            ProbeResult r = f.get();
            return r != null ? r : ProbeResult.error("no result");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            return ProbeResult.error(cause.toString());
        }
    }

    private static String shorten(String s) {
        if (s == null) return "";
        return s.length() <= 200 ? s : s.substring(0, 200) + "…";
    }
}
