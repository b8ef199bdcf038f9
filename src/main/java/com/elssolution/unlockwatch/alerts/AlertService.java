package com.elssolution.unlockwatch.alerts;

import lombok.Builder;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.*;

/**
 * Operational problems of the watcher, one entry per key.
 * A key is raised while its problem lasts; the sweep settles probe and delivery keys
 * at the end of every round (see {@link #settleSweep}). Read-only view at /alerts.
 */
@Slf4j
@Service
public class AlertService {

    public enum Severity { INFO, WARN, ERROR, CRITICAL }

    /** Status endpoint unreachable or answering >= 400 for some account. */
    public static final String PROBE_ERROR = "PROBE_ERROR";
    /** Telegram refused or never got a notification. */
    public static final String DELIVERY_FAILED = "DELIVERY_FAILED";
    /** Unlock was notified but could not be persisted. */
    public static final String STORE_WRITE = "STORE_WRITE";
    public static final String SWEEP_STEP = "SWEEP_STEP";

    static final int RECENT_CAPACITY = 50;

    @Value @Builder
    public static class AlertView {
        String key;
        String message;
        Severity severity;
        long firstSeen;   // epoch ms, start of the current episode
        long lastSeen;    // epoch ms
        int count;        // raises in this episode
        boolean active;
    }

    @Value @Builder
    public static class EventView {
        String key;
        String message;
        Severity severity;
        long ts;
        String type;      // "RAISE" or "RESOLVE"
    }

    @Value @Builder
    public static class AlertsSnapshot {
        List<AlertView> active;
        List<EventView> recent;
    }

    private final Clock clock;
    private final Map<String, Episode> episodes = new LinkedHashMap<>();
    private final Deque<EventView> recent = new ArrayDeque<>();

    public AlertService(Clock clock) {
        this.clock = clock;
    }

    /** Opens an episode for {@code key}, or refreshes the open one. */
    public void raise(String key, String message, Severity severity) {
        long now = clock.millis();
        boolean opened;
        synchronized (this) {
            Episode ep = episodes.get(key);
            opened = ep == null || !ep.active;
            if (opened) {
                ep = new Episode(now);
                episodes.put(key, ep);
            }
            ep.touch(message, severity, now);
            record(key, message, severity, now, "RAISE");
        }
        if (opened) log.warn("ALERT RAISE key={} sev={} msg={}", key, severity, message);
        else        log.debug("ALERT again key={} msg={}", key, message);
    }

    /** Closes the open episode of {@code key}; no-op when nothing is open. */
    public void resolve(String key) {
        long now = clock.millis();
        synchronized (this) {
            Episode ep = episodes.get(key);
            if (ep == null || !ep.active) return;
            ep.active = false;
            ep.lastSeen = now;
            record(key, "recovered", ep.severity, now, "RESOLVE");
        }
        log.info("ALERT RESOLVE key={}", key);
    }

    public synchronized boolean isActive(String key) {
        Episode ep = episodes.get(key);
        return ep != null && ep.active;
    }

    /**
     * End-of-sweep bookkeeping. A round that probed something without a single probe failure
     * clears {@link #PROBE_ERROR}; a round that delivered at least one notification and
     * lost none clears {@link #DELIVERY_FAILED}. Rounds that did neither leave both untouched.
     */
    public void settleSweep(int probes, int probeFailures, int notifications, int deliveryFailures) {
        if (probes > 0 && probeFailures == 0) resolve(PROBE_ERROR);
        if (notifications > 0 && deliveryFailures == 0) resolve(DELIVERY_FAILED);
    }

    /** Open episodes, latest activity first, and the recent raise/resolve events, newest first. */
    public synchronized AlertsSnapshot snapshot() {
        List<AlertView> active = new ArrayList<>();
        episodes.forEach((key, ep) -> {
            if (ep.active) active.add(ep.view(key));
        });
        active.sort(Comparator.comparingLong(AlertView::getLastSeen).reversed());

        List<EventView> events = new ArrayList<>(recent);
        Collections.reverse(events);
        return AlertsSnapshot.builder().active(active).recent(events).build();
    }

    private void record(String key, String message, Severity severity, long ts, String type) {
        recent.addLast(EventView.builder()
                .key(key).message(message).severity(severity).ts(ts).type(type)
                .build());
        if (recent.size() > RECENT_CAPACITY) recent.removeFirst();
    }

    /** Guarded by the service monitor. */
    private static final class Episode {
        final long firstSeen;
        long lastSeen;
        String message;
        Severity severity;
        int count;
        boolean active = true;

        Episode(long now) {
            this.firstSeen = now;
            this.lastSeen = now;
        }

        void touch(String message, Severity severity, long now) {
            this.message = message;
            this.severity = severity;
            this.lastSeen = now;
            this.count++;
        }

        AlertView view(String key) {
            return AlertView.builder()
                    .key(key).message(message).severity(severity).active(active)
                    .firstSeen(firstSeen).lastSeen(lastSeen).count(count)
                    .build();
        }
    }
}
