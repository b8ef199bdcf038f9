package com.elssolution.unlockwatch.alerts;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/** Last line of defence for worker threads: log and raise an alert instead of dying silently. */
@Slf4j
@Component
@RequiredArgsConstructor
public class GlobalUncaughtHandler implements Thread.UncaughtExceptionHandler {

    public static final String SCHEDULER_THREAD_PREFIX = "uw-sched-";
    public static final String PROBE_THREAD_PREFIX = "uw-probe-";

    private final AlertService alerts;

    private volatile boolean stopping = false; // mute noise while shutting down

    @PostConstruct
    void registerAsDefault() {
        Thread.setDefaultUncaughtExceptionHandler(this);
        log.info("Global uncaught handler installed");
    }

    @EventListener
    public void onContextClosed(ContextClosedEvent e) {
        stopping = true;
    }

    @Override
    public void uncaughtException(Thread t, Throwable e) {
        if (stopping) return;

        String key = classify(t);
        log.error("Uncaught in {} -> {}", t.getName(), e.toString(), e);
        alerts.raise(key, e.toString(), AlertService.Severity.CRITICAL);
    }

    private String classify(Thread t) {
        String name = t.getName() == null ? "" : t.getName();
        if (name.startsWith(SCHEDULER_THREAD_PREFIX)) return "SCHEDULER_UNCAUGHT";
        if (name.startsWith(PROBE_THREAD_PREFIX)) return "PROBE_UNCAUGHT";
        return "UNCAUGHT";
    }
}
