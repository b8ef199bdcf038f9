package com.elssolution.unlockwatch.config;

import com.elssolution.unlockwatch.alerts.GlobalUncaughtHandler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.SchedulingConfigurer;
import org.springframework.scheduling.config.ScheduledTaskRegistrar;

import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

@Slf4j
@Configuration
@EnableScheduling
public class SchedulingConfig implements SchedulingConfigurer {
    private final GlobalUncaughtHandler handler;

    public SchedulingConfig(GlobalUncaughtHandler handler) {
        this.handler = handler;
    }

    /** Sweep ticks, the Telegram long poll and @Scheduled jobs all run here. */
    @Bean(destroyMethod = "shutdown") // no zombie threads after context close
    public ScheduledExecutorService scheduler() {
        ScheduledThreadPoolExecutor ex = new ScheduledThreadPoolExecutor(4,
                namedDaemonThreads(GlobalUncaughtHandler.SCHEDULER_THREAD_PREFIX));
        ex.setRemoveOnCancelPolicy(true);
        ex.setContinueExistingPeriodicTasksAfterShutdownPolicy(false);
        ex.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
        return ex;
    }

    /** Bounded fan-out for probing the accounts of one sweep. */
    @Bean(name = "probeExecutor", destroyMethod = "shutdown")
    public ExecutorService probeExecutor(@Value("${watch.sweep.parallelism:4}") int parallelism) {
        int threads = Math.max(1, parallelism);
        log.info("Probe pool: {} threads", threads);
        return Executors.newFixedThreadPool(threads, namedDaemonThreads(GlobalUncaughtHandler.PROBE_THREAD_PREFIX));
    }

    @Override
    public void configureTasks(ScheduledTaskRegistrar taskRegistrar) {
        taskRegistrar.setScheduler(scheduler());
    }

    private ThreadFactory namedDaemonThreads(String prefix) {
        AtomicInteger seq = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r);
            t.setName(prefix + seq.incrementAndGet());
            t.setDaemon(true); // Spring handles clean shutdown
            t.setUncaughtExceptionHandler(handler);
            return t;
        };
    }
}
