package com.elssolution.tanksim.config;

import com.elssolution.tanksim.alerts.GlobalUncaughtHandler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.SchedulingConfigurer;
import org.springframework.scheduling.config.ScheduledTaskRegistrar;

import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread pools:
 *   - scheduler: periodic housekeeping (status summary), also used by @Scheduled;
 *   - replayExecutor: one long-lived thread per running source;
 *   - streamExecutor: one pump thread per connected stream client.
 * All threads are daemons and report uncaught failures to the alert service.
 */
@Slf4j
@Configuration
@EnableScheduling
public class SchedulingConfig implements SchedulingConfigurer {
    private final GlobalUncaughtHandler handler;

    public SchedulingConfig(GlobalUncaughtHandler handler) {
        this.handler = handler;
    }

    @Bean(destroyMethod = "shutdown") // no zombie threads after context close
    public ScheduledExecutorService scheduler() {
        ScheduledThreadPoolExecutor ex = new ScheduledThreadPoolExecutor(2, named("tank-sched-"));
        ex.setRemoveOnCancelPolicy(true);
        ex.setContinueExistingPeriodicTasksAfterShutdownPolicy(false);
        ex.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
        return ex;
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService replayExecutor() {
        return Executors.newCachedThreadPool(named("replay-"));
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService streamExecutor() {
        return Executors.newCachedThreadPool(named("stream-"));
    }

    @Override
    public void configureTasks(ScheduledTaskRegistrar taskRegistrar) {
        taskRegistrar.setScheduler(scheduler());
    }

    private ThreadFactory named(String prefix) {
        AtomicInteger seq = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r);
            t.setName(prefix + seq.incrementAndGet()); // unique name → easier debugging/logging
            t.setDaemon(true);
            t.setUncaughtExceptionHandler(handler);
            return t;
        };
    }
}
