package com.elssolution.bmsdashboard.config;

import com.elssolution.bmsdashboard.alerts.GlobalUncaughtHandler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
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

    @Value("${bms.acquisition.threads:3}")
    private int acquisitionThreads;

    public SchedulingConfig(GlobalUncaughtHandler handler) {
        this.handler = handler;
    }

    @Primary
    @Bean(destroyMethod = "shutdown") // no zombie threads after context close
    public ScheduledExecutorService scheduler() {
        ScheduledThreadPoolExecutor ex = new ScheduledThreadPoolExecutor(2, daemonFactory("bms-sched-"));
        ex.setRemoveOnCancelPolicy(true);
        ex.setContinueExistingPeriodicTasksAfterShutdownPolicy(false);
        ex.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
        return ex;
    }

    /** One worker per leg; legs block on the network, not on CPU. */
    @Bean(name = "acquisitionExecutor", destroyMethod = "shutdownNow")
    public ExecutorService acquisitionExecutor() {
        int n = Math.max(1, acquisitionThreads);
        log.info("Acquisition pool: {} threads", n);
        return Executors.newFixedThreadPool(n, daemonFactory("bms-leg-"));
    }

    @Override
    public void configureTasks(ScheduledTaskRegistrar taskRegistrar) {
        taskRegistrar.setScheduler(scheduler());
    }

    private ThreadFactory daemonFactory(String prefix) {
        AtomicInteger seq = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r);
            t.setName(prefix + seq.incrementAndGet()); // unique name → easier debugging/logging
            t.setDaemon(true); // don’t block JVM exit; Spring handles clean shutdown
            t.setUncaughtExceptionHandler(handler);
            return t;
        };
    }
}
