package com.herotasks.realtime.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

@Configuration
public class RealtimeConfig {

    @Bean(destroyMethod = "shutdownNow")
    public ScheduledExecutorService heartbeatScheduler() {
        return Executors.newScheduledThreadPool(2, daemonThreads("heartbeat-"));
    }

    @Bean(destroyMethod = "shutdownNow")
    public ScheduledExecutorService busReconnectScheduler() {
        return Executors.newSingleThreadScheduledExecutor(daemonThreads("bus-reconnect-"));
    }

    /**
     * One long-running drain task per open connection.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService inboxExecutor() {
        return Executors.newCachedThreadPool(daemonThreads("inbox-"));
    }

    private static CustomizableThreadFactory daemonThreads(String prefix) {
        CustomizableThreadFactory factory = new CustomizableThreadFactory(prefix);
        factory.setDaemon(true);
        return factory;
    }
}
