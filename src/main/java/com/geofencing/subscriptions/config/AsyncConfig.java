package com.geofencing.subscriptions.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Thread pool used for webhook delivery.
 *
 * The monitor hands every notification to this executor and moves on to the
 * next subscription, so the latency of one sink never delays the rest of a pass.
 * On shutdown queued deliveries are allowed to finish.
 */
@Configuration
public class AsyncConfig {

    @Bean(name = "notificationExecutor")
    public ThreadPoolTaskExecutor notificationExecutor(GeofencingProperties properties) {
        GeofencingProperties.Notifications notifications = properties.getNotifications();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(notifications.getExecutorPoolSize());
        executor.setMaxPoolSize(notifications.getExecutorPoolSize());
        executor.setQueueCapacity(notifications.getExecutorQueueCapacity());
        executor.setThreadNamePrefix("notify-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        executor.initialize();
        return executor;
    }
}
