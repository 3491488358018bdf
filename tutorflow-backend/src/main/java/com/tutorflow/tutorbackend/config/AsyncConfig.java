package com.tutorflow.tutorbackend.config;

import com.tutorflow.tutorbackend.notification.NotificationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

@Configuration
public class AsyncConfig {

    // Bounded: a full queue rejects new deliveries instead of growing without limit.
    @Bean(name = "notificationExecutor")
    public ThreadPoolTaskExecutor notificationExecutor(NotificationProperties props) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.corePoolSize());
        executor.setMaxPoolSize(Math.max(props.corePoolSize(), props.maxPoolSize()));
        executor.setQueueCapacity(props.queueCapacity());
        executor.setThreadNamePrefix("notify-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        return executor;
    }
}
