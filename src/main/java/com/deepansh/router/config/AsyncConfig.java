package com.deepansh.router.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Dedicated thread pool for routing work off the request thread: timed classifier and
 * responder calls, tool-using streaming turns, SSE subscriptions and trace persistence.
 *
 * Isolated from the web thread pool so a burst of streaming requests never starves
 * HTTP request handling. A streaming turn with tools holds a thread until its last
 * round ends, hence the larger max pool.
 */
@Configuration
@EnableAsync
public class AsyncConfig {

    @Bean(name = "routerTaskExecutor")
    public Executor routerTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(8);
        executor.setMaxPoolSize(64);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("router-async-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }
}
