package com.digitalgroup.reportscheduler.config;

import com.digitalgroup.reportscheduler.job.PrioritizedTask;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.PriorityBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread pools
 * - dispatchExecutor: one thread per running schedule; queued runs start by priority, then FIFO
 * - channelExecutor: render and channel calls of running attempts, cancelled on timeout
 * - taskExecutor: @Async notifications
 */
@Slf4j
@Configuration
public class ExecutorConfig {

    @Value("${app.dispatch.pool-size:8}")
    private int dispatchPoolSize;

    @Value("${app.dispatch.channel-pool-size:16}")
    private int channelPoolSize;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Only accepts {@link PrioritizedTask}s through {@code execute}; {@code submit}
     * would wrap them in a non-comparable FutureTask.
     */
    @Bean(name = "dispatchExecutor", destroyMethod = "shutdown")
    public ThreadPoolExecutor dispatchExecutor() {
        log.info("Dispatch pool initialized with {} worker threads", dispatchPoolSize);
        return new ThreadPoolExecutor(dispatchPoolSize, dispatchPoolSize,
                60, TimeUnit.SECONDS,
                new PriorityBlockingQueue<>(),
                namedThreads("report-dispatch-"));
    }

    @Bean(name = "channelExecutor", destroyMethod = "shutdownNow")
    public ExecutorService channelExecutor() {
        return new ThreadPoolExecutor(channelPoolSize, channelPoolSize,
                60, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(),
                namedThreads("report-channel-"));
    }

    @Bean(name = "taskExecutor")
    public ThreadPoolTaskExecutor taskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(4);
        executor.setQueueCapacity(500);
        executor.setThreadNamePrefix("notify-");
        executor.initialize();
        return executor;
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
