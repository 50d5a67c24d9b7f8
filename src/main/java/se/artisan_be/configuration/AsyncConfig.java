package se.artisan_be.configuration;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class AsyncConfig {

    @Value("${app.charts.pool-size:8}")
    private int chartPoolSize;

    @Value("${app.streaming.pool-size:4}")
    private int streamPoolSize;

    @Value("${app.streaming.queue-capacity:50}")
    private int streamQueueCapacity;

    /** Fan-out pool for the combined chart report. */
    @Bean(name = "chartExecutor")
    public ThreadPoolTaskExecutor chartExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(chartPoolSize);
        executor.setMaxPoolSize(chartPoolSize);
        executor.setQueueCapacity(200);
        executor.setThreadNamePrefix("chart-");
        executor.initialize();
        return executor;
    }

    /** Runs artisan create/update work while progress frames stream back to the client. */
    @Bean(name = "streamExecutor")
    public ThreadPoolTaskExecutor streamExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(streamPoolSize);
        executor.setMaxPoolSize(streamPoolSize);
        executor.setQueueCapacity(streamQueueCapacity);
        executor.setThreadNamePrefix("artisan-stream-");
        executor.initialize();
        return executor;
    }
}
