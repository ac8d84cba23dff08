package com.postpilot.scheduler.config;

import com.postpilot.scheduler.service.JobStatusNotifier;
import org.springframework.amqp.core.TopicExchange;
import org.springframework.amqp.support.converter.Jackson2JsonMessageConverter;
import org.springframework.amqp.support.converter.MessageConverter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

@Configuration
public class SchedulerConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Workers for platform publish calls. The dispatch loop never submits more than
     * {@code max-concurrency} tasks, so the queue only absorbs the gap between a worker
     * finishing and its slot being released.
     */
    @Bean(name = "publishExecutor")
    public ThreadPoolTaskExecutor publishExecutor(DispatchProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getMaxConcurrency());
        executor.setMaxPoolSize(properties.getMaxConcurrency());
        executor.setQueueCapacity(properties.getMaxConcurrency());
        executor.setThreadNamePrefix("publish-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds((int) properties.getPublishTimeout().toSeconds() + 5);
        executor.initialize();
        return executor;
    }

    @Bean
    public TopicExchange publishingExchange() {
        return new TopicExchange(JobStatusNotifier.EXCHANGE, true, false);
    }

    @Bean
    public MessageConverter jsonMessageConverter() {
        return new Jackson2JsonMessageConverter();
    }
}
