package io.dispatch.orders.configuration;

import io.dispatch.orders.domain.OrderingRules;
import io.dispatch.orders.domain.usecase.ContentionRetryPolicy;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.auditing.DateTimeProvider;
import org.springframework.data.jpa.repository.config.EnableJpaAuditing;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.ThreadPoolExecutor;

@Configuration
@EnableJpaAuditing(dateTimeProviderRef = "auditingDateTimeProvider")
public class OrderingConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /** Audit timestamps come from the same clock as the operational day. */
    @Bean
    public DateTimeProvider auditingDateTimeProvider(Clock clock) {
        return () -> Optional.of(clock.instant());
    }

    @Bean
    public OrderingRules orderingRules(OrderingProperties properties) {
        return new OrderingRules(properties.zone(), properties.payment().strict());
    }

    @Bean
    public ContentionRetryPolicy contentionRetryPolicy(OrderingProperties properties) {
        var sequence = properties.sequence();
        return new ContentionRetryPolicy(sequence.maxAttempts(), sequence.minBackoff(), sequence.maxBackoff());
    }

    /**
     * Delivery pool for change notifications. Rejects instead of running on the caller so that a
     * slow subscriber never holds up an order request.
     */
    @Bean(name = "notificationExecutor")
    public ThreadPoolTaskExecutor notificationExecutor(OrderingProperties properties) {
        var notifier = properties.notifier();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(notifier.corePoolSize());
        executor.setMaxPoolSize(notifier.maxPoolSize());
        executor.setQueueCapacity(notifier.queueCapacity());
        executor.setThreadNamePrefix("order-notify-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setAwaitTerminationSeconds(10);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        return executor;
    }
}
