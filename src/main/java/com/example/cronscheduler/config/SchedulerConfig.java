package com.example.cronscheduler.config;

import com.example.cronscheduler.cron.CronEvaluator;
import com.example.cronscheduler.service.alert.SlackAlertService;
import com.example.cronscheduler.service.callback.CallbackRegistry;
import com.example.cronscheduler.service.executor.DistributedScheduler;
import com.example.cronscheduler.service.executor.JobExecutor;
import com.example.cronscheduler.service.executor.SchedulerLifecycle;
import com.example.cronscheduler.store.TaskStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Clock;
import java.time.ZoneId;
import java.util.UUID;

/**
 * Wires the scheduler core: cron evaluation, the job executor and the tick loop.
 * <p>
 * The scheduler is started and stopped with the application context unless
 * {@code cron-scheduler.auto-start} is false.
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class SchedulerConfig {

    private final SchedulerProperties properties;

    private String instanceId;

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public CronEvaluator cronEvaluator() {
        return new CronEvaluator(ZoneId.of(properties.getTimeZone()));
    }

    @Bean(destroyMethod = "shutdown")
    public JobExecutor jobExecutor(Clock clock, MetricsConfig metricsConfig) {
        var executor = new JobExecutor(properties.getMaxConcurrent(), clock, instanceId());
        metricsConfig.registerExecutorGauges(executor);
        return executor;
    }

    @Bean
    public DistributedScheduler distributedScheduler(TaskStore taskStore, JobExecutor jobExecutor, CronEvaluator cronEvaluator,
                                                     CallbackRegistry callbackRegistry, Clock clock, MetricsConfig metricsConfig,
                                                     SlackAlertService slackAlertService) {
        return new DistributedScheduler(taskStore, jobExecutor, cronEvaluator, callbackRegistry, clock, properties,
                metricsConfig, slackAlertService, instanceId());
    }

    @Bean
    public SchedulerLifecycle schedulerLifecycle(DistributedScheduler distributedScheduler) {
        return new SchedulerLifecycle(distributedScheduler, properties.isAutoStart());
    }

    /**
     * Lease owner token: configured value, or host name plus a random UUID
     */
    synchronized String instanceId() {
        if (instanceId == null) {
            if (properties.getInstanceId() != null && !properties.getInstanceId().isBlank()) {
                instanceId = properties.getInstanceId();
            } else {
                instanceId = hostName() + "-" + UUID.randomUUID();
            }
            log.info("Scheduler instance id: {}", instanceId);
        }
        return instanceId;
    }

    private static String hostName() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            log.warn("Could not resolve host name, using 'unknown': {}", e.getMessage());
            return System.getenv().getOrDefault("HOSTNAME", "unknown");
        }
    }
}
