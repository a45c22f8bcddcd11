package com.example.cronscheduler.service.executor;

import lombok.RequiredArgsConstructor;
import org.springframework.context.SmartLifecycle;

/**
 * Starts the scheduler once the context is refreshed and stops it, draining
 * in-flight runs, before the context shuts down.
 */
@RequiredArgsConstructor
public class SchedulerLifecycle implements SmartLifecycle {

    private final DistributedScheduler scheduler;
    private final boolean autoStart;

    @Override
    public void start() {
        scheduler.start();
    }

    @Override
    public void stop() {
        scheduler.stop();
    }

    @Override
    public boolean isRunning() {
        return scheduler.isRunning();
    }

    @Override
    public boolean isAutoStartup() {
        return autoStart;
    }

    /**
     * Stop before the web server and data source go away
     */
    @Override
    public int getPhase() {
        return Integer.MAX_VALUE - 1024;
    }
}
