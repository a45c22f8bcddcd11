package com.example.cronscheduler.store;

import com.example.cronscheduler.service.alert.SlackAlertService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;

/**
 * Periodically purges expired job records, stale leases and old run history.
 * <p>
 * ShedLock ensures one instance sweeps at a time across the cluster.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "cron-scheduler.store", name = "type", havingValue = "jpa", matchIfMissing = true)
public class StoreHousekeepingService {

    private final TaskStore taskStore;
    private final SlackAlertService slackAlertService;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${cron-scheduler.store.housekeeping-interval:PT1H}",
            initialDelayString = "${cron-scheduler.store.housekeeping-interval:PT1H}")
    @SchedulerLock(name = "storeHousekeeping", lockAtLeastFor = "30s", lockAtMostFor = "10m")
    public void purgeExpired() {
        try {
            var removed = taskStore.purgeExpired(clock.instant());
            if (removed > 0) {
                log.info("Store housekeeping removed {} expired entries", removed);
            } else {
                log.debug("Store housekeeping found nothing to remove");
            }
        } catch (Exception e) {
            log.error("Error during store housekeeping: {}", e.getMessage(), e);
            slackAlertService.sendErrorAlert("Cron scheduler housekeeping failed", e.getMessage(), e.getClass().getName());
        }
    }
}
