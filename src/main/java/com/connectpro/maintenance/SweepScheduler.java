package com.connectpro.maintenance;

import com.connectpro.tenants.TenantOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.scheduling.support.CronTrigger;

import java.io.Closeable;
import java.time.ZoneId;

/** Cron triggers for the retention sweep and the trial sweep. */
public class SweepScheduler implements Closeable {

    private static final Logger log = LoggerFactory.getLogger(SweepScheduler.class);

    private final ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();

    public SweepScheduler() {
        scheduler.setPoolSize(2);
        scheduler.setThreadNamePrefix("sweep-");
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.initialize();
    }

    public void start(RetentionSweep retention, String retentionCron,
                      TenantOrchestrator orchestrator, String trialCron, ZoneId zone) {
        scheduler.schedule(retention::run, new CronTrigger(retentionCron, zone));
        scheduler.schedule(orchestrator::checkTrials, new CronTrigger(trialCron, zone));
        log.info("Scheduled retention sweep '{}' and trial sweep '{}' ({})", retentionCron, trialCron, zone);
    }

    @Override
    public void close() {
        scheduler.shutdown();
    }
}
