package com.connectpro.maintenance;

import com.connectpro.store.RecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Deletes messages past the retention age. Users, owners and conversations are
 * kept indefinitely.
 */
public class RetentionSweep {

    private static final Logger log = LoggerFactory.getLogger(RetentionSweep.class);

    private final RecordStore store;
    private final Duration retention;
    private final String schedule;
    private final Clock clock;

    public RetentionSweep(RecordStore store, int retentionDays, String schedule, Clock clock) {
        this.store = store;
        this.retention = Duration.ofDays(retentionDays);
        this.schedule = schedule;
        this.clock = clock;
    }

    /** Never throws; failures are logged and reported. */
    public CleanupReport run() {
        var errors = new ArrayList<String>();
        long deleted = 0;
        try {
            deleted = store.purgeMessagesOlderThan(retention);
            log.info("Daily cleanup: deleted {} old messages", deleted);
        } catch (Exception e) {
            var msg = "Message cleanup failed: " + e.getMessage();
            errors.add(msg);
            log.error(msg, e);
        }
        return new CleanupReport(deleted, errors);
    }

    public Map<String, Object> stats() {
        var stats = new LinkedHashMap<String, Object>();
        stats.put("retentionDays", retention.toDays());
        stats.put("retentionCutoff", clock.instant().minus(retention).toString());
        stats.put("schedule", schedule);
        return stats;
    }
}
