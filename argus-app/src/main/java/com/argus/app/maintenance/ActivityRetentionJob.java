package com.argus.app.maintenance;

import com.argus.activity.memory.InMemoryActivityHub;
import com.argus.common.config.ArgusConfig;
import com.argus.common.config.ConfigService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Periodic sweep: fails abandoned sessions and prunes old activity.
 */
@Slf4j
@Component
public class ActivityRetentionJob {

    private final InMemoryActivityHub hub;
    private final ConfigService configService;

    public ActivityRetentionJob(InMemoryActivityHub hub, ConfigService configService) {
        this.hub = hub;
        this.configService = configService;
    }

    public record SweepResult(int failedSessions, int prunedEntries) {
    }

    @Scheduled(fixedDelayString = "#{@configService.loadConfig().retention.sweepIntervalMs}",
            initialDelayString = "#{@configService.loadConfig().retention.sweepIntervalMs}")
    public void scheduledSweep() {
        try {
            sweep();
        } catch (RuntimeException e) {
            log.error("Activity retention sweep failed", e);
        }
    }

    public SweepResult sweep() {
        ArgusConfig.RetentionConfig retention = configService.loadConfig().getRetention();
        int failed = hub.failStaleSessions(Duration.ofMinutes(retention.getStaleSessionMinutes()));
        int pruned = hub.pruneActivityOlderThan(Duration.ofDays(retention.getActivityRetentionDays()));
        if (failed > 0 || pruned > 0) {
            log.info("Retention sweep: {} stale session(s) failed, {} entr(ies) pruned", failed, pruned);
        } else {
            log.debug("Retention sweep: nothing to do");
        }
        return new SweepResult(failed, pruned);
    }
}
