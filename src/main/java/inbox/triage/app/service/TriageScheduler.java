package inbox.triage.app.service;

import inbox.triage.app.config.RunSettings;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Runs the triage on a cron schedule in the configured mode. Disabled unless triage.schedule.cron is set.
 */
@Slf4j
@Service
public class TriageScheduler {
    private final RunOrchestrator runOrchestrator;
    private final RunSettings settings;

    public TriageScheduler(RunOrchestrator runOrchestrator, RunSettings settings) {
        this.runOrchestrator = runOrchestrator;
        this.settings = settings;
    }

    @Scheduled(cron = "${triage.schedule.cron:-}")
    public void scheduledRun() {
        try {
            runOrchestrator.run(settings.getRunMode());
        } catch (RunInProgressException e) {
            log.info("Skipping scheduled run: {}", e.getMessage());
        }
    }
}
