package inbox.triage.app.controller;

import inbox.triage.app.config.RunSettings;
import inbox.triage.app.model.Category;
import inbox.triage.app.model.RunMode;
import inbox.triage.app.model.RunOutcome;
import inbox.triage.app.model.RunResult;
import inbox.triage.app.service.RunInProgressException;
import inbox.triage.app.service.RunOrchestrator;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Manual trigger for a triage run. Without a mode parameter the configured mode is used.
 */
@RestController
@RequestMapping("/api/runs")
public class RunController {
    private final RunOrchestrator runOrchestrator;
    private final RunSettings settings;

    public RunController(RunOrchestrator runOrchestrator, RunSettings settings) {
        this.runOrchestrator = runOrchestrator;
        this.settings = settings;
    }

    @PostMapping
    public ResponseEntity<Map<String, Object>> triggerRun(@RequestParam(required = false) String mode) {
        RunMode runMode;
        try {
            runMode = mode != null ? RunMode.parse(mode) : settings.getRunMode();
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }

        try {
            RunOutcome outcome = runOrchestrator.run(runMode);
            return ResponseEntity.status(outcome.isSuccessful() ? HttpStatus.OK : HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(toBody(runMode, outcome));
        } catch (RunInProgressException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", e.getMessage()));
        }
    }

    @GetMapping("/state")
    public Map<String, Object> state() {
        return Map.of("state", runOrchestrator.getState().name());
    }

    private Map<String, Object> toBody(RunMode runMode, RunOutcome outcome) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("mode", runMode.name());
        body.put("state", outcome.getState().name());
        if (outcome.getFailure() != null) {
            body.put("failure", outcome.getFailure());
        }
        RunResult result = outcome.getResult();
        if (result != null) {
            Map<String, Integer> categories = new LinkedHashMap<>();
            for (Category category : Category.values()) {
                categories.put(category.getWireName(), result.getItems(category).size());
            }
            body.put("categories", categories);
            body.put("processed", result.getProcessedCount());
            body.put("agedArchived", result.getAgedArchivedCount());
            body.put("skippedReports", result.getSkippedReportCount());
            body.put("errors", result.getErrors().size());
        }
        return body;
    }
}
