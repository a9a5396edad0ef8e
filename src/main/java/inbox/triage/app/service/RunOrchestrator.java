package inbox.triage.app.service;

import inbox.triage.app.config.RunSettings;
import inbox.triage.app.model.Classification;
import inbox.triage.app.model.MailMessage;
import inbox.triage.app.model.ProcessingError;
import inbox.triage.app.model.RetentionDecision;
import inbox.triage.app.model.RunContext;
import inbox.triage.app.model.RunMode;
import inbox.triage.app.model.RunOutcome;
import inbox.triage.app.model.RunResult;
import inbox.triage.app.model.RunState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Drives one triage run: fetch, then classify, decide, label, apply and aggregate each message
 * in order, then render and send the report.
 *
 * Per-message failures are collected into the report; a failure of the run itself ends in
 * {@link RunState#FAILED} with an operator alert instead of a report.
 */
@Slf4j
@Service
public class RunOrchestrator {
    private final MailStore mailStore;
    private final ClassificationGateway classificationGateway;
    private final RetentionPolicyEngine retentionPolicyEngine;
    private final LabelStateManager labelStateManager;
    private final RunAggregator runAggregator;
    private final SelfReportDetector selfReportDetector;
    private final ReportRenderer reportRenderer;
    private final RunSettings settings;
    private final Clock clock;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile RunState state = RunState.IDLE;

    public RunOrchestrator(
            MailStore mailStore,
            ClassificationGateway classificationGateway,
            RetentionPolicyEngine retentionPolicyEngine,
            LabelStateManager labelStateManager,
            RunAggregator runAggregator,
            SelfReportDetector selfReportDetector,
            ReportRenderer reportRenderer,
            RunSettings settings,
            Clock clock) {
        this.mailStore = mailStore;
        this.classificationGateway = classificationGateway;
        this.retentionPolicyEngine = retentionPolicyEngine;
        this.labelStateManager = labelStateManager;
        this.runAggregator = runAggregator;
        this.selfReportDetector = selfReportDetector;
        this.reportRenderer = reportRenderer;
        this.settings = settings;
        this.clock = clock;
    }

    public RunState getState() {
        return state;
    }

    /**
     * Execute one run in the given mode.
     * @throws RunInProgressException if another run has not finished yet
     */
    public RunOutcome run(RunMode runMode) {
        if (!running.compareAndSet(false, true)) {
            throw new RunInProgressException("A triage run is already in progress");
        }
        try {
            state = RunState.IDLE;
            return execute(new RunContext(runMode, clock.instant()));
        } finally {
            running.set(false);
        }
    }

    private RunOutcome execute(RunContext context) {
        log.info("Triage run started in {} mode", context.getRunMode());
        labelStateManager.resetCache();
        try {
            state = RunState.FETCHING;
            List<MailMessage> conversations = newestPerConversation(fetch());

            state = RunState.PROCESSING;
            int batchSize = context.getRunMode().batchSize(conversations.size(), settings.getBatchCap());
            List<MailMessage> batch = conversations.subList(0, batchSize);
            log.info("Processing {} of {} fetched conversations", batch.size(), conversations.size());

            RunResult result = new RunResult(context.getRunMode(), context.getNow());
            processBatch(batch, result, context);
            if (settings.isSocialDigestEnabled()) {
                runAggregator.summarizeSocial(result);
            }

            state = RunState.REPORTING;
            result.finish(clock.instant());
            sendReport(result);

            state = RunState.DONE;
            log.info("Triage run finished: {} processed, {} listed, {} errors, {} own reports skipped",
                    result.getProcessedCount(), result.getListedCount(), result.getErrors().size(),
                    result.getSkippedReportCount());
            return RunOutcome.done(result);
        } catch (Exception e) {
            RunState failedIn = state;
            state = RunState.FAILED;
            String failure = "Run failed while " + failedIn.name().toLowerCase(Locale.ROOT) + ": " + e.getMessage();
            log.error("Triage run failed in state {}: {}", failedIn, e.getMessage(), e);
            notifyOperator(failure);
            return RunOutcome.failed(failure);
        }
    }

    private List<MailMessage> fetch() {
        try {
            return mailStore.fetchRecent(settings.getFetchQuery(), settings.getFetchCap());
        } catch (Exception e) {
            throw new RunFailedException("Failed to fetch messages: " + e.getMessage(), e);
        }
    }

    /**
     * One message per conversation, the newest one, in the order conversations were first seen.
     * Labels and archiving act on the whole conversation, so it gets a single verdict.
     */
    static List<MailMessage> newestPerConversation(List<MailMessage> fetched) {
        Map<String, MailMessage> newest = new LinkedHashMap<>();
        for (MailMessage message : fetched) {
            String key = message.getThreadId() != null ? message.getThreadId() : message.getId();
            newest.merge(key, message, (current, candidate) -> isNewer(candidate, current) ? candidate : current);
        }
        return new ArrayList<>(newest.values());
    }

    private static boolean isNewer(MailMessage candidate, MailMessage current) {
        if (candidate.getReceivedAt() == null) {
            return false;
        }
        return current.getReceivedAt() == null || candidate.getReceivedAt().isAfter(current.getReceivedAt());
    }

    private void processBatch(List<MailMessage> batch, RunResult result, RunContext context) {
        for (MailMessage message : batch) {
            if (selfReportDetector.isOwnReport(message)) {
                archiveOwnReport(message, context);
                result.incrementSkippedReports();
                continue;
            }
            try {
                processMessage(message, result, context);
            } catch (Exception e) {
                log.error("Failed to process message {}: {}", message.getId(), e.getMessage(), e);
                result.addError(new ProcessingError(message.getId(), message.getSubject(), message.getSender(),
                        e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName()));
            }
        }
    }

    void processMessage(MailMessage message, RunResult result, RunContext context) throws Exception {
        Classification classification = classificationGateway.classify(message);
        RetentionDecision decision = retentionPolicyEngine.decide(message, classification.getCategory(), context);
        boolean labeled = labelStateManager.applyCategory(message, classification.getCategory(), context);
        retentionPolicyEngine.apply(message, decision, context);
        runAggregator.record(result, message, classification, decision, labeled);
    }

    private void archiveOwnReport(MailMessage message, RunContext context) {
        if (!context.mutationsAllowed()) {
            return;
        }
        try {
            mailStore.archiveThread(message.getThreadId());
            log.debug("Archived previous report {}", message.getId());
        } catch (Exception e) {
            log.warn("Failed to archive previous report {}: {}", message.getId(), e.getMessage());
        }
    }

    private void sendReport(RunResult result) {
        String recipient = settings.getReportRecipient();
        if (recipient == null || recipient.isBlank()) {
            throw new RunFailedException("No report recipient configured");
        }
        try {
            mailStore.sendHtml(recipient, reportRenderer.renderSubject(result), reportRenderer.renderHtml(result));
        } catch (Exception e) {
            throw new RunFailedException("Failed to send report: " + e.getMessage(), e);
        }
    }

    private void notifyOperator(String failure) {
        String recipient = settings.alertRecipient();
        if (recipient == null || recipient.isBlank()) {
            log.error("No operator recipient configured, run failure not delivered: {}", failure);
            return;
        }
        try {
            String html = "<html><body><p><strong>Inbox triage run failed.</strong></p><p>"
                    + failure.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;")
                    + "</p></body></html>";
            mailStore.sendHtml(recipient, settings.getReportSubjectMarker() + " Run failed", html);
        } catch (Exception e) {
            log.error("Failed to send run failure alert to {}: {}", recipient, e.getMessage(), e);
        }
    }
}
