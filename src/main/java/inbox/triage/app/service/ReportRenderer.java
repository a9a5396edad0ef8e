package inbox.triage.app.service;

import inbox.triage.app.model.RunResult;

/**
 * Turns a finished {@link RunResult} into a deliverable report.
 */
public interface ReportRenderer {

    String renderSubject(RunResult result);

    String renderHtml(RunResult result);
}
