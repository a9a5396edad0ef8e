package inbox.triage.app.model;

public enum RunState {
    IDLE,
    FETCHING,
    PROCESSING,
    REPORTING,
    DONE,
    FAILED
}
