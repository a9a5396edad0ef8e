package inbox.triage.app.model;

public enum AgingAction {
    KEEP,
    WARN,
    ARCHIVE
}
