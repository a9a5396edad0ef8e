package inbox.triage.app.model;

/**
 * Partition of the category taxonomy.
 * ACTION mail needs a human and is never auto-archived; REFERENCE mail is filed away.
 */
public enum Tier {
    ACTION("Action"),
    REFERENCE("Reference");

    private final String labelPrefix;

    Tier(String labelPrefix) {
        this.labelPrefix = labelPrefix;
    }

    public String getLabelPrefix() {
        return labelPrefix;
    }
}
