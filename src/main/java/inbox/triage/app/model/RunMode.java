package inbox.triage.app.model;

import java.util.Locale;

/**
 * Mutation permission and batch size policy for one run.
 */
public enum RunMode {
    PREVIEW,
    LIMITED,
    FULL;

    public boolean allowsMutation() {
        return this != PREVIEW;
    }

    /**
     * Number of fetched messages to process: capped only in LIMITED mode.
     */
    public int batchSize(int fetched, int batchCap) {
        if (this == LIMITED) {
            return Math.max(0, Math.min(fetched, batchCap));
        }
        return fetched;
    }

    public static RunMode parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Run mode is required (preview, limited or full)");
        }
        try {
            return RunMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown run mode '" + value + "', expected preview, limited or full", e);
        }
    }
}
