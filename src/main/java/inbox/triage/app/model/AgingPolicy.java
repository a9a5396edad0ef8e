package inbox.triage.app.model;

import lombok.Value;

/**
 * Age thresholds for a reference category: warn from {@code warningDays} (inclusive),
 * archive once older than {@code archiveDays}.
 */
@Value
public class AgingPolicy {
    int warningDays;
    int archiveDays;

    public AgingPolicy(int warningDays, int archiveDays) {
        if (warningDays < 0 || archiveDays < warningDays) {
            throw new IllegalArgumentException(
                    "Invalid aging thresholds: warning=" + warningDays + ", archive=" + archiveDays);
        }
        this.warningDays = warningDays;
        this.archiveDays = archiveDays;
    }

    public AgingDecision evaluate(long daysOld) {
        if (daysOld > archiveDays) {
            return AgingDecision.archive(daysOld);
        }
        if (daysOld >= warningDays) {
            long remaining = archiveDays - daysOld + 1;
            return AgingDecision.warn(daysOld, String.format(
                    "%d days old, auto-archives in %d day%s", daysOld, remaining, remaining == 1 ? "" : "s"));
        }
        return AgingDecision.keep(daysOld);
    }
}
