package inbox.triage.app.config;

import inbox.triage.app.model.RunMode;
import lombok.Builder;
import lombok.Value;

/**
 * Run configuration loaded before the engine runs. Built by {@link TriageConfig}.
 */
@Value
@Builder(toBuilder = true)
public class RunSettings {
    public enum PurchasesPolicy {
        IMMEDIATE_ARCHIVE,
        AGING
    }

    @Builder.Default
    RunMode runMode = RunMode.PREVIEW;
    @Builder.Default
    int batchCap = 10;
    @Builder.Default
    int fetchCap = 100;
    @Builder.Default
    String fetchQuery = "in:inbox";

    @Builder.Default
    int financialWarningDays = 5;
    @Builder.Default
    int financialArchiveDays = 7;
    @Builder.Default
    int purchasesWarningDays = 3;
    @Builder.Default
    int purchasesArchiveDays = 5;
    @Builder.Default
    PurchasesPolicy purchasesPolicy = PurchasesPolicy.IMMEDIATE_ARCHIVE;

    String reportRecipient;
    String reportSender;
    @Builder.Default
    String reportSubjectMarker = "[Inbox Digest]";
    String operatorRecipient;
    @Builder.Default
    boolean socialDigestEnabled = true;

    public String alertRecipient() {
        return operatorRecipient != null && !operatorRecipient.isBlank() ? operatorRecipient : reportRecipient;
    }
}
