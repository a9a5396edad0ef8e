package inbox.triage.app.config;

import inbox.triage.app.model.RunMode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.Locale;

/**
 * Binds the triage.* properties into a {@link RunSettings} bean.
 */
@Slf4j
@Configuration
public class TriageConfig {

    @Bean
    public RunSettings runSettings(
            @Value("${triage.run.mode:preview}") String runMode,
            @Value("${triage.run.batch-cap:10}") int batchCap,
            @Value("${triage.run.fetch-cap:100}") int fetchCap,
            @Value("${triage.run.fetch-query:in:inbox}") String fetchQuery,
            @Value("${triage.retention.financial.warning-days:5}") int financialWarningDays,
            @Value("${triage.retention.financial.archive-days:7}") int financialArchiveDays,
            @Value("${triage.retention.purchases.warning-days:3}") int purchasesWarningDays,
            @Value("${triage.retention.purchases.archive-days:5}") int purchasesArchiveDays,
            @Value("${triage.retention.purchases-policy:immediate_archive}") String purchasesPolicy,
            @Value("${triage.report.recipient:}") String reportRecipient,
            @Value("${triage.report.sender:}") String reportSender,
            @Value("${triage.report.subject-marker:[Inbox Digest]}") String subjectMarker,
            @Value("${triage.report.operator-recipient:}") String operatorRecipient,
            @Value("${triage.report.social-digest-enabled:true}") boolean socialDigestEnabled) {

        if (financialWarningDays > financialArchiveDays) {
            throw new IllegalStateException("triage.retention.financial.warning-days must not exceed archive-days");
        }
        if (purchasesWarningDays > purchasesArchiveDays) {
            throw new IllegalStateException("triage.retention.purchases.warning-days must not exceed archive-days");
        }
        if (reportRecipient.isBlank()) {
            log.warn("triage.report.recipient is not configured. Reports cannot be delivered.");
        }

        RunSettings settings = RunSettings.builder()
                .runMode(RunMode.parse(runMode))
                .batchCap(batchCap)
                .fetchCap(fetchCap)
                .fetchQuery(fetchQuery)
                .financialWarningDays(financialWarningDays)
                .financialArchiveDays(financialArchiveDays)
                .purchasesWarningDays(purchasesWarningDays)
                .purchasesArchiveDays(purchasesArchiveDays)
                .purchasesPolicy(RunSettings.PurchasesPolicy.valueOf(purchasesPolicy.trim().toUpperCase(Locale.ROOT)))
                .reportRecipient(reportRecipient)
                .reportSender(reportSender)
                .reportSubjectMarker(subjectMarker)
                .operatorRecipient(operatorRecipient)
                .socialDigestEnabled(socialDigestEnabled)
                .build();
        log.info("Triage configured: mode={}, batchCap={}, fetchCap={}, purchasesPolicy={}",
                settings.getRunMode(), batchCap, fetchCap, settings.getPurchasesPolicy());
        return settings;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
