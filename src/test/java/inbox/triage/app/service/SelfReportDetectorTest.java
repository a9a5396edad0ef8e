package inbox.triage.app.service;

import inbox.triage.app.config.RunSettings;
import inbox.triage.app.model.MailMessage;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SelfReportDetectorTest {

    private static final String SUBJECT = "[Inbox Digest] 2024-05-10: 3 need action, 12 total";

    private final SelfReportDetector detector = new SelfReportDetector(RunSettings.builder()
            .reportRecipient("me@example.com")
            .build());

    private MailMessage from(String sender, String subject) {
        return MailMessage.builder().id("m1").threadId("t1").sender(sender).subject(subject).build();
    }

    @Test
    void isOwnReport_WithReportAddressAndMarker_ShouldMatch() {
        assertTrue(detector.isOwnReport(from("me@example.com", SUBJECT)));
        assertTrue(detector.isOwnReport(from("Inbox Triage <ME@Example.com>", SUBJECT)));
    }

    @Test
    void isOwnReport_WithAddressContainingReportAddress_ShouldNotMatch() {
        assertFalse(detector.isOwnReport(from("Jamie <jame@example.com>", "Fwd: " + SUBJECT)));
        assertFalse(detector.isOwnReport(from("notme@example.com", SUBJECT)));
        assertFalse(detector.isOwnReport(from("me@example.com.evil.test", SUBJECT)));
    }

    @Test
    void isOwnReport_WithoutMarker_ShouldNotMatch() {
        assertFalse(detector.isOwnReport(from("me@example.com", "Lunch on Friday?")));
    }

    @Test
    void isOwnReport_WithUnparseableSender_ShouldNotMatch() {
        assertFalse(detector.isOwnReport(from("<<<", SUBJECT)));
        assertFalse(detector.isOwnReport(from(null, SUBJECT)));
    }

    @Test
    void isOwnReport_ShouldPreferConfiguredReportSender() {
        SelfReportDetector withSender = new SelfReportDetector(RunSettings.builder()
                .reportRecipient("me@example.com")
                .reportSender("digest@example.com")
                .build());

        assertTrue(withSender.isOwnReport(from("Digest <digest@example.com>", SUBJECT)));
        assertFalse(withSender.isOwnReport(from("me@example.com", SUBJECT)));
    }

    @Test
    void isOwnReport_WithoutConfiguredAddress_ShouldNeverMatch() {
        SelfReportDetector unconfigured = new SelfReportDetector(RunSettings.builder().build());

        assertFalse(unconfigured.isOwnReport(from("me@example.com", SUBJECT)));
    }
}
