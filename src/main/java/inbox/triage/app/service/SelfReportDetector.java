package inbox.triage.app.service;

import inbox.triage.app.config.RunSettings;
import inbox.triage.app.model.MailMessage;
import jakarta.mail.internet.AddressException;
import jakarta.mail.internet.InternetAddress;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Recognizes digests sent by a previous run so they are never classified again.
 * The sender address must equal the report sender exactly (ignoring case and display name).
 */
@Slf4j
@Component
public class SelfReportDetector {
    private final String reportAddress;
    private final String subjectMarker;

    public SelfReportDetector(RunSettings settings) {
        String sender = settings.getReportSender();
        if (sender == null || sender.isBlank()) {
            sender = settings.getReportRecipient();
        }
        this.reportAddress = addressOf(sender).orElse("");
        this.subjectMarker = settings.getReportSubjectMarker() != null ? settings.getReportSubjectMarker() : "";
    }

    public boolean isOwnReport(MailMessage message) {
        if (reportAddress.isEmpty() || subjectMarker.isEmpty()) {
            return false;
        }
        String subject = message.getSubject() != null ? message.getSubject() : "";
        if (!subject.contains(subjectMarker)) {
            return false;
        }
        return addressOf(message.getSender())
                .map(reportAddress::equalsIgnoreCase)
                .orElse(false);
    }

    static Optional<String> addressOf(String header) {
        if (header == null || header.isBlank()) {
            return Optional.empty();
        }
        try {
            InternetAddress[] addresses = InternetAddress.parseHeader(header.trim(), false);
            if (addresses.length == 0 || addresses[0].getAddress() == null) {
                return Optional.empty();
            }
            return Optional.of(addresses[0].getAddress().trim());
        } catch (AddressException e) {
            log.debug("Unparseable sender '{}': {}", header, e.getMessage());
            return Optional.empty();
        }
    }
}
