package inbox.triage.app.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class ReportItem {
    String messageId;
    String threadId;
    String subject;
    String sender;
    Instant receivedAt;
    Classification classification;
    long daysOld;
    String agingWarning;
    boolean archived;
    boolean labeled;
}
