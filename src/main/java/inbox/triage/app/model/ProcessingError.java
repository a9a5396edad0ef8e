package inbox.triage.app.model;

import lombok.Value;

@Value
public class ProcessingError {
    String messageId;
    String subject;
    String sender;
    String error;
}
