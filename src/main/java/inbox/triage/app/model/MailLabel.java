package inbox.triage.app.model;

import lombok.Value;

@Value
public class MailLabel {
    String id;
    String name;
}
