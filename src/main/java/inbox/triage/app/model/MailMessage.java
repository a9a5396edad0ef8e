package inbox.triage.app.model;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/**
 * A message as read from the mail store. The store owns the mailbox; this is only a handle
 * carrying the fields the engine needs plus the ids used to mutate it.
 */
@Data
@Builder(toBuilder = true)
public class MailMessage {
    private String id;
    private String threadId;
    private String subject;
    private String sender;
    private String bodyExcerpt;
    private Instant receivedAt;
    private boolean unread;
    private boolean starred;
    private boolean important;
    /** Already out of the inbox when fetched. */
    private boolean archived;
}
