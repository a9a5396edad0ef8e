package inbox.triage.app.model;

/**
 * Mailbox mutations the retention policy can trigger.
 */
public enum MailboxAction {
    ARCHIVE,
    STAR,
    MARK_IMPORTANT,
    MARK_UNREAD
}
