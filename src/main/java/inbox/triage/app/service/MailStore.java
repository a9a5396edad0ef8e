package inbox.triage.app.service;

import inbox.triage.app.model.MailLabel;
import inbox.triage.app.model.MailMessage;

import java.util.List;
import java.util.Optional;

/**
 * Interface for mailbox operations.
 * This abstraction allows for easier testing and potential future implementations.
 */
public interface MailStore {
    /**
     * Fetch the most recent messages matching a mailbox view, newest first.
     * @param query Mailbox view query (e.g. "in:inbox")
     * @param maxResults Maximum number of messages to return
     * @return Messages with subject, sender, body excerpt and timestamp populated
     * @throws Exception if the API call fails
     */
    List<MailMessage> fetchRecent(String query, int maxResults) throws Exception;

    /**
     * Labels currently attached to any message of a thread.
     */
    List<MailLabel> getThreadLabels(String threadId) throws Exception;

    Optional<MailLabel> findLabel(String name) throws Exception;

    MailLabel createLabel(String name) throws Exception;

    void addLabel(String threadId, MailLabel label) throws Exception;

    void removeLabel(String threadId, MailLabel label) throws Exception;

    /**
     * Archive a thread (removes the INBOX label). Archiving an archived thread is a no-op.
     */
    void archiveThread(String threadId) throws Exception;

    void starMessage(String messageId) throws Exception;

    void markThreadImportant(String threadId) throws Exception;

    void markUnread(String messageId) throws Exception;

    void markRead(String messageId) throws Exception;

    /**
     * Send a new message with an HTML body from the mailbox owner.
     */
    void sendHtml(String to, String subject, String htmlBody) throws Exception;
}
