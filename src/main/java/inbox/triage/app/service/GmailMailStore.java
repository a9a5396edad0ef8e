package inbox.triage.app.service;

import com.google.api.services.gmail.Gmail;
import com.google.api.services.gmail.model.Label;
import com.google.api.services.gmail.model.ListLabelsResponse;
import com.google.api.services.gmail.model.ListThreadsResponse;
import com.google.api.services.gmail.model.Message;
import com.google.api.services.gmail.model.MessagePart;
import com.google.api.services.gmail.model.MessagePartHeader;
import com.google.api.services.gmail.model.ModifyMessageRequest;
import com.google.api.services.gmail.model.ModifyThreadRequest;
import com.google.api.services.gmail.model.Thread;
import inbox.triage.app.model.MailLabel;
import inbox.triage.app.model.MailMessage;
import jakarta.mail.MessagingException;
import jakarta.mail.Session;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeMessage;
import lombok.extern.slf4j.Slf4j;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link MailStore} backed by the Gmail API for the authorized mailbox ("me").
 */
@Slf4j
public class GmailMailStore implements MailStore {
    private static final String USER_ID = "me";
    private static final String INBOX = "INBOX";
    private static final String STARRED = "STARRED";
    private static final String IMPORTANT = "IMPORTANT";
    private static final String UNREAD = "UNREAD";
    private static final int EXCERPT_LIMIT = 4000;

    private final Gmail gmail;
    private final Map<String, String> labelNamesById = new ConcurrentHashMap<>();

    public GmailMailStore(Gmail gmail) {
        this.gmail = gmail;
    }

    /**
     * Lists the most recent conversations matching {@code query} and returns the newest
     * message of each, so every conversation is classified once.
     */
    @Override
    public List<MailMessage> fetchRecent(String query, int maxResults) throws Exception {
        ListThreadsResponse response = gmail.users().threads().list(USER_ID)
                .setQ(query)
                .setMaxResults((long) maxResults)
                .execute();

        List<MailMessage> messages = new ArrayList<>();
        if (response.getThreads() != null) {
            for (Thread ref : response.getThreads()) {
                Thread thread = gmail.users().threads().get(USER_ID, ref.getId())
                        .setFormat("full")
                        .execute();
                newestMessage(thread).ifPresent(message -> messages.add(toMailMessage(message)));
            }
        }
        log.debug("Fetched {} conversations for query '{}'", messages.size(), query);
        return messages;
    }

    static Optional<Message> newestMessage(Thread thread) {
        if (thread.getMessages() == null) {
            return Optional.empty();
        }
        return thread.getMessages().stream()
                .max(Comparator.comparing((Message message) -> message.getInternalDate() != null ? message.getInternalDate() : 0L));
    }

    MailMessage toMailMessage(Message message) {
        String subject = "";
        String from = "";
        if (message.getPayload() != null && message.getPayload().getHeaders() != null) {
            for (MessagePartHeader header : message.getPayload().getHeaders()) {
                switch (header.getName().toLowerCase(Locale.ROOT)) {
                    case "subject":
                        subject = header.getValue();
                        break;
                    case "from":
                        from = header.getValue();
                        break;
                    default:
                        break;
                }
            }
        }

        String body = message.getPayload() != null ? extractPlainText(message.getPayload()) : null;
        if (body == null || body.isBlank()) {
            body = message.getSnippet() != null ? message.getSnippet() : "";
        }
        if (body.length() > EXCERPT_LIMIT) {
            body = body.substring(0, EXCERPT_LIMIT);
        }

        List<String> labelIds = message.getLabelIds() != null ? message.getLabelIds() : Collections.emptyList();
        Instant receivedAt = message.getInternalDate() != null
                ? Instant.ofEpochMilli(message.getInternalDate())
                : Instant.now();

        return MailMessage.builder()
                .id(message.getId())
                .threadId(message.getThreadId())
                .subject(subject)
                .sender(from)
                .bodyExcerpt(body)
                .receivedAt(receivedAt)
                .unread(labelIds.contains(UNREAD))
                .starred(labelIds.contains(STARRED))
                .important(labelIds.contains(IMPORTANT))
                .archived(!labelIds.contains(INBOX))
                .build();
    }

    /**
     * First text/plain part found depth-first; HTML-only messages fall back to the snippet.
     */
    private String extractPlainText(MessagePart part) {
        if ("text/plain".equals(part.getMimeType()) && part.getBody() != null && part.getBody().getData() != null) {
            try {
                byte[] decoded = Base64.getUrlDecoder().decode(part.getBody().getData());
                return new String(decoded, StandardCharsets.UTF_8);
            } catch (IllegalArgumentException e) {
                log.warn("Error decoding email body part: {}", e.getMessage());
            }
        }
        if (part.getParts() != null) {
            for (MessagePart subPart : part.getParts()) {
                String text = extractPlainText(subPart);
                if (text != null && !text.isBlank()) {
                    return text;
                }
            }
        }
        return null;
    }

    @Override
    public List<MailLabel> getThreadLabels(String threadId) throws Exception {
        Thread thread = gmail.users().threads().get(USER_ID, threadId)
                .setFormat("minimal")
                .execute();

        Set<String> labelIds = new LinkedHashSet<>();
        if (thread.getMessages() != null) {
            for (Message message : thread.getMessages()) {
                if (message.getLabelIds() != null) {
                    labelIds.addAll(message.getLabelIds());
                }
            }
        }

        List<MailLabel> labels = new ArrayList<>();
        for (String labelId : labelIds) {
            String name = labelNamesById.get(labelId);
            if (name == null) {
                refreshLabelNames();
                name = labelNamesById.getOrDefault(labelId, labelId);
            }
            labels.add(new MailLabel(labelId, name));
        }
        return labels;
    }

    @Override
    public Optional<MailLabel> findLabel(String name) throws Exception {
        refreshLabelNames();
        return labelNamesById.entrySet().stream()
                .filter(entry -> entry.getValue().equals(name))
                .map(entry -> new MailLabel(entry.getKey(), entry.getValue()))
                .findFirst();
    }

    @Override
    public MailLabel createLabel(String name) throws Exception {
        Label label = new Label()
                .setName(name)
                .setLabelListVisibility("labelShow")
                .setMessageListVisibility("show");
        Label created = gmail.users().labels().create(USER_ID, label).execute();
        labelNamesById.put(created.getId(), created.getName());
        log.info("Created label {} ({})", created.getName(), created.getId());
        return new MailLabel(created.getId(), created.getName());
    }

    private void refreshLabelNames() throws Exception {
        ListLabelsResponse response = gmail.users().labels().list(USER_ID).execute();
        if (response.getLabels() != null) {
            for (Label label : response.getLabels()) {
                labelNamesById.put(label.getId(), label.getName());
            }
        }
    }

    @Override
    public void addLabel(String threadId, MailLabel label) throws Exception {
        modifyThread(threadId, List.of(label.getId()), Collections.emptyList());
    }

    @Override
    public void removeLabel(String threadId, MailLabel label) throws Exception {
        modifyThread(threadId, Collections.emptyList(), List.of(label.getId()));
    }

    @Override
    public void archiveThread(String threadId) throws Exception {
        // Archiving in Gmail is removing the INBOX label from the thread
        modifyThread(threadId, Collections.emptyList(), List.of(INBOX));
    }

    @Override
    public void starMessage(String messageId) throws Exception {
        modifyMessage(messageId, List.of(STARRED), Collections.emptyList());
    }

    @Override
    public void markThreadImportant(String threadId) throws Exception {
        modifyThread(threadId, List.of(IMPORTANT), Collections.emptyList());
    }

    @Override
    public void markUnread(String messageId) throws Exception {
        modifyMessage(messageId, List.of(UNREAD), Collections.emptyList());
    }

    @Override
    public void markRead(String messageId) throws Exception {
        modifyMessage(messageId, Collections.emptyList(), List.of(UNREAD));
    }

    private void modifyThread(String threadId, List<String> add, List<String> remove) throws Exception {
        ModifyThreadRequest request = new ModifyThreadRequest()
                .setAddLabelIds(add)
                .setRemoveLabelIds(remove);
        gmail.users().threads().modify(USER_ID, threadId, request).execute();
    }

    private void modifyMessage(String messageId, List<String> add, List<String> remove) throws Exception {
        ModifyMessageRequest request = new ModifyMessageRequest()
                .setAddLabelIds(add)
                .setRemoveLabelIds(remove);
        gmail.users().messages().modify(USER_ID, messageId, request).execute();
    }

    @Override
    public void sendHtml(String to, String subject, String htmlBody) throws Exception {
        Message message = new Message().setRaw(encodeRaw(to, subject, htmlBody));
        Message sent = gmail.users().messages().send(USER_ID, message).execute();
        log.info("Sent message {} to {}", sent.getId(), to);
    }

    static String encodeRaw(String to, String subject, String htmlBody) throws MessagingException, IOException {
        MimeMessage email = new MimeMessage(Session.getInstance(new Properties()));
        email.setRecipient(jakarta.mail.Message.RecipientType.TO, new InternetAddress(to));
        email.setSubject(subject, "UTF-8");
        email.setContent(htmlBody, "text/html; charset=UTF-8");

        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        email.writeTo(buffer);
        return Base64.getUrlEncoder().encodeToString(buffer.toByteArray());
    }
}
