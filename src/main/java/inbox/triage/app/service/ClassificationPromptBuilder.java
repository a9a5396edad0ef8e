package inbox.triage.app.service;

import inbox.triage.app.model.Category;
import inbox.triage.app.model.MailMessage;
import org.springframework.stereotype.Component;

/**
 * Builds the classification prompt: the category enumeration with definitions, the output
 * depth rules and a bounded excerpt of the message.
 */
@Component
public class ClassificationPromptBuilder {
    static final int BODY_LIMIT = 2000;
    static final int SHORT_SUMMARY_LIMIT = 110;

    public String build(MailMessage message) {
        StringBuilder categories = new StringBuilder();
        for (Category category : Category.values()) {
            categories.append(String.format("- %s: %s%n", category.getWireName(), category.getDefinition()));
        }

        return String.format(
                "Classify the following email into exactly one of these categories:%n%n%s%n" +
                "Summary rules:%n" +
                "- creator_newsletters: write a long-form summary (3-5 sentences) covering the key points of the issue.%n" +
                "- social_community: write one short highlight and set details.platform to the platform name " +
                "(for example LinkedIn, Reddit, Discord, GitHub).%n" +
                "- every other category: write a single sentence under %d characters.%n%n" +
                "Respond with JSON only, in this shape:%n" +
                "{\"category\": \"<category>\", \"confidence\": <0.0-1.0>, \"summary\": \"...\", " +
                "\"reasoning\": \"...\", \"details\": {}}%n%n" +
                "Subject: %s%n" +
                "From: %s%n%n" +
                "%s",
                categories,
                SHORT_SUMMARY_LIMIT,
                nullToEmpty(message.getSubject()),
                nullToEmpty(message.getSender()),
                excerpt(message.getBodyExcerpt()));
    }

    static String excerpt(String body) {
        if (body == null) {
            return "";
        }
        return body.length() > BODY_LIMIT ? body.substring(0, BODY_LIMIT) + "..." : body;
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
