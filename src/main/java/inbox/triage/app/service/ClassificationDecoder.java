package inbox.triage.app.service;

import com.fasterxml.jackson.databind.JsonNode;
import inbox.triage.app.model.Category;
import inbox.triage.app.model.Classification;
import inbox.triage.app.model.MailMessage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Iterator;
import java.util.Map;

/**
 * Validates a parsed verdict into a canonical {@link Classification}.
 * Unknown categories become MISC and confidence is clamped into [0,1].
 */
@Slf4j
@Component
public class ClassificationDecoder {
    static final double DEFAULT_CONFIDENCE = 0.5;

    /**
     * Thrown when the payload is not a verdict object at all.
     */
    public static class InvalidVerdictException extends RuntimeException {
        public InvalidVerdictException(String message) {
            super(message);
        }
    }

    public Classification decode(JsonNode verdict, MailMessage message) {
        if (verdict == null || !verdict.isObject()) {
            throw new InvalidVerdictException("Verdict is not a JSON object");
        }

        Category category = decodeCategory(verdict.get("category"), message.getId());
        Classification.ClassificationBuilder builder = Classification.builder()
                .category(category)
                .confidence(clampConfidence(verdict.get("confidence")))
                .summary(decodeSummary(verdict.get("summary"), category, message))
                .reasoning(textOrEmpty(verdict.get("reasoning")));

        JsonNode details = verdict.get("details");
        if (details != null && details.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = details.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                JsonNode value = field.getValue();
                if (value.isValueNode() && !value.isNull()) {
                    builder.detail(field.getKey(), value.asText());
                } else if (value.isContainerNode()) {
                    builder.detail(field.getKey(), value.toString());
                }
            }
        }
        return builder.build();
    }

    private Category decodeCategory(JsonNode node, String messageId) {
        if (node == null || !node.isTextual()) {
            log.warn("Verdict for message {} has no textual category, using misc", messageId);
            return Category.MISC;
        }
        return Category.fromWireName(node.asText()).orElseGet(() -> {
            log.warn("Verdict category '{}' for message {} is not in the taxonomy, using misc", node.asText(), messageId);
            return Category.MISC;
        });
    }

    static double clampConfidence(JsonNode node) {
        if (node == null || node.isNull()) {
            return DEFAULT_CONFIDENCE;
        }
        double value;
        if (node.isNumber()) {
            value = node.asDouble();
        } else if (node.isTextual()) {
            try {
                value = Double.parseDouble(node.asText().trim());
            } catch (NumberFormatException e) {
                return DEFAULT_CONFIDENCE;
            }
        } else {
            return DEFAULT_CONFIDENCE;
        }
        if (Double.isNaN(value)) {
            return DEFAULT_CONFIDENCE;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }

    private String decodeSummary(JsonNode node, Category category, MailMessage message) {
        String summary = textOrEmpty(node).trim();
        if (summary.isEmpty()) {
            summary = message.getSubject() != null ? message.getSubject() : "";
        }
        if (category != Category.CREATOR_NEWSLETTERS
                && category != Category.SOCIAL_COMMUNITY
                && summary.length() >= ClassificationPromptBuilder.SHORT_SUMMARY_LIMIT) {
            summary = summary.substring(0, ClassificationPromptBuilder.SHORT_SUMMARY_LIMIT - 4) + "...";
        }
        return summary;
    }

    private static String textOrEmpty(JsonNode node) {
        if (node == null || node.isNull() || node.isContainerNode()) {
            return "";
        }
        return node.asText();
    }
}
