package inbox.triage.app.service;

import inbox.triage.app.model.ReportItem;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Best-effort one or two sentence digest of a platform's social updates.
 * Any failure or unusable output degrades to "N updates".
 */
@Slf4j
@Service
public class SocialDigestService {
    private static final int MAX_ITEMS = 15;
    private static final int MAX_DIGEST_LENGTH = 400;

    private final LanguageModelClient languageModelClient;

    public SocialDigestService(LanguageModelClient languageModelClient) {
        this.languageModelClient = languageModelClient;
    }

    public String summarize(String platform, List<ReportItem> items) {
        String fallback = fallback(items.size());
        if (items.isEmpty()) {
            return fallback;
        }

        StringBuilder updates = new StringBuilder();
        for (ReportItem item : items.subList(0, Math.min(items.size(), MAX_ITEMS))) {
            updates.append(String.format("- Subject: %s | From: %s | Summary: %s%n",
                    item.getSubject(), item.getSender(), item.getClassification().getSummary()));
        }
        String prompt = String.format(
                "These are recent %s notifications:%n%n%s%n" +
                "Write a 1-2 sentence digest of what happened on %s. Plain text only, no lists.",
                platform, updates, platform);

        try {
            String digest = languageModelClient.complete(prompt, 120, 0.4, false);
            if (digest == null || digest.isBlank() || digest.length() > MAX_DIGEST_LENGTH || digest.trim().startsWith("{")) {
                log.warn("Discarding unusable {} digest from {}", platform, languageModelClient.providerName());
                return fallback;
            }
            return digest.trim();
        } catch (Exception e) {
            log.warn("Social digest for {} failed: {}", platform, e.getMessage());
            return fallback;
        }
    }

    static String fallback(int count) {
        return count + (count == 1 ? " update" : " updates");
    }
}
