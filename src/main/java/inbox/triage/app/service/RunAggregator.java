package inbox.triage.app.service;

import inbox.triage.app.model.Category;
import inbox.triage.app.model.Classification;
import inbox.triage.app.model.MailMessage;
import inbox.triage.app.model.ReportItem;
import inbox.triage.app.model.RetentionDecision;
import inbox.triage.app.model.RunResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Folds per-message outcomes into the run's {@link RunResult}.
 */
@Slf4j
@Service
public class RunAggregator {
    static final String PLATFORM_DETAIL = "platform";
    static final String OTHER_PLATFORM = "Other";

    private final SocialDigestService socialDigestService;

    public RunAggregator(SocialDigestService socialDigestService) {
        this.socialDigestService = socialDigestService;
    }

    public void record(RunResult result, MailMessage message, Classification classification,
                       RetentionDecision decision, boolean labeled) {
        Category category = classification.getCategory();

        if (decision.isAgedOut()) {
            result.incrementAgedArchived();
            return;
        }
        if (decision.archivesImmediately() && !category.isActionTier()) {
            result.incrementAutoArchived(category);
        }

        result.addItem(category, ReportItem.builder()
                .messageId(message.getId())
                .threadId(message.getThreadId())
                .subject(message.getSubject())
                .sender(message.getSender())
                .receivedAt(message.getReceivedAt())
                .classification(classification)
                .daysOld(decision.getAging().getDaysOld())
                .agingWarning(decision.getAging().warning().orElse(null))
                .archived(decision.archives())
                .labeled(labeled)
                .build());
    }

    /**
     * Group social items by platform and attach a digest per platform.
     */
    public void summarizeSocial(RunResult result) {
        Map<String, List<ReportItem>> byPlatform = groupByPlatform(result.getItems(Category.SOCIAL_COMMUNITY));
        for (Map.Entry<String, List<ReportItem>> entry : byPlatform.entrySet()) {
            result.putSocialDigest(entry.getKey(), socialDigestService.summarize(entry.getKey(), entry.getValue()));
        }
        log.debug("Social digests built for {} platforms", byPlatform.size());
    }

    static Map<String, List<ReportItem>> groupByPlatform(List<ReportItem> items) {
        Map<String, List<ReportItem>> byPlatform = new LinkedHashMap<>();
        for (ReportItem item : items) {
            String platform = item.getClassification().detail(PLATFORM_DETAIL)
                    .map(String::trim)
                    .orElse(OTHER_PLATFORM);
            byPlatform.computeIfAbsent(platform, key -> new ArrayList<>()).add(item);
        }
        return byPlatform;
    }
}
