package inbox.triage.app.service;

import inbox.triage.app.config.RunSettings;
import inbox.triage.app.model.AgingPolicy;
import inbox.triage.app.model.Category;
import inbox.triage.app.model.CategoryPolicy;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

import static inbox.triage.app.model.MailboxAction.ARCHIVE;
import static inbox.triage.app.model.MailboxAction.MARK_IMPORTANT;
import static inbox.triage.app.model.MailboxAction.MARK_UNREAD;
import static inbox.triage.app.model.MailboxAction.STAR;

/**
 * Per-category retention rules. Adding a category means adding one row here.
 */
@Component
public class RetentionPolicyTable {
    private final Map<Category, CategoryPolicy> policies;

    public RetentionPolicyTable(RunSettings settings) {
        Map<Category, CategoryPolicy> table = new EnumMap<>(Category.class);
        table.put(Category.URGENT, CategoryPolicy.of(MARK_IMPORTANT, MARK_UNREAD));
        table.put(Category.TODO, CategoryPolicy.of(MARK_UNREAD));
        table.put(Category.WAITING, CategoryPolicy.of(MARK_UNREAD));
        table.put(Category.SECURITY_ALERT, CategoryPolicy.of(STAR, MARK_IMPORTANT, MARK_UNREAD));
        table.put(Category.CREATOR_NEWSLETTERS, CategoryPolicy.of(ARCHIVE));
        table.put(Category.SOCIAL_COMMUNITY, CategoryPolicy.of(ARCHIVE));
        table.put(Category.PROMOTIONS, CategoryPolicy.of(ARCHIVE));
        table.put(Category.FINANCIAL, CategoryPolicy.aging(
                new AgingPolicy(settings.getFinancialWarningDays(), settings.getFinancialArchiveDays())));
        table.put(Category.PURCHASES, settings.getPurchasesPolicy() == RunSettings.PurchasesPolicy.AGING
                ? CategoryPolicy.aging(new AgingPolicy(settings.getPurchasesWarningDays(), settings.getPurchasesArchiveDays()))
                : CategoryPolicy.of(ARCHIVE));
        table.put(Category.MISC, CategoryPolicy.of());

        for (Category category : Category.values()) {
            if (!table.containsKey(category)) {
                throw new IllegalStateException("No retention policy for category " + category);
            }
        }
        this.policies = Collections.unmodifiableMap(table);
    }

    public CategoryPolicy policyFor(Category category) {
        return policies.get(category);
    }
}
