package inbox.triage.app.service;

import inbox.triage.app.model.AgingAction;
import inbox.triage.app.model.AgingDecision;
import inbox.triage.app.model.Category;
import inbox.triage.app.model.CategoryPolicy;
import inbox.triage.app.model.MailMessage;
import inbox.triage.app.model.MailboxAction;
import inbox.triage.app.model.RetentionDecision;
import inbox.triage.app.model.RunContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.Set;

/**
 * Decides and applies the retention policy for a classified message.
 * {@link #decide} is pure; {@link #apply} performs the mailbox mutations when the run allows them.
 */
@Slf4j
@Service
public class RetentionPolicyEngine {
    private static final long MILLIS_PER_DAY = Duration.ofDays(1).toMillis();

    private final RetentionPolicyTable policyTable;
    private final MailStore mailStore;

    public RetentionPolicyEngine(RetentionPolicyTable policyTable, MailStore mailStore) {
        this.policyTable = policyTable;
        this.mailStore = mailStore;
    }

    /**
     * Whole days elapsed between {@code receivedAt} and {@code now}, floored. Future timestamps count as 0.
     */
    public static long ageInDays(Instant receivedAt, Instant now) {
        if (receivedAt == null) {
            return 0;
        }
        long elapsed = now.toEpochMilli() - receivedAt.toEpochMilli();
        return Math.max(0, Math.floorDiv(elapsed, MILLIS_PER_DAY));
    }

    public RetentionDecision decide(Category category, long daysOld) {
        CategoryPolicy policy = policyTable.policyFor(category);
        Set<MailboxAction> actions = policy.getImmediateActions().isEmpty()
                ? EnumSet.noneOf(MailboxAction.class)
                : EnumSet.copyOf(policy.getImmediateActions());

        AgingDecision aging = policy.agingPolicy()
                .map(rule -> rule.evaluate(daysOld))
                .orElse(AgingDecision.keep(daysOld));

        boolean agedOut = aging.getAction() == AgingAction.ARCHIVE;
        if (agedOut) {
            actions.add(MailboxAction.ARCHIVE);
        }
        return new RetentionDecision(category, actions, aging, agedOut);
    }

    public RetentionDecision decide(MailMessage message, Category category, RunContext context) {
        return decide(category, ageInDays(message.getReceivedAt(), context.getNow()));
    }

    /**
     * Apply the decided mutations. A no-op in preview mode.
     * @throws Exception if the mail store rejects a mutation
     */
    public void apply(MailMessage message, RetentionDecision decision, RunContext context) throws Exception {
        if (!context.mutationsAllowed() || decision.getActions().isEmpty()) {
            return;
        }

        for (MailboxAction action : decision.getActions()) {
            switch (action) {
                case STAR:
                    mailStore.starMessage(message.getId());
                    break;
                case MARK_IMPORTANT:
                    mailStore.markThreadImportant(message.getThreadId());
                    break;
                case MARK_UNREAD:
                    mailStore.markUnread(message.getId());
                    break;
                case ARCHIVE:
                    if (message.isArchived()) {
                        log.debug("Thread {} is already out of the inbox", message.getThreadId());
                    } else {
                        mailStore.archiveThread(message.getThreadId());
                    }
                    break;
                default:
                    throw new IllegalStateException("Unhandled mailbox action " + action);
            }
        }
        log.debug("Applied {} to message {}", decision.getActions(), message.getId());
    }
}
