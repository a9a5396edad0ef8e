package inbox.triage.app.model;

import lombok.Value;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * What the retention policy wants done with one message.
 * {@code agedOut} marks an archive caused by the aging threshold rather than the category itself.
 */
@Value
public class RetentionDecision {
    Category category;
    Set<MailboxAction> actions;
    AgingDecision aging;
    boolean agedOut;

    public RetentionDecision(Category category, Set<MailboxAction> actions, AgingDecision aging, boolean agedOut) {
        this.category = category;
        this.actions = actions.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(actions));
        this.aging = aging;
        this.agedOut = agedOut;
    }

    public boolean archives() {
        return actions.contains(MailboxAction.ARCHIVE);
    }

    /**
     * True when the category archives on sight, independent of age.
     */
    public boolean archivesImmediately() {
        return archives() && !agedOut;
    }
}
