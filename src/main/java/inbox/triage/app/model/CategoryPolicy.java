package inbox.triage.app.model;

import lombok.Value;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * One row of the retention table: mutations applied on sight plus an optional aging rule.
 */
@Value
public class CategoryPolicy {
    Set<MailboxAction> immediateActions;
    AgingPolicy aging;

    public static CategoryPolicy of(MailboxAction... actions) {
        return new CategoryPolicy(toSet(actions), null);
    }

    public static CategoryPolicy aging(AgingPolicy aging) {
        return new CategoryPolicy(Collections.emptySet(), aging);
    }

    public Optional<AgingPolicy> agingPolicy() {
        return Optional.ofNullable(aging);
    }

    private static Set<MailboxAction> toSet(MailboxAction... actions) {
        if (actions.length == 0) {
            return Collections.emptySet();
        }
        EnumSet<MailboxAction> set = EnumSet.noneOf(MailboxAction.class);
        Collections.addAll(set, actions);
        return Collections.unmodifiableSet(set);
    }
}
