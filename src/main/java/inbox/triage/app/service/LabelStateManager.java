package inbox.triage.app.service;

import inbox.triage.app.model.Category;
import inbox.triage.app.model.MailLabel;
import inbox.triage.app.model.MailMessage;
import inbox.triage.app.model.RunContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps exactly one managed label on a thread. Labels outside the managed taxonomy are never touched.
 */
@Slf4j
@Service
public class LabelStateManager {
    private final MailStore mailStore;
    private final Map<String, MailLabel> labelCache = new ConcurrentHashMap<>();

    public LabelStateManager(MailStore mailStore) {
        this.mailStore = mailStore;
    }

    /**
     * Drops labels resolved by a previous run. Called once at the start of every run.
     */
    public void resetCache() {
        labelCache.clear();
    }

    /**
     * Replace whatever managed label the thread carries with the canonical label for {@code category}.
     * @return true if the thread now carries the category's label, false in preview mode or on failure
     */
    public boolean applyCategory(MailMessage message, Category category, RunContext context) {
        if (!context.mutationsAllowed()) {
            return false;
        }

        String target = category.getLabelName();
        try {
            List<MailLabel> current = mailStore.getThreadLabels(message.getThreadId());
            boolean alreadyLabeled = false;
            for (MailLabel label : current) {
                if (!Category.isManagedLabel(label.getName())) {
                    continue;
                }
                if (label.getName().equals(target)) {
                    alreadyLabeled = true;
                    labelCache.putIfAbsent(target, label);
                } else {
                    mailStore.removeLabel(message.getThreadId(), label);
                    log.debug("Removed stale label {} from thread {}", label.getName(), message.getThreadId());
                }
            }

            if (!alreadyLabeled) {
                mailStore.addLabel(message.getThreadId(), resolve(target));
            }
            return true;
        } catch (Exception e) {
            log.warn("Failed to apply label {} to thread {}: {}", target, message.getThreadId(), e.getMessage());
            return false;
        }
    }

    MailLabel resolve(String name) throws Exception {
        MailLabel cached = labelCache.get(name);
        if (cached != null) {
            return cached;
        }
        MailLabel label = mailStore.findLabel(name).orElse(null);
        if (label == null) {
            label = mailStore.createLabel(name);
        }
        labelCache.put(name, label);
        return label;
    }
}
