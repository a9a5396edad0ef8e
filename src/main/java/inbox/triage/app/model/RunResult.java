package inbox.triage.app.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregate of one run, handed to the report renderer once finished.
 * Mutated only by the orchestrating thread; every mutator rejects calls after {@link #finish()}.
 */
public class RunResult {
    private final RunMode runMode;
    private final Instant startedAt;
    private final Map<Category, List<ReportItem>> itemsByCategory = new EnumMap<>(Category.class);
    private final List<ProcessingError> errors = new ArrayList<>();
    private final Map<Category, Integer> autoArchivedCounts = new EnumMap<>(Category.class);
    private final Map<String, String> socialDigests = new LinkedHashMap<>();
    private int agedArchivedCount;
    private int skippedReportCount;
    private int processedCount;
    private Instant finishedAt;

    public RunResult(RunMode runMode, Instant startedAt) {
        this.runMode = runMode;
        this.startedAt = startedAt;
        for (Category category : Category.values()) {
            itemsByCategory.put(category, new ArrayList<>());
        }
    }

    public void addItem(Category category, ReportItem item) {
        ensureOpen();
        itemsByCategory.get(category).add(item);
        processedCount++;
    }

    public void incrementAutoArchived(Category category) {
        ensureOpen();
        autoArchivedCounts.merge(category, 1, Integer::sum);
    }

    public void incrementAgedArchived() {
        ensureOpen();
        agedArchivedCount++;
        processedCount++;
    }

    public void incrementSkippedReports() {
        ensureOpen();
        skippedReportCount++;
    }

    public void addError(ProcessingError error) {
        ensureOpen();
        errors.add(error);
    }

    public void putSocialDigest(String platform, String digest) {
        ensureOpen();
        socialDigests.put(platform, digest);
    }

    public void finish(Instant at) {
        ensureOpen();
        this.finishedAt = at;
    }

    public boolean isFinished() {
        return finishedAt != null;
    }

    private void ensureOpen() {
        if (finishedAt != null) {
            throw new IllegalStateException("Run result is finished and read-only");
        }
    }

    public RunMode getRunMode() {
        return runMode;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Instant getFinishedAt() {
        return finishedAt;
    }

    public List<ReportItem> getItems(Category category) {
        return Collections.unmodifiableList(itemsByCategory.get(category));
    }

    public List<ProcessingError> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    public int getAutoArchivedCount(Category category) {
        return autoArchivedCounts.getOrDefault(category, 0);
    }

    public Map<Category, Integer> getAutoArchivedCounts() {
        return Collections.unmodifiableMap(autoArchivedCounts);
    }

    public Map<String, String> getSocialDigests() {
        return Collections.unmodifiableMap(socialDigests);
    }

    public int getAgedArchivedCount() {
        return agedArchivedCount;
    }

    public int getSkippedReportCount() {
        return skippedReportCount;
    }

    public int getProcessedCount() {
        return processedCount;
    }

    public int getListedCount() {
        return itemsByCategory.values().stream().mapToInt(List::size).sum();
    }

    public int getActionCount() {
        return itemsByCategory.entrySet().stream()
                .filter(e -> e.getKey().isActionTier())
                .mapToInt(e -> e.getValue().size())
                .sum();
    }
}
