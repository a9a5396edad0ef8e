package inbox.triage.app.service;

import inbox.triage.app.config.RunSettings;
import inbox.triage.app.model.Category;
import inbox.triage.app.model.ProcessingError;
import inbox.triage.app.model.ReportItem;
import inbox.triage.app.model.RunMode;
import inbox.triage.app.model.RunResult;
import org.springframework.stereotype.Component;

import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;

/**
 * Minimal default renderer: one section per non-empty category, the archive tally and the error list.
 */
@Component
public class BasicHtmlReportRenderer implements ReportRenderer {
    private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd").withZone(ZoneOffset.UTC);

    private final String subjectMarker;

    public BasicHtmlReportRenderer(RunSettings settings) {
        this.subjectMarker = settings.getReportSubjectMarker();
    }

    @Override
    public String renderSubject(RunResult result) {
        String subject = String.format("%s %s: %d need action, %d total",
                subjectMarker, DATE.format(result.getStartedAt()), result.getActionCount(), result.getProcessedCount());
        return result.getRunMode() == RunMode.PREVIEW ? subject + " (preview)" : subject;
    }

    @Override
    public String renderHtml(RunResult result) {
        StringBuilder html = new StringBuilder("<html><body style='font-family: Arial, sans-serif;'>");
        if (result.getRunMode() == RunMode.PREVIEW) {
            html.append("<p><em>Preview run: no mailbox changes were made.</em></p>");
        }

        for (Category category : Category.values()) {
            List<ReportItem> items = result.getItems(category);
            if (items.isEmpty()) {
                continue;
            }
            html.append("<h3>").append(escapeHtml(category.getLabelName()))
                    .append(" (").append(items.size()).append(")</h3><ul>");
            if (category == Category.SOCIAL_COMMUNITY && !result.getSocialDigests().isEmpty()) {
                for (Map.Entry<String, String> digest : result.getSocialDigests().entrySet()) {
                    html.append("<li><strong>").append(escapeHtml(digest.getKey())).append(":</strong> ")
                            .append(escapeHtml(digest.getValue())).append("</li>");
                }
            } else {
                for (ReportItem item : items) {
                    html.append("<li><strong>").append(escapeHtml(item.getSubject())).append("</strong> - ")
                            .append(escapeHtml(item.getSender())).append("<br>")
                            .append(escapeHtml(item.getClassification().getSummary()));
                    if (item.getAgingWarning() != null) {
                        html.append(" <em>(").append(escapeHtml(item.getAgingWarning())).append(")</em>");
                    }
                    html.append("</li>");
                }
            }
            html.append("</ul>");
        }

        if (!result.getAutoArchivedCounts().isEmpty() || result.getAgedArchivedCount() > 0) {
            html.append("<h3>Auto-archived</h3><ul>");
            for (Map.Entry<Category, Integer> entry : result.getAutoArchivedCounts().entrySet()) {
                html.append("<li>").append(escapeHtml(entry.getKey().getLabelName())).append(": ")
                        .append(entry.getValue()).append("</li>");
            }
            if (result.getAgedArchivedCount() > 0) {
                html.append("<li>Aged out: ").append(result.getAgedArchivedCount()).append("</li>");
            }
            html.append("</ul>");
        }

        if (!result.getErrors().isEmpty()) {
            html.append("<h3>Errors (").append(result.getErrors().size()).append(")</h3><ul>");
            for (ProcessingError error : result.getErrors()) {
                html.append("<li>").append(escapeHtml(error.getSubject())).append(" - ")
                        .append(escapeHtml(error.getSender())).append(": ")
                        .append(escapeHtml(error.getError())).append("</li>");
            }
            html.append("</ul>");
        }
        return html.append("</body></html>").toString();
    }

    private static String escapeHtml(String text) {
        if (text == null) {
            return "";
        }
        return text.replace("&", "&amp;")
                .replace("<", "&lt;")
                .replace(">", "&gt;")
                .replace("\"", "&quot;")
                .replace("'", "&#39;");
    }
}
