package inbox.triage.app.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;
import java.util.Optional;

/**
 * Validated classifier verdict. Always carries a known category and a confidence in [0,1].
 */
@Value
@Builder
public class Classification {
    public static final String FAILED_SUMMARY = "classification failed";

    Category category;
    double confidence;
    String summary;
    String reasoning;
    @Singular
    Map<String, String> details;

    public Optional<String> detail(String key) {
        String value = details.get(key);
        return value == null || value.isBlank() ? Optional.empty() : Optional.of(value);
    }

    public boolean isFallback() {
        return category == Category.MISC && confidence == 0.0 && FAILED_SUMMARY.equals(summary);
    }

    public static Classification fallback(String cause) {
        return Classification.builder()
                .category(Category.MISC)
                .confidence(0.0)
                .summary(FAILED_SUMMARY)
                .reasoning(cause != null ? cause : "unknown error")
                .build();
    }
}
