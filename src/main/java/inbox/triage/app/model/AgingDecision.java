package inbox.triage.app.model;

import lombok.Value;

import java.util.Optional;

@Value
public class AgingDecision {
    AgingAction action;
    long daysOld;
    String warningText;

    public static AgingDecision keep(long daysOld) {
        return new AgingDecision(AgingAction.KEEP, daysOld, null);
    }

    public static AgingDecision warn(long daysOld, String warningText) {
        return new AgingDecision(AgingAction.WARN, daysOld, warningText);
    }

    public static AgingDecision archive(long daysOld) {
        return new AgingDecision(AgingAction.ARCHIVE, daysOld, null);
    }

    public Optional<String> warning() {
        return Optional.ofNullable(warningText);
    }
}
