package inbox.triage.app.model;

import lombok.Value;

/**
 * Terminal view of a run: the final state, the finished result when the run reached DONE,
 * and the failure detail when it ended FAILED.
 */
@Value
public class RunOutcome {
    RunState state;
    RunResult result;
    String failure;

    public static RunOutcome done(RunResult result) {
        return new RunOutcome(RunState.DONE, result, null);
    }

    public static RunOutcome failed(String failure) {
        return new RunOutcome(RunState.FAILED, null, failure);
    }

    public boolean isSuccessful() {
        return state == RunState.DONE;
    }
}
