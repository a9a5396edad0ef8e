package inbox.triage.app.model;

import lombok.Value;

import java.time.Instant;

/**
 * Per-run values every component receives explicitly: the mode gating mutations and the
 * instant the run treats as "now" when computing message age.
 */
@Value
public class RunContext {
    RunMode runMode;
    Instant now;

    public boolean mutationsAllowed() {
        return runMode.allowsMutation();
    }
}
