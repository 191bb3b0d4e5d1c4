package com.example.syncreconciler;

import com.example.syncreconciler.config.ConfigResult;

import java.util.List;
import java.util.Optional;

/**
 * Result of one start-up pass: how the config store loaded, what happened to each sync,
 * and whether updated configs were written back.
 */
public record ResumeReport(ConfigResult storeResult, List<ResumeOutcome> outcomes, ConfigResult flushResult) {
    public ResumeReport {
        outcomes = List.copyOf(outcomes);
    }

    static ResumeReport storeFailure(ConfigResult storeResult) {
        return new ResumeReport(storeResult, List.of(), ConfigResult.OK);
    }

    public boolean storeLoaded() {
        return storeResult == ConfigResult.OK || storeResult == ConfigResult.NOT_FOUND;
    }

    public Optional<ResumeOutcome> outcomeFor(long backupId) {
        return outcomes.stream().filter(outcome -> outcome.getBackupId() == backupId).findFirst();
    }

    public boolean isSuccess() {
        return storeLoaded()
                && flushResult == ConfigResult.OK
                && outcomes.stream().allMatch(outcome -> outcome.getStatus() != ResumeOutcome.Status.INCOMPLETE);
    }
}
