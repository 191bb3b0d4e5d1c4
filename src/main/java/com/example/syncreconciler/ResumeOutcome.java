package com.example.syncreconciler;

public class ResumeOutcome {
    public enum Status {
        RECONCILED,
        INCOMPLETE,
        SKIPPED
    }

    private final long backupId;
    private final Status status;
    private final String reason;
    private final int assignedEntries;

    private ResumeOutcome(long backupId, Status status, String reason, int assignedEntries) {
        this.backupId = backupId;
        this.status = status;
        this.reason = reason;
        this.assignedEntries = assignedEntries;
    }

    public static ResumeOutcome success(long backupId, int assignedEntries) {
        return new ResumeOutcome(backupId, Status.RECONCILED, null, assignedEntries);
    }

    public static ResumeOutcome failure(long backupId, String reason, int assignedEntries) {
        return new ResumeOutcome(backupId, Status.INCOMPLETE, reason, assignedEntries);
    }

    public static ResumeOutcome skipped(long backupId, String reason) {
        return new ResumeOutcome(backupId, Status.SKIPPED, reason, 0);
    }

    public boolean isSuccess() {
        return status == Status.RECONCILED;
    }

    public long getBackupId() {
        return backupId;
    }

    public Status getStatus() {
        return status;
    }

    public String getReason() {
        return reason;
    }

    public int getAssignedEntries() {
        return assignedEntries;
    }

    @Override
    public String toString() {
        return "ResumeOutcome{backupId=" + backupId + ", status=" + status
                + (reason == null ? "" : ", reason=" + reason)
                + ", assignedEntries=" + assignedEntries + '}';
    }
}
