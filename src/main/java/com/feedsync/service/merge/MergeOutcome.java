package com.feedsync.service.merge;

/**
 * Per-call merge counts. {@code newCount + updatedCount + unchangedCount} always equals the
 * number of records handed to the merge.
 */
public record MergeOutcome(int newCount, int updatedCount, int unchangedCount) {

    public static MergeOutcome empty() {
        return new MergeOutcome(0, 0, 0);
    }

    public MergeOutcome record(MergeDecision decision) {
        return switch (decision) {
            case INSERTED -> new MergeOutcome(newCount + 1, updatedCount, unchangedCount);
            case UPDATED -> new MergeOutcome(newCount, updatedCount + 1, unchangedCount);
            case UNCHANGED -> new MergeOutcome(newCount, updatedCount, unchangedCount + 1);
        };
    }

    public MergeOutcome plus(MergeOutcome other) {
        return new MergeOutcome(newCount + other.newCount,
                updatedCount + other.updatedCount,
                unchangedCount + other.unchangedCount);
    }

    public int total() {
        return newCount + updatedCount + unchangedCount;
    }

    /**
     * True when every merged record was already stored and identical; false for an empty merge.
     */
    public boolean isAllUnchanged() {
        return unchangedCount > 0 && newCount == 0 && updatedCount == 0;
    }
}
