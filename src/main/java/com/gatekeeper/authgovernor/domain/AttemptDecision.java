package com.gatekeeper.authgovernor.domain;

/**
 * Outcome of recording an attempt.
 */
public final class AttemptDecision {

    public enum Outcome {
        ALLOWED,
        ALLOWED_WITH_WARNING,
        BLOCKED
    }

    private final Outcome outcome;
    private final int remainingAttempts;
    private final BlockInfo blockInfo;
    private final boolean newlyBlocked;

    private AttemptDecision(Outcome outcome, int remainingAttempts, BlockInfo blockInfo, boolean newlyBlocked) {
        this.outcome = outcome;
        this.remainingAttempts = remainingAttempts;
        this.blockInfo = blockInfo;
        this.newlyBlocked = newlyBlocked;
    }

    public static AttemptDecision allowed() {
        return new AttemptDecision(Outcome.ALLOWED, 0, null, false);
    }

    public static AttemptDecision allowedWithWarning(int remainingAttempts) {
        return new AttemptDecision(Outcome.ALLOWED_WITH_WARNING, remainingAttempts, null, false);
    }

    /** Rejected by a block that was already in force. */
    public static AttemptDecision blocked(BlockInfo blockInfo) {
        return new AttemptDecision(Outcome.BLOCKED, 0, blockInfo, false);
    }

    /** This attempt crossed the threshold and opened a new block. */
    public static AttemptDecision thresholdExceeded(BlockInfo blockInfo) {
        return new AttemptDecision(Outcome.BLOCKED, 0, blockInfo, true);
    }

    public Outcome getOutcome() { return outcome; }
    public int getRemainingAttempts() { return remainingAttempts; }
    public BlockInfo getBlockInfo() { return blockInfo; }
    public boolean isNewlyBlocked() { return newlyBlocked; }

    public boolean isBlocked() {
        return outcome == Outcome.BLOCKED;
    }

    @Override
    public String toString() {
        return "AttemptDecision{" +
                "outcome=" + outcome +
                ", remainingAttempts=" + remainingAttempts +
                ", blockLevel=" + (blockInfo == null ? null : blockInfo.blockLevel()) +
                '}';
    }
}
