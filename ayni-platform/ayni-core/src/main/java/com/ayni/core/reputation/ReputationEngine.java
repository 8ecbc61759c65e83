package com.ayni.core.reputation;

/**
 * Saturating reputation arithmetic.
 *
 * Scores live in {@code [0, MAX_REPUTATION_SCORE]}. Positive deltas saturate at the
 * maximum, zero and negative deltas saturate at zero.
 */
public final class ReputationEngine {

    public static final int MAX_REPUTATION_SCORE = 1000;
    public static final int MIN_REPUTATION_SCORE = 0;
    public static final int INITIAL_REPUTATION_SCORE = 100;

    // Deltas applied by trust-affecting operations
    public static final int VERIFIED_DELTA = 100;
    public static final int UNVERIFIED_DELTA = -50;
    public static final int CREDENTIAL_ADDED_DELTA = 50;
    public static final int CREDENTIAL_REVOKED_DELTA = -30;

    private ReputationEngine() {}

    /**
     * Applies {@code delta} to {@code currentScore} without overflow and clamps the result.
     */
    public static int applyDelta(int currentScore, int delta) {
        long result;
        if (delta > 0) {
            result = Math.min((long) currentScore + delta, MAX_REPUTATION_SCORE);
        } else {
            result = Math.max((long) currentScore - Math.abs((long) delta), MIN_REPUTATION_SCORE);
        }
        return (int) Math.max(MIN_REPUTATION_SCORE, Math.min(result, MAX_REPUTATION_SCORE));
    }

    /**
     * Delta for a verification change.
     */
    public static int verificationDelta(boolean verified) {
        return verified ? VERIFIED_DELTA : UNVERIFIED_DELTA;
    }
}
