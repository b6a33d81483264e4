package com.agentvet.validation;

/**
 * Fixed-penalty deduction from 100, floored at 0.
 */
public final class Scoring {

    public static final int MAX_SCORE = 100;
    public static final int ERROR_PENALTY = 25;
    public static final int WARNING_PENALTY = 5;

    private Scoring() {}

    public static int deduct(int errorCount, int warningCount) {
        int score = MAX_SCORE - errorCount * ERROR_PENALTY - warningCount * WARNING_PENALTY;
        return Math.max(0, Math.min(MAX_SCORE, score));
    }
}
